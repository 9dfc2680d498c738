package com.dcec.formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of {@link FormulaValidator#validate(Formula)}.
 */
public class ValidationResult {
    private final List<String> errors;

    public ValidationResult(List<String> errors) {
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
    }

    public static ValidationResult ok() {
        return new ValidationResult(Collections.emptyList());
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<String> getErrors() {
        return errors;
    }

    @Override
    public String toString() {
        return isValid() ? "ValidationResult{valid}" : "ValidationResult{errors=" + errors + '}';
    }
}
