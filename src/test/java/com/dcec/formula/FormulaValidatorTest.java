package com.dcec.formula;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;

class FormulaValidatorTest {

    private final FormulaValidator validator = new FormulaValidator();

    private final Formula p = AtomicFormula.proposition("P");
    private final Formula q = AtomicFormula.proposition("Q");

    @Test
    @DisplayName("well-formed formulas should pass")
    void validFormula() {
        ValidationResult result = validator.validate(ConnectiveFormula.implies(ConnectiveFormula.and(p, q),
                ConnectiveFormula.not(p)));

        assertThat(result.isValid()).isTrue();
        assertThat(result.getErrors()).isEmpty();
    }

    @Test
    @DisplayName("and with one operand should report the minimum")
    void andTooFew() {
        ValidationResult result = validator.validate(ConnectiveFormula.and(p));

        assertThat(result.isValid()).isFalse();
        assertThat(result.getErrors()).containsExactly("AND requires at least 2 operands, found 1 in (P)");
    }

    @Test
    @DisplayName("not with two operands should report the exact count")
    void notTooMany() {
        ValidationResult result = validator.validate(new ConnectiveFormula(LogicalConnective.NOT, Arrays.asList(p, q)));

        assertThat(result.getErrors()).containsExactly("NOT requires exactly 1 operand(s), found 2 in not(P, Q)");
    }

    @Test
    @DisplayName("should find errors nested under other operators")
    void nestedErrors() {
        Formula badImplies = new ConnectiveFormula(LogicalConnective.IMPLIES, Collections.singletonList(q));
        Formula formula = new DeonticFormula(DeonticOperator.OBLIGATORY,
                ConnectiveFormula.and(p, new ConnectiveFormula(LogicalConnective.OR, Collections.singletonList(q)),
                        badImplies));

        ValidationResult result = validator.validate(formula);

        assertThat(result.getErrors()).hasSize(2);
        assertThat(result.getErrors().get(0)).startsWith("OR requires at least 2 operands");
        assertThat(result.getErrors().get(1)).startsWith("IMPLIES requires exactly 2 operand(s), found 1");
    }
}
