package com.dcec.reasoning;

import com.dcec.formula.Formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One numbered line of a proof trail. Premises refer to earlier step numbers.
 */
public class ProofStep {
    public static final String AXIOM = "Axiom";

    private final int stepNumber;
    private final Formula formula;
    private final String ruleName;
    private final String justification;
    private final List<Integer> premises;

    public ProofStep(int stepNumber, Formula formula, String ruleName, String justification, List<Integer> premises) {
        this.stepNumber = stepNumber;
        this.formula = Objects.requireNonNull(formula, "formula");
        this.ruleName = ruleName;
        this.justification = justification;
        this.premises = Collections.unmodifiableList(new ArrayList<>(premises));
    }

    public int getStepNumber() { return stepNumber; }
    public Formula getFormula() { return formula; }
    public String getRuleName() { return ruleName; }
    public String getJustification() { return justification; }
    public List<Integer> getPremises() { return premises; }

    public boolean isAxiom() {
        return AXIOM.equals(ruleName);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProofStep that = (ProofStep) o;
        return stepNumber == that.stepNumber &&
                formula.equals(that.formula) &&
                Objects.equals(ruleName, that.ruleName) &&
                premises.equals(that.premises);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stepNumber, formula, ruleName, premises);
    }

    @Override
    public String toString() {
        return stepNumber + ". " + formula.render() + " [" + justification + "]";
    }
}
