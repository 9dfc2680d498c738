package com.dcec.reasoning.rules;

import com.dcec.formula.ConnectiveFormula;
import com.dcec.formula.LogicalConnective;

import java.util.ArrayList;
import java.util.List;

/**
 * From {@code A -> B} and {@code B -> C} derive {@code A -> C}. Chains that
 * would close into {@code A -> A} are skipped.
 */
public class HypotheticalSyllogism extends BaseInferenceRule {

    public HypotheticalSyllogism() {
        super("Hypothetical Syllogism", 50);
    }

    @Override
    public boolean canApply(DerivationContext context) {
        return context.getConnectives(LogicalConnective.IMPLIES).size() >= 2;
    }

    @Override
    public List<Derivation> apply(DerivationContext context) {
        List<ConnectiveFormula> implications = context.getConnectives(LogicalConnective.IMPLIES);
        List<Derivation> derivations = new ArrayList<>();
        for (ConnectiveFormula first : implications) {
            if (!isBinary(first)) {
                continue;
            }
            for (ConnectiveFormula second : implications) {
                if (first == second || !isBinary(second)) {
                    continue;
                }
                if (first.getOperand(1).equals(second.getOperand(0))
                        && !first.getOperand(0).equals(second.getOperand(1))) {
                    derivations.add(derive(ConnectiveFormula.implies(first.getOperand(0), second.getOperand(1)),
                            first, second));
                }
            }
        }
        return derivations;
    }
}
