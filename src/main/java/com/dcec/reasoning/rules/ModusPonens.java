package com.dcec.reasoning.rules;

import com.dcec.formula.ConnectiveFormula;
import com.dcec.formula.LogicalConnective;

import java.util.ArrayList;
import java.util.List;

/**
 * From {@code A} and {@code A -> B} derive {@code B}.
 */
public class ModusPonens extends BaseInferenceRule {

    public ModusPonens() {
        super("Modus Ponens", 10);
    }

    @Override
    public boolean canApply(DerivationContext context) {
        return !context.getConnectives(LogicalConnective.IMPLIES).isEmpty();
    }

    @Override
    public List<Derivation> apply(DerivationContext context) {
        List<Derivation> derivations = new ArrayList<>();
        for (ConnectiveFormula implication : context.getConnectives(LogicalConnective.IMPLIES)) {
            if (isBinary(implication) && context.contains(implication.getOperand(0))) {
                derivations.add(derive(implication.getOperand(1), implication.getOperand(0), implication));
            }
        }
        return derivations;
    }
}
