package com.dcec.reasoning.rules;

import com.dcec.formula.ConnectiveFormula;
import com.dcec.formula.LogicalConnective;

import java.util.ArrayList;
import java.util.List;

/**
 * From {@code A <-> B} derive {@code A -> B} and {@code B -> A}.
 */
public class BiconditionalElimination extends BaseInferenceRule {

    public BiconditionalElimination() {
        super("Biconditional Elimination", 60);
    }

    @Override
    public boolean canApply(DerivationContext context) {
        return !context.getConnectives(LogicalConnective.IFF).isEmpty();
    }

    @Override
    public List<Derivation> apply(DerivationContext context) {
        List<Derivation> derivations = new ArrayList<>();
        for (ConnectiveFormula biconditional : context.getConnectives(LogicalConnective.IFF)) {
            if (!isBinary(biconditional)) {
                continue;
            }
            derivations.add(derive(ConnectiveFormula.implies(biconditional.getOperand(0), biconditional.getOperand(1)),
                    biconditional));
            derivations.add(derive(ConnectiveFormula.implies(biconditional.getOperand(1), biconditional.getOperand(0)),
                    biconditional));
        }
        return derivations;
    }
}
