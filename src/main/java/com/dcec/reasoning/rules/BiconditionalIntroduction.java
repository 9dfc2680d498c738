package com.dcec.reasoning.rules;

import com.dcec.formula.ConnectiveFormula;
import com.dcec.formula.LogicalConnective;

import java.util.ArrayList;
import java.util.List;

/**
 * From {@code A -> B} and {@code B -> A} derive {@code A <-> B}, with the
 * sides in the order of the earlier implication.
 */
public class BiconditionalIntroduction extends BaseInferenceRule {

    public BiconditionalIntroduction() {
        super("Biconditional Introduction", 110);
    }

    @Override
    public boolean canApply(DerivationContext context) {
        return context.getConnectives(LogicalConnective.IMPLIES).size() >= 2;
    }

    @Override
    public List<Derivation> apply(DerivationContext context) {
        List<ConnectiveFormula> implications = context.getConnectives(LogicalConnective.IMPLIES);
        List<Derivation> derivations = new ArrayList<>();
        for (int i = 0; i < implications.size(); i++) {
            ConnectiveFormula forward = implications.get(i);
            if (!isBinary(forward)) {
                continue;
            }
            for (int j = i + 1; j < implications.size(); j++) {
                ConnectiveFormula backward = implications.get(j);
                if (isBinary(backward)
                        && forward.getOperand(0).equals(backward.getOperand(1))
                        && forward.getOperand(1).equals(backward.getOperand(0))) {
                    derivations.add(derive(ConnectiveFormula.iff(forward.getOperand(0), forward.getOperand(1)),
                            forward, backward));
                }
            }
        }
        return derivations;
    }
}
