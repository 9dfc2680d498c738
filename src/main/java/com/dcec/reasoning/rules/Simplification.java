package com.dcec.reasoning.rules;

import com.dcec.formula.ConnectiveFormula;
import com.dcec.formula.Formula;
import com.dcec.formula.LogicalConnective;

import java.util.ArrayList;
import java.util.List;

/**
 * From a conjunction derive each of its conjuncts.
 */
public class Simplification extends BaseInferenceRule {

    public Simplification() {
        super("Simplification", 20);
    }

    @Override
    public boolean canApply(DerivationContext context) {
        return !context.getConnectives(LogicalConnective.AND).isEmpty();
    }

    @Override
    public List<Derivation> apply(DerivationContext context) {
        List<Derivation> derivations = new ArrayList<>();
        for (ConnectiveFormula conjunction : context.getConnectives(LogicalConnective.AND)) {
            for (Formula conjunct : conjunction.getOperands()) {
                derivations.add(derive(conjunct, conjunction));
            }
        }
        return derivations;
    }
}
