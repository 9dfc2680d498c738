package com.dcec.reasoning.rules;

import com.dcec.formula.ConnectiveFormula;
import com.dcec.formula.Formula;
import com.dcec.formula.LogicalConnective;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds a target disjunction once any disjunct is known.
 */
public class DisjunctionIntroduction extends BaseInferenceRule {

    public DisjunctionIntroduction() {
        super("Disjunction Introduction", 130);
    }

    @Override
    public boolean canApply(DerivationContext context) {
        return true;
    }

    @Override
    public List<Derivation> apply(DerivationContext context) {
        List<Derivation> derivations = new ArrayList<>();
        for (Formula target : context.getIntroductionTargets()) {
            if (!(target instanceof ConnectiveFormula) || !((ConnectiveFormula) target).is(LogicalConnective.OR)) {
                continue;
            }
            for (Formula disjunct : ((ConnectiveFormula) target).getOperands()) {
                if (context.contains(disjunct)) {
                    derivations.add(derive(target, disjunct));
                    break;
                }
            }
        }
        return derivations;
    }
}
