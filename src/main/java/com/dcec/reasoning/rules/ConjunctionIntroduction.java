package com.dcec.reasoning.rules;

import com.dcec.formula.ConnectiveFormula;
import com.dcec.formula.Formula;
import com.dcec.formula.LogicalConnective;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds a target conjunction once every conjunct is known.
 */
public class ConjunctionIntroduction extends BaseInferenceRule {

    public ConjunctionIntroduction() {
        super("Conjunction Introduction", 120);
    }

    @Override
    public boolean canApply(DerivationContext context) {
        return true;
    }

    @Override
    public List<Derivation> apply(DerivationContext context) {
        List<Derivation> derivations = new ArrayList<>();
        for (Formula target : context.getIntroductionTargets()) {
            if (!(target instanceof ConnectiveFormula) || !((ConnectiveFormula) target).is(LogicalConnective.AND)) {
                continue;
            }
            List<Formula> conjuncts = ((ConnectiveFormula) target).getOperands();
            if (!conjuncts.isEmpty() && conjuncts.stream().allMatch(context::contains)) {
                derivations.add(new Derivation(target, conjuncts));
            }
        }
        return derivations;
    }
}
