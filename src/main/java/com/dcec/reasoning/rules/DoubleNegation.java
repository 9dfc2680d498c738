package com.dcec.reasoning.rules;

import com.dcec.formula.ConnectiveFormula;
import com.dcec.formula.Formula;
import com.dcec.formula.LogicalConnective;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes a double negation, {@code not(not(A))} to {@code A}. Introduces one
 * only where the result is an introduction target.
 */
public class DoubleNegation extends BaseInferenceRule {

    public DoubleNegation() {
        super("Double Negation", 70);
    }

    @Override
    public boolean canApply(DerivationContext context) {
        return !context.getConnectives(LogicalConnective.NOT).isEmpty() || isNegation(context.getGoal());
    }

    @Override
    public List<Derivation> apply(DerivationContext context) {
        List<Derivation> derivations = new ArrayList<>();
        for (ConnectiveFormula negation : context.getConnectives(LogicalConnective.NOT)) {
            if (isNegation(negation) && isNegation(negated(negation))) {
                derivations.add(derive(negated(negated(negation)), negation));
            }
        }
        for (Formula target : context.getIntroductionTargets()) {
            if (isNegation(target) && isNegation(negated(target))) {
                Formula inner = negated(negated(target));
                if (context.contains(inner)) {
                    derivations.add(derive(target, inner));
                }
            }
        }
        return derivations;
    }
}
