package com.dcec.reasoning.rules;

import com.dcec.formula.Formula;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Anything follows from a contradiction. Once some formula and its negation
 * are both known the goal is derived from the pair.
 */
public class ContradictionElimination extends BaseInferenceRule {

    public ContradictionElimination() {
        super("Contradiction Elimination", 180);
    }

    @Override
    public boolean canApply(DerivationContext context) {
        return context.getGoal() != null && !context.contains(context.getGoal());
    }

    @Override
    public List<Derivation> apply(DerivationContext context) {
        for (Formula formula : context.getFormulas()) {
            if (isNegation(formula)) {
                continue;
            }
            Optional<Formula> negation = knownComplement(formula, context);
            if (negation.isPresent()) {
                LOGGER.debug("Contradiction between {} and {}", formula.render(), negation.get().render());
                return Collections.singletonList(derive(context.getGoal(), formula, negation.get()));
            }
        }
        return Collections.emptyList();
    }
}
