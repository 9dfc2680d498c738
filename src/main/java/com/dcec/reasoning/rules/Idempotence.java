package com.dcec.reasoning.rules;

import com.dcec.formula.ConnectiveFormula;
import com.dcec.formula.Formula;
import com.dcec.formula.LogicalConnective;

import java.util.ArrayList;
import java.util.List;

/**
 * A disjunction that repeats one formula, {@code A or A}, gives that formula.
 */
public class Idempotence extends BaseInferenceRule {

    public Idempotence() {
        super("Idempotence", 145);
    }

    @Override
    public boolean canApply(DerivationContext context) {
        return !context.getConnectives(LogicalConnective.OR).isEmpty();
    }

    @Override
    public List<Derivation> apply(DerivationContext context) {
        List<Derivation> derivations = new ArrayList<>();
        for (ConnectiveFormula disjunction : context.getConnectives(LogicalConnective.OR)) {
            List<Formula> disjuncts = disjunction.getOperands();
            if (disjuncts.size() >= 2 && disjuncts.stream().allMatch(disjuncts.get(0)::equals)) {
                derivations.add(derive(disjuncts.get(0), disjunction));
            }
        }
        return derivations;
    }
}
