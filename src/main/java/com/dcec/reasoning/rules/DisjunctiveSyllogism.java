package com.dcec.reasoning.rules;

import com.dcec.formula.ConnectiveFormula;
import com.dcec.formula.Formula;
import com.dcec.formula.LogicalConnective;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * From a disjunction and the complement of one disjunct derive the remaining disjuncts.
 */
public class DisjunctiveSyllogism extends BaseInferenceRule {

    public DisjunctiveSyllogism() {
        super("Disjunctive Syllogism", 40);
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
            if (disjuncts.size() < 2) {
                continue;
            }
            for (int i = 0; i < disjuncts.size(); i++) {
                Optional<Formula> denial = knownComplement(disjuncts.get(i), context);
                if (denial.isEmpty()) {
                    continue;
                }
                List<Formula> remaining = new ArrayList<>(disjuncts);
                remaining.remove(i);
                Formula conclusion = remaining.size() == 1
                        ? remaining.get(0)
                        : new ConnectiveFormula(LogicalConnective.OR, remaining);
                derivations.add(derive(conclusion, disjunction, denial.get()));
            }
        }
        return derivations;
    }
}
