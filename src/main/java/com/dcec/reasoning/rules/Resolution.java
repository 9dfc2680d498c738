package com.dcec.reasoning.rules;

import com.dcec.formula.ConnectiveFormula;
import com.dcec.formula.Formula;
import com.dcec.formula.LogicalConnective;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Propositional resolution over disjunctions. Two clauses with a
 * complementary pair of literals give the disjunction of their remaining
 * literals. A resolvent is kept only when it is no longer than the larger
 * parent clause and is not a tautology, so repeated passes cannot grow
 * clauses without bound.
 */
public class Resolution extends BaseInferenceRule {

    public Resolution() {
        super("Resolution", 90);
    }

    @Override
    public boolean canApply(DerivationContext context) {
        return !context.getConnectives(LogicalConnective.OR).isEmpty();
    }

    @Override
    public List<Derivation> apply(DerivationContext context) {
        List<ConnectiveFormula> clauses = context.getConnectives(LogicalConnective.OR);
        List<Derivation> derivations = new ArrayList<>();
        for (int i = 0; i < clauses.size(); i++) {
            for (int j = i + 1; j < clauses.size(); j++) {
                resolve(clauses.get(i), clauses.get(j), derivations);
            }
        }
        return derivations;
    }

    private void resolve(ConnectiveFormula left, ConnectiveFormula right, List<Derivation> derivations) {
        List<Formula> leftLiterals = left.getOperands();
        List<Formula> rightLiterals = right.getOperands();
        int limit = Math.max(leftLiterals.size(), rightLiterals.size());
        for (Formula literal : leftLiterals) {
            Formula clash = complement(literal);
            if (!rightLiterals.contains(clash)) {
                continue;
            }
            Set<Formula> resolvent = new LinkedHashSet<>();
            for (Formula candidate : leftLiterals) {
                if (!candidate.equals(literal)) {
                    resolvent.add(candidate);
                }
            }
            for (Formula candidate : rightLiterals) {
                if (!candidate.equals(clash)) {
                    resolvent.add(candidate);
                }
            }
            if (resolvent.isEmpty() || resolvent.size() > limit || isTautology(resolvent)) {
                continue;
            }
            List<Formula> literals = new ArrayList<>(resolvent);
            Formula conclusion = literals.size() == 1
                    ? literals.get(0)
                    : new ConnectiveFormula(LogicalConnective.OR, literals);
            derivations.add(derive(conclusion, left, right));
        }
    }

    private static boolean isTautology(Set<Formula> literals) {
        for (Formula literal : literals) {
            if (isNegation(literal) && literals.contains(negated(literal))) {
                return true;
            }
        }
        return false;
    }
}
