package com.dcec.reasoning.rules;

import com.dcec.formula.ConnectiveFormula;
import com.dcec.formula.Formula;
import com.dcec.formula.LogicalConnective;

import java.util.ArrayList;
import java.util.List;

/**
 * Pushes a negation through a conjunction or disjunction:
 * {@code not(A and B)} gives {@code (not(A) or not(B))} and
 * {@code not(A or B)} gives {@code (not(A) and not(B))}.
 */
public class DeMorgan extends BaseInferenceRule {

    public DeMorgan() {
        super("De Morgan", 80);
    }

    @Override
    public boolean canApply(DerivationContext context) {
        return !context.getConnectives(LogicalConnective.NOT).isEmpty();
    }

    @Override
    public List<Derivation> apply(DerivationContext context) {
        List<Derivation> derivations = new ArrayList<>();
        for (ConnectiveFormula negation : context.getConnectives(LogicalConnective.NOT)) {
            if (!isNegation(negation) || !(negated(negation) instanceof ConnectiveFormula)) {
                continue;
            }
            ConnectiveFormula inner = (ConnectiveFormula) negated(negation);
            LogicalConnective dual;
            if (inner.is(LogicalConnective.AND)) {
                dual = LogicalConnective.OR;
            } else if (inner.is(LogicalConnective.OR)) {
                dual = LogicalConnective.AND;
            } else {
                continue;
            }
            List<Formula> negatedOperands = new ArrayList<>(inner.getOperands().size());
            for (Formula operand : inner.getOperands()) {
                negatedOperands.add(ConnectiveFormula.not(operand));
            }
            derivations.add(derive(new ConnectiveFormula(dual, negatedOperands), negation));
        }
        return derivations;
    }
}
