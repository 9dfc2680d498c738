package com.dcec.reasoning.rules.modal;

import com.dcec.formula.ConnectiveFormula;
import com.dcec.formula.Formula;
import com.dcec.formula.LogicalConnective;
import com.dcec.formula.TemporalFormula;
import com.dcec.formula.TemporalOperator;
import com.dcec.reasoning.rules.BaseInferenceRule;
import com.dcec.reasoning.rules.Derivation;
import com.dcec.reasoning.rules.DerivationContext;

import java.util.ArrayList;
import java.util.List;

/**
 * A conjunction that holds next gives each conjunct next.
 */
public class NextDistribution extends BaseInferenceRule {

    public NextDistribution() {
        super("Next Distribution", 400);
    }

    @Override
    public boolean canApply(DerivationContext context) {
        return true;
    }

    @Override
    public List<Derivation> apply(DerivationContext context) {
        List<Derivation> derivations = new ArrayList<>();
        for (Formula formula : context.getFormulas()) {
            if (!(formula instanceof TemporalFormula)) {
                continue;
            }
            TemporalFormula temporal = (TemporalFormula) formula;
            if (temporal.getOperator() == TemporalOperator.NEXT
                    && temporal.getInner() instanceof ConnectiveFormula
                    && ((ConnectiveFormula) temporal.getInner()).is(LogicalConnective.AND)) {
                for (Formula conjunct : ((ConnectiveFormula) temporal.getInner()).getOperands()) {
                    derivations.add(derive(new TemporalFormula(TemporalOperator.NEXT, conjunct), formula));
                }
            }
        }
        return derivations;
    }
}
