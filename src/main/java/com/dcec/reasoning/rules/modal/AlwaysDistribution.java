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
 * What always holds of a conjunction always holds of each conjunct.
 */
public class AlwaysDistribution extends BaseInferenceRule {

    public AlwaysDistribution() {
        super("Always Distribution", 360);
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
            if (temporal.getOperator() == TemporalOperator.ALWAYS
                    && temporal.getInner() instanceof ConnectiveFormula
                    && ((ConnectiveFormula) temporal.getInner()).is(LogicalConnective.AND)) {
                for (Formula conjunct : ((ConnectiveFormula) temporal.getInner()).getOperands()) {
                    derivations.add(derive(new TemporalFormula(TemporalOperator.ALWAYS, conjunct), formula));
                }
            }
        }
        return derivations;
    }
}
