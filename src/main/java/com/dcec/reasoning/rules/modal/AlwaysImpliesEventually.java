package com.dcec.reasoning.rules.modal;

import com.dcec.formula.Formula;
import com.dcec.formula.TemporalFormula;
import com.dcec.formula.TemporalOperator;
import com.dcec.reasoning.rules.BaseInferenceRule;
import com.dcec.reasoning.rules.Derivation;
import com.dcec.reasoning.rules.DerivationContext;

import java.util.ArrayList;
import java.util.List;

/**
 * What always holds eventually holds.
 */
public class AlwaysImpliesEventually extends BaseInferenceRule {

    public AlwaysImpliesEventually() {
        super("Always Implies Eventually", 270);
    }

    @Override
    public boolean canApply(DerivationContext context) {
        return true;
    }

    @Override
    public List<Derivation> apply(DerivationContext context) {
        List<Derivation> derivations = new ArrayList<>();
        for (Formula formula : context.getFormulas()) {
            if (formula instanceof TemporalFormula
                    && ((TemporalFormula) formula).getOperator() == TemporalOperator.ALWAYS) {
                Formula inner = ((TemporalFormula) formula).getInner();
                derivations.add(derive(new TemporalFormula(TemporalOperator.EVENTUALLY, inner), formula));
            }
        }
        return derivations;
    }
}
