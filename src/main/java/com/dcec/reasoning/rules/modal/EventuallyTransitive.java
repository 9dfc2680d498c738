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
 * {@code eventually(eventually(A))} gives {@code eventually(A)}.
 */
public class EventuallyTransitive extends BaseInferenceRule {

    public EventuallyTransitive() {
        super("Eventually Transitive", 390);
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
                    && ((TemporalFormula) formula).getOperator() == TemporalOperator.EVENTUALLY
                    && ((TemporalFormula) formula).getInner() instanceof TemporalFormula
                    && ((TemporalFormula) ((TemporalFormula) formula).getInner()).getOperator() == TemporalOperator.EVENTUALLY) {
                derivations.add(derive(((TemporalFormula) formula).getInner(), formula));
            }
        }
        return derivations;
    }
}
