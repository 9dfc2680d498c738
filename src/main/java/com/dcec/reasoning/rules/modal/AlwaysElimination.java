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
 * What always holds, holds now.
 */
public class AlwaysElimination extends BaseInferenceRule {

    public AlwaysElimination() {
        super("Always Elimination", 260);
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
                derivations.add(derive(((TemporalFormula) formula).getInner(), formula));
            }
        }
        return derivations;
    }
}
