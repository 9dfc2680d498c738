package com.dcec.reasoning.rules.modal;

import com.dcec.formula.DeonticFormula;
import com.dcec.formula.DeonticOperator;
import com.dcec.formula.Formula;
import com.dcec.reasoning.rules.BaseInferenceRule;
import com.dcec.reasoning.rules.Derivation;
import com.dcec.reasoning.rules.DerivationContext;

import java.util.ArrayList;
import java.util.List;

/**
 * What is obligatory is permissible.
 */
public class ObligationImpliesPermission extends BaseInferenceRule {

    public ObligationImpliesPermission() {
        super("Obligation Implies Permission", 240);
    }

    @Override
    public boolean canApply(DerivationContext context) {
        return true;
    }

    @Override
    public List<Derivation> apply(DerivationContext context) {
        List<Derivation> derivations = new ArrayList<>();
        for (Formula formula : context.getFormulas()) {
            if (formula instanceof DeonticFormula
                    && ((DeonticFormula) formula).getOperator() == DeonticOperator.OBLIGATORY) {
                derivations.add(derive(new DeonticFormula(DeonticOperator.PERMISSIBLE,
                        ((DeonticFormula) formula).getInner()), formula));
            }
        }
        return derivations;
    }
}
