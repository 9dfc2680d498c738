package com.dcec.reasoning.rules.modal;

import com.dcec.formula.ConnectiveFormula;
import com.dcec.formula.DeonticFormula;
import com.dcec.formula.DeonticOperator;
import com.dcec.formula.Formula;
import com.dcec.reasoning.rules.BaseInferenceRule;
import com.dcec.reasoning.rules.Derivation;
import com.dcec.reasoning.rules.DerivationContext;

import java.util.ArrayList;
import java.util.List;

/**
 * What is forbidden is not obligatory.
 */
public class ForbiddenToNotObligatory extends BaseInferenceRule {

    public ForbiddenToNotObligatory() {
        super("Forbidden To Not Obligatory", 330);
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
                    && ((DeonticFormula) formula).getOperator() == DeonticOperator.FORBIDDEN) {
                derivations.add(derive(ConnectiveFormula.not(new DeonticFormula(DeonticOperator.OBLIGATORY,
                        ((DeonticFormula) formula).getInner())), formula));
            }
        }
        return derivations;
    }
}
