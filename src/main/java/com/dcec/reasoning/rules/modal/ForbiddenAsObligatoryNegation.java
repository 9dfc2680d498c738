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
 * A forbidden formula is one whose negation is obligatory.
 */
public class ForbiddenAsObligatoryNegation extends BaseInferenceRule {

    public ForbiddenAsObligatoryNegation() {
        super("Forbidden As Obligatory Negation", 250);
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
                Formula inner = ((DeonticFormula) formula).getInner();
                derivations.add(derive(new DeonticFormula(DeonticOperator.OBLIGATORY, ConnectiveFormula.not(inner)),
                        formula));
            }
        }
        return derivations;
    }
}
