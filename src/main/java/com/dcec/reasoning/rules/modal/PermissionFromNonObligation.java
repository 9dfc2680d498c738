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
 * Whatever is not obligatory to refrain from is permissible:
 * {@code not(obligatory(not(A)))} gives {@code permissible(A)}.
 */
public class PermissionFromNonObligation extends BaseInferenceRule {

    public PermissionFromNonObligation() {
        super("Permission From Non Obligation", 350);
    }

    @Override
    public boolean canApply(DerivationContext context) {
        return true;
    }

    @Override
    public List<Derivation> apply(DerivationContext context) {
        List<Derivation> derivations = new ArrayList<>();
        for (Formula formula : context.getFormulas()) {
            if (!isNegation(formula) || !(negated(formula) instanceof DeonticFormula)) {
                continue;
            }
            DeonticFormula obligation = (DeonticFormula) negated(formula);
            if (obligation.getOperator() == DeonticOperator.OBLIGATORY && isNegation(obligation.getInner())) {
                derivations.add(derive(new DeonticFormula(DeonticOperator.PERMISSIBLE, negated(obligation.getInner())),
                        formula));
            }
        }
        return derivations;
    }
}
