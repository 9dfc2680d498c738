package com.dcec.reasoning.rules.modal;

import com.dcec.formula.ConnectiveFormula;
import com.dcec.formula.DeonticFormula;
import com.dcec.formula.DeonticOperator;
import com.dcec.formula.Formula;
import com.dcec.formula.LogicalConnective;
import com.dcec.reasoning.rules.BaseInferenceRule;
import com.dcec.reasoning.rules.Derivation;
import com.dcec.reasoning.rules.DerivationContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Obligation distributes over conjunction: {@code obligatory((X and Y))} gives {@code obligatory(X)} and {@code obligatory(Y)}.
 */
public class ObligationDistribution extends BaseInferenceRule {

    public ObligationDistribution() {
        super("Obligation Distribution", 230);
    }

    @Override
    public boolean canApply(DerivationContext context) {
        return true;
    }

    @Override
    public List<Derivation> apply(DerivationContext context) {
        List<Derivation> derivations = new ArrayList<>();
        for (Formula formula : context.getFormulas()) {
            if (!(formula instanceof DeonticFormula)) {
                continue;
            }
            DeonticFormula obligation = (DeonticFormula) formula;
            if (obligation.getOperator() == DeonticOperator.OBLIGATORY
                    && obligation.getInner() instanceof ConnectiveFormula
                    && ((ConnectiveFormula) obligation.getInner()).is(LogicalConnective.AND)) {
                for (Formula conjunct : ((ConnectiveFormula) obligation.getInner()).getOperands()) {
                    derivations.add(derive(new DeonticFormula(DeonticOperator.OBLIGATORY, conjunct), formula));
                }
            }
        }
        return derivations;
    }
}
