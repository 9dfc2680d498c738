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
 * From {@code eventually(A)} and {@code always(A -> B)} derive {@code eventually(B)}.
 */
public class EventuallyImplication extends BaseInferenceRule {

    public EventuallyImplication() {
        super("Eventually Implication", 420);
    }

    @Override
    public boolean canApply(DerivationContext context) {
        return true;
    }

    @Override
    public List<Derivation> apply(DerivationContext context) {
        List<Derivation> derivations = new ArrayList<>();
        for (Formula formula : context.getFormulas()) {
            if (!(formula instanceof TemporalFormula)
                    || ((TemporalFormula) formula).getOperator() != TemporalOperator.ALWAYS
                    || !(((TemporalFormula) formula).getInner() instanceof ConnectiveFormula)) {
                continue;
            }
            ConnectiveFormula implication = (ConnectiveFormula) ((TemporalFormula) formula).getInner();
            if (!implication.is(LogicalConnective.IMPLIES) || !isBinary(implication)) {
                continue;
            }
            Formula premise = new TemporalFormula(TemporalOperator.EVENTUALLY, implication.getOperand(0));
            if (context.contains(premise)) {
                derivations.add(derive(new TemporalFormula(TemporalOperator.EVENTUALLY, implication.getOperand(1)),
                        premise, formula));
            }
        }
        return derivations;
    }
}
