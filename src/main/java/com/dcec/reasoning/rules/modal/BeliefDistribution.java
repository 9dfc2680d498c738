package com.dcec.reasoning.rules.modal;

import com.dcec.formula.CognitiveFormula;
import com.dcec.formula.CognitiveOperator;
import com.dcec.formula.ConnectiveFormula;
import com.dcec.formula.Formula;
import com.dcec.formula.LogicalConnective;
import com.dcec.reasoning.rules.BaseInferenceRule;
import com.dcec.reasoning.rules.Derivation;
import com.dcec.reasoning.rules.DerivationContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Belief distributes over conjunction: {@code believes(a, (X and Y))} gives {@code believes(a, X)} and {@code believes(a, Y)}.
 */
public class BeliefDistribution extends BaseInferenceRule {

    public BeliefDistribution() {
        super("Belief Distribution", 220);
    }

    @Override
    public boolean canApply(DerivationContext context) {
        return true;
    }

    @Override
    public List<Derivation> apply(DerivationContext context) {
        List<Derivation> derivations = new ArrayList<>();
        for (Formula formula : context.getFormulas()) {
            if (!(formula instanceof CognitiveFormula)) {
                continue;
            }
            CognitiveFormula belief = (CognitiveFormula) formula;
            if (belief.getOperator() != CognitiveOperator.BELIEF || !(belief.getInner() instanceof ConnectiveFormula)) {
                continue;
            }
            ConnectiveFormula inner = (ConnectiveFormula) belief.getInner();
            if (inner.is(LogicalConnective.AND)) {
                for (Formula conjunct : inner.getOperands()) {
                    derivations.add(derive(new CognitiveFormula(CognitiveOperator.BELIEF, belief.getAgent(), conjunct),
                            formula));
                }
            }
        }
        return derivations;
    }
}
