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
 * An agent that intends {@code P} and believes {@code P -> Q} intends {@code Q}.
 */
public class IntentionCommitment extends BaseInferenceRule {

    public IntentionCommitment() {
        super("Intention Commitment", 310);
    }

    @Override
    public boolean canApply(DerivationContext context) {
        return true;
    }

    @Override
    public List<Derivation> apply(DerivationContext context) {
        List<Derivation> derivations = new ArrayList<>();
        for (Formula formula : context.getFormulas()) {
            ConnectiveFormula implication = believedImplication(formula);
            if (implication == null) {
                continue;
            }
            CognitiveFormula belief = (CognitiveFormula) formula;
            Formula intention = new CognitiveFormula(CognitiveOperator.INTENTION, belief.getAgent(),
                    implication.getOperand(0));
            if (context.contains(intention)) {
                derivations.add(derive(new CognitiveFormula(CognitiveOperator.INTENTION, belief.getAgent(),
                        implication.getOperand(1)), intention, formula));
            }
        }
        return derivations;
    }

    /**
     * The binary implication inside {@code believes(a, P -> Q)}, or null for any other formula.
     */
    static ConnectiveFormula believedImplication(Formula formula) {
        if (!(formula instanceof CognitiveFormula)
                || ((CognitiveFormula) formula).getOperator() != CognitiveOperator.BELIEF
                || !(((CognitiveFormula) formula).getInner() instanceof ConnectiveFormula)) {
            return null;
        }
        ConnectiveFormula inner = (ConnectiveFormula) ((CognitiveFormula) formula).getInner();
        return inner.is(LogicalConnective.IMPLIES) && isBinary(inner) ? inner : null;
    }
}
