package com.dcec.reasoning.rules.modal;

import com.dcec.formula.CognitiveFormula;
import com.dcec.formula.CognitiveOperator;
import com.dcec.formula.ConnectiveFormula;
import com.dcec.formula.Formula;
import com.dcec.reasoning.rules.BaseInferenceRule;
import com.dcec.reasoning.rules.Derivation;
import com.dcec.reasoning.rules.DerivationContext;

import java.util.ArrayList;
import java.util.List;

/**
 * An agent does not intend {@code P} when it believes {@code P -> Q} and
 * believes {@code not(Q)}.
 */
public class IntentionSideEffect extends BaseInferenceRule {

    public IntentionSideEffect() {
        super("Intention Side Effect", 320);
    }

    @Override
    public boolean canApply(DerivationContext context) {
        return true;
    }

    @Override
    public List<Derivation> apply(DerivationContext context) {
        List<Derivation> derivations = new ArrayList<>();
        for (Formula formula : context.getFormulas()) {
            ConnectiveFormula implication = IntentionCommitment.believedImplication(formula);
            if (implication == null) {
                continue;
            }
            CognitiveFormula belief = (CognitiveFormula) formula;
            Formula intention = new CognitiveFormula(CognitiveOperator.INTENTION, belief.getAgent(),
                    implication.getOperand(0));
            Formula disbelief = new CognitiveFormula(CognitiveOperator.BELIEF, belief.getAgent(),
                    ConnectiveFormula.not(implication.getOperand(1)));
            if (context.contains(intention) && context.contains(disbelief)) {
                derivations.add(derive(ConnectiveFormula.not(intention), intention, formula, disbelief));
            }
        }
        return derivations;
    }
}
