package com.dcec.reasoning.rules.modal;

import com.dcec.formula.CognitiveFormula;
import com.dcec.formula.CognitiveOperator;
import com.dcec.formula.Formula;
import com.dcec.reasoning.rules.BaseInferenceRule;
import com.dcec.reasoning.rules.Derivation;
import com.dcec.reasoning.rules.DerivationContext;

import java.util.ArrayList;
import java.util.List;

/**
 * What an agent perceives, it knows.
 */
public class PerceptionImpliesKnowledge extends BaseInferenceRule {

    public PerceptionImpliesKnowledge() {
        super("Perception Implies Knowledge", 290);
    }

    @Override
    public boolean canApply(DerivationContext context) {
        return true;
    }

    @Override
    public List<Derivation> apply(DerivationContext context) {
        List<Derivation> derivations = new ArrayList<>();
        for (Formula formula : context.getFormulas()) {
            if (formula instanceof CognitiveFormula
                    && ((CognitiveFormula) formula).getOperator() == CognitiveOperator.PERCEPTION) {
                CognitiveFormula perception = (CognitiveFormula) formula;
                derivations.add(derive(new CognitiveFormula(CognitiveOperator.KNOWLEDGE, perception.getAgent(),
                        perception.getInner()), formula));
            }
        }
        return derivations;
    }
}
