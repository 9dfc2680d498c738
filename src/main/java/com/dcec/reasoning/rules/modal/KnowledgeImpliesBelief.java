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
 * An agent believes what it knows: {@code knows(a, X)} gives {@code believes(a, X)}.
 */
public class KnowledgeImpliesBelief extends BaseInferenceRule {

    public KnowledgeImpliesBelief() {
        super("Knowledge Implies Belief", 210);
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
                    && ((CognitiveFormula) formula).getOperator() == CognitiveOperator.KNOWLEDGE) {
                CognitiveFormula knowledge = (CognitiveFormula) formula;
                derivations.add(derive(new CognitiveFormula(CognitiveOperator.BELIEF, knowledge.getAgent(),
                        knowledge.getInner()), formula));
            }
        }
        return derivations;
    }
}
