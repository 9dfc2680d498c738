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
 * What an agent knows holds: {@code knows(a, X)} gives {@code X}.
 */
public class KnowledgeImpliesTruth extends BaseInferenceRule {

    public KnowledgeImpliesTruth() {
        super("Knowledge Implies Truth", 200);
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
                derivations.add(derive(((CognitiveFormula) formula).getInner(), formula));
            }
        }
        return derivations;
    }
}
