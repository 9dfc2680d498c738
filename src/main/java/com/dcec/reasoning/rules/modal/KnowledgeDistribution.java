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
 * Knowledge distributes over conjunction: {@code knows(a, (X and Y))} gives {@code knows(a, X)} and {@code knows(a, Y)}.
 */
public class KnowledgeDistribution extends BaseInferenceRule {

    public KnowledgeDistribution() {
        super("Knowledge Distribution", 300);
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
            CognitiveFormula knowledge = (CognitiveFormula) formula;
            if (knowledge.getOperator() == CognitiveOperator.KNOWLEDGE
                    && knowledge.getInner() instanceof ConnectiveFormula
                    && ((ConnectiveFormula) knowledge.getInner()).is(LogicalConnective.AND)) {
                for (Formula conjunct : ((ConnectiveFormula) knowledge.getInner()).getOperands()) {
                    derivations.add(derive(new CognitiveFormula(CognitiveOperator.KNOWLEDGE, knowledge.getAgent(),
                            conjunct), formula));
                }
            }
        }
        return derivations;
    }
}
