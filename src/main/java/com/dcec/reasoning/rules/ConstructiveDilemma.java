package com.dcec.reasoning.rules;

import com.dcec.formula.ConnectiveFormula;
import com.dcec.formula.Formula;
import com.dcec.formula.LogicalConnective;

import java.util.ArrayList;
import java.util.List;

/**
 * From {@code A or C}, {@code A -> B} and {@code C -> D} derive {@code B or D}.
 */
public class ConstructiveDilemma extends BaseInferenceRule {

    public ConstructiveDilemma() {
        super("Constructive Dilemma", 100);
    }

    @Override
    public boolean canApply(DerivationContext context) {
        return !context.getConnectives(LogicalConnective.OR).isEmpty()
                && context.getConnectives(LogicalConnective.IMPLIES).size() >= 2;
    }

    @Override
    public List<Derivation> apply(DerivationContext context) {
        List<Derivation> derivations = new ArrayList<>();
        List<ConnectiveFormula> implications = context.getConnectives(LogicalConnective.IMPLIES);
        for (ConnectiveFormula disjunction : context.getConnectives(LogicalConnective.OR)) {
            if (!isBinary(disjunction)) {
                continue;
            }
            for (ConnectiveFormula leftCase : implicationsFrom(disjunction.getOperand(0), implications)) {
                for (ConnectiveFormula rightCase : implicationsFrom(disjunction.getOperand(1), implications)) {
                    Formula left = leftCase.getOperand(1);
                    Formula right = rightCase.getOperand(1);
                    Formula conclusion = left.equals(right) ? left : ConnectiveFormula.or(left, right);
                    derivations.add(derive(conclusion, disjunction, leftCase, rightCase));
                }
            }
        }
        return derivations;
    }

    private static List<ConnectiveFormula> implicationsFrom(Formula antecedent, List<ConnectiveFormula> implications) {
        List<ConnectiveFormula> matching = new ArrayList<>();
        for (ConnectiveFormula implication : implications) {
            if (isBinary(implication) && implication.getOperand(0).equals(antecedent)) {
                matching.add(implication);
            }
        }
        return matching;
    }
}
