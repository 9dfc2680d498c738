package com.dcec.reasoning.rules;

import com.dcec.formula.ConnectiveFormula;
import com.dcec.formula.Formula;
import com.dcec.formula.LogicalConnective;

import java.util.ArrayList;
import java.util.List;

/**
 * From {@code A -> B}, {@code C -> D} and {@code not(B) or not(D)} derive
 * {@code not(A) or not(C)}.
 */
public class DestructiveDilemma extends BaseInferenceRule {

    public DestructiveDilemma() {
        super("Destructive Dilemma", 170);
    }

    @Override
    public boolean canApply(DerivationContext context) {
        return context.getConnectives(LogicalConnective.IMPLIES).size() >= 2
                && !context.getConnectives(LogicalConnective.OR).isEmpty();
    }

    @Override
    public List<Derivation> apply(DerivationContext context) {
        List<ConnectiveFormula> implications = context.getConnectives(LogicalConnective.IMPLIES);
        List<Derivation> derivations = new ArrayList<>();
        for (ConnectiveFormula disjunction : context.getConnectives(LogicalConnective.OR)) {
            if (!isBinary(disjunction)) {
                continue;
            }
            for (ConnectiveFormula first : implications) {
                if (!isBinary(first) || !disjunction.getOperand(0).equals(complement(first.getOperand(1)))) {
                    continue;
                }
                for (ConnectiveFormula second : implications) {
                    if (first != second && isBinary(second)
                            && disjunction.getOperand(1).equals(complement(second.getOperand(1)))) {
                        derivations.add(derive(ConnectiveFormula.or(complement(first.getOperand(0)),
                                complement(second.getOperand(0))), first, second, disjunction));
                    }
                }
            }
        }
        return derivations;
    }
}
