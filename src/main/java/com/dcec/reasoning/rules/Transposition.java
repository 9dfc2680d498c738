package com.dcec.reasoning.rules;

import com.dcec.formula.ConnectiveFormula;
import com.dcec.formula.Formula;
import com.dcec.formula.LogicalConnective;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds a target {@code A -> B} from its contrapositive {@code not(B) -> not(A)},
 * in either direction.
 */
public class Transposition extends BaseInferenceRule {

    public Transposition() {
        super("Transposition", 160);
    }

    @Override
    public boolean canApply(DerivationContext context) {
        return !context.getConnectives(LogicalConnective.IMPLIES).isEmpty();
    }

    @Override
    public List<Derivation> apply(DerivationContext context) {
        List<Derivation> derivations = new ArrayList<>();
        for (Formula target : context.getIntroductionTargets()) {
            if (!(target instanceof ConnectiveFormula) || !((ConnectiveFormula) target).is(LogicalConnective.IMPLIES)
                    || !isBinary((ConnectiveFormula) target)) {
                continue;
            }
            Formula antecedent = ((ConnectiveFormula) target).getOperand(0);
            Formula consequent = ((ConnectiveFormula) target).getOperand(1);
            Formula contrapositive = ConnectiveFormula.implies(complement(consequent), complement(antecedent));
            if (context.contains(contrapositive)) {
                derivations.add(derive(target, contrapositive));
            }
        }
        return derivations;
    }
}
