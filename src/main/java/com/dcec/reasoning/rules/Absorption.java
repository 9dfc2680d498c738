package com.dcec.reasoning.rules;

import com.dcec.formula.ConnectiveFormula;
import com.dcec.formula.Formula;
import com.dcec.formula.LogicalConnective;

import java.util.ArrayList;
import java.util.List;

/**
 * Absorption in two shapes. {@code A or (A and B)} gives {@code A}, and a
 * target {@code A -> (A and B)} is built from a known {@code A -> B}.
 */
public class Absorption extends BaseInferenceRule {

    public Absorption() {
        super("Absorption", 150);
    }

    @Override
    public boolean canApply(DerivationContext context) {
        return true;
    }

    @Override
    public List<Derivation> apply(DerivationContext context) {
        List<Derivation> derivations = new ArrayList<>();
        for (ConnectiveFormula disjunction : context.getConnectives(LogicalConnective.OR)) {
            if (!isBinary(disjunction)) {
                continue;
            }
            for (int i = 0; i < 2; i++) {
                Formula kept = disjunction.getOperand(i);
                Formula other = disjunction.getOperand(1 - i);
                if (other instanceof ConnectiveFormula && ((ConnectiveFormula) other).is(LogicalConnective.AND)
                        && ((ConnectiveFormula) other).getOperands().contains(kept)) {
                    derivations.add(derive(kept, disjunction));
                    break;
                }
            }
        }
        for (Formula target : context.getIntroductionTargets()) {
            if (!(target instanceof ConnectiveFormula) || !((ConnectiveFormula) target).is(LogicalConnective.IMPLIES)
                    || !isBinary((ConnectiveFormula) target)) {
                continue;
            }
            Formula antecedent = ((ConnectiveFormula) target).getOperand(0);
            Formula consequent = ((ConnectiveFormula) target).getOperand(1);
            if (!(consequent instanceof ConnectiveFormula) || !((ConnectiveFormula) consequent).is(LogicalConnective.AND)
                    || !isBinary((ConnectiveFormula) consequent)
                    || !((ConnectiveFormula) consequent).getOperand(0).equals(antecedent)) {
                continue;
            }
            Formula source = ConnectiveFormula.implies(antecedent, ((ConnectiveFormula) consequent).getOperand(1));
            if (context.contains(source)) {
                derivations.add(derive(target, source));
            }
        }
        return derivations;
    }
}
