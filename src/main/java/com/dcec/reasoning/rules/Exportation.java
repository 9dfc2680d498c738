package com.dcec.reasoning.rules;

import com.dcec.formula.ConnectiveFormula;
import com.dcec.formula.Formula;
import com.dcec.formula.LogicalConnective;

import java.util.ArrayList;
import java.util.List;

/**
 * Exports {@code (A and B) -> C} to {@code A -> (B -> C)}. The import
 * direction only builds introduction targets, so saturation stays finite.
 */
public class Exportation extends BaseInferenceRule {

    public Exportation() {
        super("Exportation", 155);
    }

    @Override
    public boolean canApply(DerivationContext context) {
        return true;
    }

    @Override
    public List<Derivation> apply(DerivationContext context) {
        List<Derivation> derivations = new ArrayList<>();
        for (ConnectiveFormula implication : context.getConnectives(LogicalConnective.IMPLIES)) {
            if (!isBinary(implication) || !isBinaryConjunction(implication.getOperand(0))) {
                continue;
            }
            ConnectiveFormula conjunction = (ConnectiveFormula) implication.getOperand(0);
            derivations.add(derive(ConnectiveFormula.implies(conjunction.getOperand(0),
                    ConnectiveFormula.implies(conjunction.getOperand(1), implication.getOperand(1))), implication));
        }
        for (Formula target : context.getIntroductionTargets()) {
            if (!(target instanceof ConnectiveFormula) || !((ConnectiveFormula) target).is(LogicalConnective.IMPLIES)
                    || !isBinary((ConnectiveFormula) target)
                    || !isBinaryConjunction(((ConnectiveFormula) target).getOperand(0))) {
                continue;
            }
            ConnectiveFormula conjunction = (ConnectiveFormula) ((ConnectiveFormula) target).getOperand(0);
            Formula exported = ConnectiveFormula.implies(conjunction.getOperand(0),
                    ConnectiveFormula.implies(conjunction.getOperand(1), ((ConnectiveFormula) target).getOperand(1)));
            if (context.contains(exported)) {
                derivations.add(derive(target, exported));
            }
        }
        return derivations;
    }

    private static boolean isBinaryConjunction(Formula formula) {
        return formula instanceof ConnectiveFormula && ((ConnectiveFormula) formula).is(LogicalConnective.AND)
                && isBinary((ConnectiveFormula) formula);
    }
}
