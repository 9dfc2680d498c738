package com.dcec.reasoning.rules;

import com.dcec.formula.ConnectiveFormula;
import com.dcec.formula.Formula;
import com.dcec.formula.LogicalConnective;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code A -> B} and {@code not(A) or B} stand for each other. Either form is
 * built when it is an introduction target and the other is known.
 */
public class MaterialImplication extends BaseInferenceRule {

    public MaterialImplication() {
        super("Material Implication", 165);
    }

    @Override
    public boolean canApply(DerivationContext context) {
        return !context.getConnectives(LogicalConnective.IMPLIES).isEmpty()
                || !context.getConnectives(LogicalConnective.OR).isEmpty();
    }

    @Override
    public List<Derivation> apply(DerivationContext context) {
        List<Derivation> derivations = new ArrayList<>();
        for (Formula target : context.getIntroductionTargets()) {
            if (!(target instanceof ConnectiveFormula) || !isBinary((ConnectiveFormula) target)) {
                continue;
            }
            ConnectiveFormula binary = (ConnectiveFormula) target;
            Formula source;
            if (binary.is(LogicalConnective.IMPLIES)) {
                source = ConnectiveFormula.or(complement(binary.getOperand(0)), binary.getOperand(1));
            } else if (binary.is(LogicalConnective.OR)) {
                source = ConnectiveFormula.implies(complement(binary.getOperand(0)), binary.getOperand(1));
            } else {
                continue;
            }
            if (context.contains(source)) {
                derivations.add(derive(target, source));
            }
        }
        return derivations;
    }
}
