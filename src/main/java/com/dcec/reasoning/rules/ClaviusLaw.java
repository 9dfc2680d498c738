package com.dcec.reasoning.rules;

import com.dcec.formula.ConnectiveFormula;
import com.dcec.formula.Formula;
import com.dcec.formula.LogicalConnective;

import java.util.ArrayList;
import java.util.List;

/**
 * From {@code not(A) -> A} derive {@code A}.
 */
public class ClaviusLaw extends BaseInferenceRule {

    public ClaviusLaw() {
        super("Clavius Law", 140);
    }

    @Override
    public boolean canApply(DerivationContext context) {
        return !context.getConnectives(LogicalConnective.IMPLIES).isEmpty();
    }

    @Override
    public List<Derivation> apply(DerivationContext context) {
        List<Derivation> derivations = new ArrayList<>();
        for (ConnectiveFormula implication : context.getConnectives(LogicalConnective.IMPLIES)) {
            if (!isBinary(implication)) {
                continue;
            }
            Formula consequent = implication.getOperand(1);
            Formula antecedent = implication.getOperand(0);
            if (antecedent.equals(ConnectiveFormula.not(consequent)) || antecedent.equals(complement(consequent))) {
                derivations.add(derive(consequent, implication));
            }
        }
        return derivations;
    }
}
