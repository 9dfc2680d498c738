package com.dcec.reasoning.rules;

import com.dcec.formula.ConnectiveFormula;
import com.dcec.formula.Formula;
import com.dcec.formula.LogicalConnective;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * From {@code A -> B} and the complement of {@code B} derive the complement of {@code A}.
 */
public class ModusTollens extends BaseInferenceRule {

    public ModusTollens() {
        super("Modus Tollens", 30);
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
            Optional<Formula> denial = knownComplement(implication.getOperand(1), context);
            if (denial.isPresent()) {
                derivations.add(derive(complement(implication.getOperand(0)), implication, denial.get()));
            }
        }
        return derivations;
    }
}
