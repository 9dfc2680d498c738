package com.dcec.reasoning.rules.modal;

import com.dcec.formula.ConnectiveFormula;
import com.dcec.formula.DeonticFormula;
import com.dcec.formula.DeonticOperator;
import com.dcec.formula.Formula;
import com.dcec.formula.LogicalConnective;
import com.dcec.reasoning.rules.BaseInferenceRule;
import com.dcec.reasoning.rules.Derivation;
import com.dcec.reasoning.rules.DerivationContext;

import java.util.ArrayList;
import java.util.List;

/**
 * From {@code obligatory(P)} and {@code P -> Q} derive {@code obligatory(Q)}.
 */
public class ObligationImplication extends BaseInferenceRule {

    public ObligationImplication() {
        super("Obligation Implication", 340);
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
            Formula obligation = new DeonticFormula(DeonticOperator.OBLIGATORY, implication.getOperand(0));
            if (context.contains(obligation)) {
                derivations.add(derive(new DeonticFormula(DeonticOperator.OBLIGATORY, implication.getOperand(1)),
                        obligation, implication));
            }
        }
        return derivations;
    }
}
