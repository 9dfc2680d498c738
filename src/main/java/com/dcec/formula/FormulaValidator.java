package com.dcec.formula;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks operand-count constraints over a whole formula tree. Predicate
 * argument sorts are not checked here.
 */
public class FormulaValidator {

    public ValidationResult validate(Formula formula) {
        List<String> errors = new ArrayList<>();
        collect(formula, errors);
        return new ValidationResult(errors);
    }

    private void collect(Formula formula, List<String> errors) {
        if (formula instanceof ConnectiveFormula) {
            ConnectiveFormula connective = (ConnectiveFormula) formula;
            LogicalConnective op = connective.getConnective();
            int count = connective.getOperands().size();
            if (!op.acceptsOperandCount(count)) {
                errors.add(describe(op, count) + " in " + formula.render());
            }
        }
        for (Formula sub : formula.getSubformulas()) {
            collect(sub, errors);
        }
    }

    private String describe(LogicalConnective op, int count) {
        if (op.getMinOperands() == op.getMaxOperands()) {
            return String.format("%s requires exactly %d operand(s), found %d", op, op.getMinOperands(), count);
        }
        return String.format("%s requires at least %d operands, found %d", op, op.getMinOperands(), count);
    }
}
