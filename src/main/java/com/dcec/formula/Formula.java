package com.dcec.formula;

import java.util.List;
import java.util.Set;

/**
 * Immutable DCEC formula. Equality and hashing are structural; two formulas
 * with the same structure render to the same text.
 */
public abstract class Formula {

    /**
     * Canonical, re-parseable text form.
     */
    public abstract String render();

    /**
     * Variables not bound by an enclosing quantifier.
     */
    public abstract Set<Variable> getFreeVariables();

    /**
     * Replace free occurrences of {@code variable} with {@code term}. Bound
     * variables that would capture a variable of {@code term} are renamed.
     */
    public abstract Formula substitute(Variable variable, Term term);

    /**
     * Immediate sub-formulas in operand order.
     */
    public abstract List<Formula> getSubformulas();

    public boolean isClosed() {
        return getFreeVariables().isEmpty();
    }

    @Override
    public String toString() {
        return render();
    }
}
