package com.dcec.formula;

import java.util.Set;

/**
 * A first-order term: either a variable or a function application.
 */
public abstract class Term {

    /**
     * Sort of the value this term denotes.
     */
    public abstract String getSort();

    /**
     * All variables occurring in this term.
     */
    public abstract Set<Variable> getVariables();

    /**
     * Replace every occurrence of {@code variable} with {@code replacement}.
     */
    public abstract Term substitute(Variable variable, Term replacement);

    public abstract String render();

    @Override
    public String toString() {
        return render();
    }
}
