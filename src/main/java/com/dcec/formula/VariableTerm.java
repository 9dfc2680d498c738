package com.dcec.formula;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;

public class VariableTerm extends Term {
    private final Variable variable;

    public VariableTerm(Variable variable) {
        this.variable = Objects.requireNonNull(variable, "variable");
    }

    public Variable getVariable() { return variable; }

    @Override
    public String getSort() {
        return variable.getSort();
    }

    @Override
    public Set<Variable> getVariables() {
        return Collections.singleton(variable);
    }

    @Override
    public Term substitute(Variable target, Term replacement) {
        return variable.equals(target) ? replacement : this;
    }

    @Override
    public String render() {
        return variable.getName();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return variable.equals(((VariableTerm) o).variable);
    }

    @Override
    public int hashCode() {
        return variable.hashCode();
    }
}
