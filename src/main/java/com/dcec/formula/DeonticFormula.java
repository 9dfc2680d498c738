package com.dcec.formula;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;

public class DeonticFormula extends Formula {
    private final DeonticOperator operator;
    private final Formula inner;
    private final int hash;

    public DeonticFormula(DeonticOperator operator, Formula inner) {
        this.operator = Objects.requireNonNull(operator, "operator");
        this.inner = Objects.requireNonNull(inner, "inner");
        this.hash = Objects.hash(operator, inner);
    }

    public DeonticOperator getOperator() { return operator; }
    public Formula getInner() { return inner; }

    @Override
    public String render() {
        return operator.getKeyword() + "(" + inner.render() + ")";
    }

    @Override
    public Set<Variable> getFreeVariables() {
        return inner.getFreeVariables();
    }

    @Override
    public Formula substitute(Variable variable, Term term) {
        return new DeonticFormula(operator, inner.substitute(variable, term));
    }

    @Override
    public List<Formula> getSubformulas() {
        return Collections.singletonList(inner);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DeonticFormula that = (DeonticFormula) o;
        return operator == that.operator && inner.equals(that.inner);
    }

    @Override
    public int hashCode() {
        return hash;
    }
}
