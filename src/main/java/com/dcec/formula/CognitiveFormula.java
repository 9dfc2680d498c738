package com.dcec.formula;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A mental-state modality indexed by an agent term, e.g. {@code believes(john, rain)}.
 */
public class CognitiveFormula extends Formula {
    private final CognitiveOperator operator;
    private final Term agent;
    private final Formula inner;
    private final int hash;

    public CognitiveFormula(CognitiveOperator operator, Term agent, Formula inner) {
        this.operator = Objects.requireNonNull(operator, "operator");
        this.agent = Objects.requireNonNull(agent, "agent");
        this.inner = Objects.requireNonNull(inner, "inner");
        this.hash = Objects.hash(operator, agent, inner);
    }

    public CognitiveOperator getOperator() { return operator; }
    public Term getAgent() { return agent; }
    public Formula getInner() { return inner; }

    @Override
    public String render() {
        return operator.getKeyword() + "(" + agent.render() + ", " + inner.render() + ")";
    }

    @Override
    public Set<Variable> getFreeVariables() {
        Set<Variable> free = new LinkedHashSet<>(agent.getVariables());
        free.addAll(inner.getFreeVariables());
        return free;
    }

    @Override
    public Formula substitute(Variable variable, Term term) {
        return new CognitiveFormula(operator, agent.substitute(variable, term), inner.substitute(variable, term));
    }

    @Override
    public List<Formula> getSubformulas() {
        return Collections.singletonList(inner);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CognitiveFormula that = (CognitiveFormula) o;
        return operator == that.operator && agent.equals(that.agent) && inner.equals(that.inner);
    }

    @Override
    public int hashCode() {
        return hash;
    }
}
