package com.dcec.formula;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A quantifier binding one variable over a body.
 */
public class QuantifiedFormula extends Formula {
    private final Quantifier quantifier;
    private final Variable variable;
    private final Formula inner;
    private final int hash;

    public QuantifiedFormula(Quantifier quantifier, Variable variable, Formula inner) {
        this.quantifier = Objects.requireNonNull(quantifier, "quantifier");
        this.variable = Objects.requireNonNull(variable, "variable");
        this.inner = Objects.requireNonNull(inner, "inner");
        this.hash = Objects.hash(quantifier, variable, inner);
    }

    public Quantifier getQuantifier() { return quantifier; }
    public Variable getVariable() { return variable; }
    public Formula getInner() { return inner; }

    @Override
    public String render() {
        return quantifier.getKeyword() + "(" + variable.getName() + ", " + inner.render() + ")";
    }

    @Override
    public Set<Variable> getFreeVariables() {
        Set<Variable> free = new LinkedHashSet<>(inner.getFreeVariables());
        free.remove(variable);
        return free;
    }

    @Override
    public Formula substitute(Variable target, Term term) {
        if (variable.equals(target) || !inner.getFreeVariables().contains(target)) {
            return this;
        }
        if (term.getVariables().contains(variable)) {
            Variable fresh = freshVariable(term);
            Formula renamed = inner.substitute(variable, new VariableTerm(fresh));
            return new QuantifiedFormula(quantifier, fresh, renamed.substitute(target, term));
        }
        return new QuantifiedFormula(quantifier, variable, inner.substitute(target, term));
    }

    private Variable freshVariable(Term term) {
        Set<String> taken = new HashSet<>();
        for (Variable v : inner.getFreeVariables()) {
            taken.add(v.getName());
        }
        for (Variable v : term.getVariables()) {
            taken.add(v.getName());
        }
        int suffix = 1;
        String candidate = variable.getName() + "_" + suffix;
        while (taken.contains(candidate)) {
            suffix++;
            candidate = variable.getName() + "_" + suffix;
        }
        return new Variable(candidate, variable.getSort());
    }

    @Override
    public List<Formula> getSubformulas() {
        return Collections.singletonList(inner);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        QuantifiedFormula that = (QuantifiedFormula) o;
        return quantifier == that.quantifier && variable.equals(that.variable) && inner.equals(that.inner);
    }

    @Override
    public int hashCode() {
        return hash;
    }
}
