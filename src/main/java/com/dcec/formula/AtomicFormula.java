package com.dcec.formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A predicate applied to terms, e.g. {@code holds(f, t)} or the proposition {@code P}.
 */
public class AtomicFormula extends Formula {
    private final PredicateSymbol predicate;
    private final List<Term> arguments;
    private final int hash;

    public AtomicFormula(PredicateSymbol predicate, List<Term> arguments) {
        this.predicate = Objects.requireNonNull(predicate, "predicate");
        if (arguments.size() != predicate.getArity()) {
            throw new IllegalArgumentException("Predicate " + predicate.getName() + " expects "
                    + predicate.getArity() + " arguments, got " + arguments.size());
        }
        this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
        this.hash = Objects.hash(predicate, this.arguments);
    }

    /**
     * A zero-argument proposition.
     */
    public static AtomicFormula proposition(String name) {
        return new AtomicFormula(new PredicateSymbol(name), Collections.emptyList());
    }

    public PredicateSymbol getPredicate() { return predicate; }
    public List<Term> getArguments() { return arguments; }

    @Override
    public String render() {
        if (arguments.isEmpty()) {
            return predicate.getName();
        }
        return predicate.getName() + "(" + arguments.stream().map(Term::render).collect(Collectors.joining(", ")) + ")";
    }

    @Override
    public Set<Variable> getFreeVariables() {
        Set<Variable> free = new LinkedHashSet<>();
        for (Term argument : arguments) {
            free.addAll(argument.getVariables());
        }
        return free;
    }

    @Override
    public Formula substitute(Variable variable, Term term) {
        List<Term> substituted = new ArrayList<>(arguments.size());
        for (Term argument : arguments) {
            substituted.add(argument.substitute(variable, term));
        }
        return new AtomicFormula(predicate, substituted);
    }

    @Override
    public List<Formula> getSubformulas() {
        return Collections.emptyList();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AtomicFormula that = (AtomicFormula) o;
        return hash == that.hash && predicate.equals(that.predicate) && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return hash;
    }
}
