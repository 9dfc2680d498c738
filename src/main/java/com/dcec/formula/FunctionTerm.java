package com.dcec.formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Application of a function symbol to argument terms. Owns its arguments.
 */
public class FunctionTerm extends Term {
    private final FunctionSymbol function;
    private final List<Term> arguments;

    public FunctionTerm(FunctionSymbol function, List<Term> arguments) {
        this.function = Objects.requireNonNull(function, "function");
        if (arguments.size() != function.getArity()) {
            throw new IllegalArgumentException("Function " + function.getName() + " expects "
                    + function.getArity() + " arguments, got " + arguments.size());
        }
        this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
    }

    /**
     * Convenience for a constant of the given sort.
     */
    public static FunctionTerm constant(String name, String sort) {
        return new FunctionTerm(new FunctionSymbol(name, sort, Collections.emptyList()), Collections.emptyList());
    }

    public FunctionSymbol getFunction() { return function; }
    public List<Term> getArguments() { return arguments; }

    @Override
    public String getSort() {
        return function.getReturnSort();
    }

    @Override
    public Set<Variable> getVariables() {
        Set<Variable> variables = new LinkedHashSet<>();
        for (Term argument : arguments) {
            variables.addAll(argument.getVariables());
        }
        return variables;
    }

    @Override
    public Term substitute(Variable variable, Term replacement) {
        List<Term> substituted = new ArrayList<>(arguments.size());
        for (Term argument : arguments) {
            substituted.add(argument.substitute(variable, replacement));
        }
        return new FunctionTerm(function, substituted);
    }

    @Override
    public String render() {
        if (arguments.isEmpty()) {
            return function.getName();
        }
        return function.getName() + "(" + arguments.stream().map(Term::render).collect(Collectors.joining(", ")) + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FunctionTerm that = (FunctionTerm) o;
        return function.equals(that.function) && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(function, arguments);
    }
}
