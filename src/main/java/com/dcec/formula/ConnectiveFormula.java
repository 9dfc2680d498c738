package com.dcec.formula;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A propositional connective over sub-formulas. Operand counts are not
 * enforced here; {@link FormulaValidator} reports violations and
 * {@link FormulaBuilder} never produces them.
 */
public class ConnectiveFormula extends Formula {
    private final LogicalConnective connective;
    private final List<Formula> operands;
    private final int hash;

    public ConnectiveFormula(LogicalConnective connective, List<Formula> operands) {
        this.connective = Objects.requireNonNull(connective, "connective");
        for (Formula operand : operands) {
            Objects.requireNonNull(operand, "operand");
        }
        this.operands = Collections.unmodifiableList(new ArrayList<>(operands));
        this.hash = Objects.hash(connective, this.operands);
    }

    public static ConnectiveFormula and(Formula... operands) {
        return new ConnectiveFormula(LogicalConnective.AND, Arrays.asList(operands));
    }

    public static ConnectiveFormula or(Formula... operands) {
        return new ConnectiveFormula(LogicalConnective.OR, Arrays.asList(operands));
    }

    public static ConnectiveFormula not(Formula operand) {
        return new ConnectiveFormula(LogicalConnective.NOT, Collections.singletonList(operand));
    }

    public static ConnectiveFormula implies(Formula antecedent, Formula consequent) {
        return new ConnectiveFormula(LogicalConnective.IMPLIES, Arrays.asList(antecedent, consequent));
    }

    public static ConnectiveFormula iff(Formula left, Formula right) {
        return new ConnectiveFormula(LogicalConnective.IFF, Arrays.asList(left, right));
    }

    public LogicalConnective getConnective() { return connective; }
    public List<Formula> getOperands() { return operands; }

    public Formula getOperand(int index) {
        return operands.get(index);
    }

    public boolean is(LogicalConnective candidate) {
        return connective == candidate;
    }

    @Override
    public String render() {
        if (connective == LogicalConnective.NOT) {
            return "not(" + operands.stream().map(Formula::render).collect(Collectors.joining(", ")) + ")";
        }
        return "(" + operands.stream().map(Formula::render)
                .collect(Collectors.joining(" " + connective.getSymbol() + " ")) + ")";
    }

    @Override
    public Set<Variable> getFreeVariables() {
        Set<Variable> free = new LinkedHashSet<>();
        for (Formula operand : operands) {
            free.addAll(operand.getFreeVariables());
        }
        return free;
    }

    @Override
    public Formula substitute(Variable variable, Term term) {
        List<Formula> substituted = new ArrayList<>(operands.size());
        for (Formula operand : operands) {
            substituted.add(operand.substitute(variable, term));
        }
        return new ConnectiveFormula(connective, substituted);
    }

    @Override
    public List<Formula> getSubformulas() {
        return operands;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ConnectiveFormula that = (ConnectiveFormula) o;
        return hash == that.hash && connective == that.connective && operands.equals(that.operands);
    }

    @Override
    public int hashCode() {
        return hash;
    }
}
