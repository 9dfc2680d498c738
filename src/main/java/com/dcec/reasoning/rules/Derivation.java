package com.dcec.reasoning.rules;

import com.dcec.formula.Formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A conclusion and the known formulas it was drawn from.
 */
public class Derivation {
    private final Formula formula;
    private final List<Formula> premises;

    public Derivation(Formula formula, List<Formula> premises) {
        this.formula = Objects.requireNonNull(formula, "formula");
        this.premises = Collections.unmodifiableList(new ArrayList<>(premises));
    }

    public Formula getFormula() { return formula; }
    public List<Formula> getPremises() { return premises; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Derivation that = (Derivation) o;
        return formula.equals(that.formula) && premises.equals(that.premises);
    }

    @Override
    public int hashCode() {
        return Objects.hash(formula, premises);
    }

    @Override
    public String toString() {
        return "Derivation{" + formula.render() + " from " + premises + '}';
    }
}
