package com.dcec.formula;

import com.dcec.namespace.Namespace;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class QuantifiedFormulaTest {

    private final Variable x = new Variable("x", Namespace.OBJECT);
    private final Variable y = new Variable("y", Namespace.OBJECT);
    private final PredicateSymbol related = new PredicateSymbol("R", Arrays.asList(Namespace.OBJECT, Namespace.OBJECT));

    private Formula related(Term first, Term second) {
        return new AtomicFormula(related, Arrays.asList(first, second));
    }

    @Test
    @DisplayName("should substitute free occurrences under the quantifier")
    void substitutesFreeVariable() {
        Formula formula = new QuantifiedFormula(Quantifier.FORALL, y, related(new VariableTerm(x), new VariableTerm(y)));

        Formula result = formula.substitute(x, FunctionTerm.constant("c", Namespace.OBJECT));

        assertThat(result.render()).isEqualTo("forall(y, R(c, y))");
        assertThat(result.isClosed()).isTrue();
    }

    @Test
    @DisplayName("should leave the bound variable alone")
    void boundVariableUntouched() {
        Formula formula = new QuantifiedFormula(Quantifier.FORALL, x, related(new VariableTerm(x), new VariableTerm(x)));

        assertThat(formula.substitute(x, FunctionTerm.constant("c", Namespace.OBJECT))).isSameAs(formula);
    }

    @Test
    @DisplayName("should rename the bound variable instead of capturing the substituted one")
    void avoidsCapture() {
        Formula formula = new QuantifiedFormula(Quantifier.EXISTS, y, related(new VariableTerm(x), new VariableTerm(y)));

        Formula result = formula.substitute(x, new VariableTerm(y));

        assertThat(result.render()).isEqualTo("exists(y_1, R(y, y_1))");
        assertThat(result.getFreeVariables()).containsExactly(y);
    }

    @Test
    @DisplayName("the fresh name should skip names already in use")
    void freshNameSkipsTaken() {
        Variable taken = new Variable("y_1", Namespace.OBJECT);
        Formula body = ConnectiveFormula.and(related(new VariableTerm(x), new VariableTerm(y)),
                related(new VariableTerm(taken), new VariableTerm(y)));
        Formula formula = new QuantifiedFormula(Quantifier.FORALL, y, body);

        Formula result = formula.substitute(x, new VariableTerm(y));

        assertThat(result.render()).isEqualTo("forall(y_2, (R(y, y_2) and R(y_1, y_2)))");
    }
}
