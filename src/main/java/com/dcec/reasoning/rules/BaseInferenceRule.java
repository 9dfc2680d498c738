package com.dcec.reasoning.rules;

import com.dcec.formula.ConnectiveFormula;
import com.dcec.formula.Formula;
import com.dcec.formula.LogicalConnective;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Optional;

public abstract class BaseInferenceRule implements InferenceRule {

    protected static final Logger LOGGER = LoggerFactory.getLogger(BaseInferenceRule.class);

    private final String name;
    private final int priority;

    protected BaseInferenceRule(String name, int priority) {
        this.name = name;
        this.priority = priority;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int getPriority() {
        return priority;
    }

    protected Derivation derive(Formula conclusion, Formula... premises) {
        return new Derivation(conclusion, Arrays.asList(premises));
    }

    protected static boolean isBinary(ConnectiveFormula formula) {
        return formula.getOperands().size() == 2;
    }

    protected static boolean isNegation(Formula formula) {
        return formula instanceof ConnectiveFormula
                && ((ConnectiveFormula) formula).is(LogicalConnective.NOT)
                && ((ConnectiveFormula) formula).getOperands().size() == 1;
    }

    /**
     * Operand of a well-formed negation; callers check {@link #isNegation} first.
     */
    protected static Formula negated(Formula negation) {
        return ((ConnectiveFormula) negation).getOperand(0);
    }

    /**
     * The complement of a formula: {@code X} for {@code not(X)}, {@code not(X)} otherwise.
     */
    protected static Formula complement(Formula formula) {
        return isNegation(formula) ? negated(formula) : ConnectiveFormula.not(formula);
    }

    /**
     * The known complement of {@code formula}, if any.
     */
    protected static Optional<Formula> knownComplement(Formula formula, DerivationContext context) {
        Formula complement = complement(formula);
        if (context.contains(complement)) {
            return Optional.of(complement);
        }
        Formula negation = ConnectiveFormula.not(formula);
        return context.contains(negation) ? Optional.of(negation) : Optional.empty();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{name='" + name + "', priority=" + priority + '}';
    }
}
