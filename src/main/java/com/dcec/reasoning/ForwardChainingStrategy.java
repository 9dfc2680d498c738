package com.dcec.reasoning;

import com.dcec.formula.ConnectiveFormula;
import com.dcec.formula.Formula;
import com.dcec.formula.LogicalConnective;
import com.dcec.reasoning.rules.Derivation;
import com.dcec.reasoning.rules.DerivationContext;
import com.dcec.reasoning.rules.InferenceRule;
import com.dcec.reasoning.rules.InferenceRuleRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Saturates the axioms with the registry's rules, pass by pass, until the
 * goal or its negation appears, a pass adds nothing, the pass limit is hit,
 * or the deadline passes. The deadline is checked before every pass and
 * before every rule, so a zero timeout never runs a rule. A rule that throws,
 * or hands back a derivation the trail cannot record, ends the search with
 * {@link ProofStatus#ERROR} and the trail built so far.
 */
public class ForwardChainingStrategy implements ProverStrategy {

    private static final Logger LOGGER = LoggerFactory.getLogger(ForwardChainingStrategy.class);

    public static final String NAME = "forward-chaining";

    private final InferenceRuleRegistry registry;
    private final int maxPasses;

    public ForwardChainingStrategy(InferenceRuleRegistry registry, int maxPasses) {
        if (maxPasses <= 0) {
            throw new IllegalArgumentException("maxPasses must be positive, got " + maxPasses);
        }
        this.registry = registry;
        this.maxPasses = maxPasses;
    }

    @Override
    public String getName() {
        return NAME;
    }

    public InferenceRuleRegistry getRegistry() {
        return registry;
    }

    @Override
    public ProofAttempt prove(Formula goal, List<Formula> axioms, Duration timeout) {
        long start = System.nanoTime();
        long budget = timeout.toNanos();
        ProofState state = new ProofState(goal, axioms);

        if (axioms.contains(goal)) {
            state.addAxiom(goal);
            return finish(state, ProofStatus.PROVED, start, null);
        }
        for (Formula axiom : axioms) {
            state.addAxiom(axiom);
        }
        Formula refutation = refutationOf(goal);
        if (state.contains(refutation)) {
            return finish(state, ProofStatus.DISPROVED, start, null);
        }

        for (int pass = 1; pass <= maxPasses; pass++) {
            if (System.nanoTime() - start >= budget) {
                return finish(state, ProofStatus.TIMEOUT, start, null);
            }
            DerivationContext context = state.newContext();
            boolean progress = false;
            for (InferenceRule rule : registry.getRules()) {
                if (System.nanoTime() - start >= budget) {
                    return finish(state, ProofStatus.TIMEOUT, start, null);
                }
                try {
                    if (!rule.canApply(context)) {
                        continue;
                    }
                    for (Derivation derivation : rule.apply(context)) {
                        if (!state.addDerived(derivation.getFormula(), rule.getName(), derivation.getPremises())) {
                            continue;
                        }
                        progress = true;
                        if (derivation.getFormula().equals(goal)) {
                            return finish(state, ProofStatus.PROVED, start, null);
                        }
                        if (derivation.getFormula().equals(refutation)) {
                            return finish(state, ProofStatus.DISPROVED, start, null);
                        }
                    }
                } catch (RuntimeException e) {
                    LOGGER.error("Inference rule {} failed on pass {}: {}", rule.getName(), pass, e.getMessage(), e);
                    return finish(state, ProofStatus.ERROR, start, rule.getName() + " failed: " + e.getMessage());
                }
            }
            if (!progress) {
                LOGGER.debug("Fixpoint reached after {} pass(es) with {} formulas", pass, state.size());
                return finish(state, ProofStatus.UNKNOWN, start, null);
            }
        }
        LOGGER.debug("Pass limit {} reached with {} formulas", maxPasses, state.size());
        return finish(state, ProofStatus.UNKNOWN, start, null);
    }

    /**
     * {@code X} refutes {@code not(X)}; {@code not(G)} refutes any other goal {@code G}.
     */
    static Formula refutationOf(Formula goal) {
        if (goal instanceof ConnectiveFormula && ((ConnectiveFormula) goal).is(LogicalConnective.NOT)
                && ((ConnectiveFormula) goal).getOperands().size() == 1) {
            return ((ConnectiveFormula) goal).getOperand(0);
        }
        return ConnectiveFormula.not(goal);
    }

    private ProofAttempt finish(ProofState state, ProofStatus status, long start, String errorMessage) {
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        return new ProofAttempt(state.toTree(status), elapsed, NAME, errorMessage);
    }

    @Override
    public String toString() {
        return "ForwardChainingStrategy{rules=" + registry.size() + ", maxPasses=" + maxPasses + '}';
    }
}
