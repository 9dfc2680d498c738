package com.dcec.reasoning;

import com.dcec.formula.Formula;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Delegates to an {@link ExternalProverAdapter}, falling back to another
 * strategy when the adapter is unavailable or fails. An external proof only
 * reports success, so its trail holds the axioms and the goal.
 */
public class ExternalProverStrategy implements ProverStrategy {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExternalProverStrategy.class);

    private final ExternalProverAdapter adapter;
    private final ProverStrategy fallback;

    public ExternalProverStrategy(ExternalProverAdapter adapter, ProverStrategy fallback) {
        this.adapter = adapter;
        this.fallback = fallback;
    }

    @Override
    public String getName() {
        return "external:" + adapter.getName();
    }

    @Override
    public ProofAttempt prove(Formula goal, List<Formula> axioms, Duration timeout) {
        if (!adapter.isAvailable()) {
            LOGGER.warn("External prover {} unavailable, using {}", adapter.getName(), fallback.getName());
            return fallback.prove(goal, axioms, timeout);
        }
        long start = System.nanoTime();
        ExternalProofResult result;
        try {
            result = adapter.prove(goal, axioms, timeout);
        } catch (RuntimeException e) {
            LOGGER.warn("External prover {} failed ({}), using {}", adapter.getName(), e.getMessage(),
                    fallback.getName());
            return fallback.prove(goal, axioms, timeout);
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        LOGGER.debug("External prover {} returned {}", adapter.getName(), result);
        return new ProofAttempt(toTree(goal, axioms, result), elapsed, getName(), null);
    }

    private ProofTree toTree(Formula goal, List<Formula> axioms, ExternalProofResult result) {
        List<ProofStep> steps = new ArrayList<>();
        List<Integer> premises = new ArrayList<>();
        for (Formula axiom : axioms) {
            int number = steps.size() + 1;
            steps.add(new ProofStep(number, axiom, ProofStep.AXIOM, ProofStep.AXIOM, Collections.emptyList()));
            premises.add(number);
        }
        if (!result.isProved()) {
            return new ProofTree(goal, axioms, steps, ProofStatus.UNKNOWN);
        }
        String justification = String.format("%s: %d steps in %.3fs", adapter.getName(), result.getSteps(),
                result.getTimeSeconds());
        steps.add(new ProofStep(steps.size() + 1, goal, getName(), justification, premises));
        return new ProofTree(goal, axioms, steps, ProofStatus.PROVED);
    }
}
