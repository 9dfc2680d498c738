package com.dcec.reasoning;

import com.dcec.formula.Formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable record of a finished proof search: the goal, the axioms, the
 * ordered trail and the terminal status.
 */
public class ProofTree {
    private final Formula goal;
    private final List<Formula> axioms;
    private final List<ProofStep> steps;
    private final ProofStatus status;

    public ProofTree(Formula goal, List<Formula> axioms, List<ProofStep> steps, ProofStatus status) {
        this.goal = Objects.requireNonNull(goal, "goal");
        this.axioms = Collections.unmodifiableList(new ArrayList<>(axioms));
        this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
        this.status = Objects.requireNonNull(status, "status");
    }

    public Formula getGoal() { return goal; }
    public List<Formula> getAxioms() { return axioms; }
    public List<ProofStep> getSteps() { return steps; }
    public ProofStatus getStatus() { return status; }

    public int getStepCount() {
        return steps.size();
    }

    public boolean isProved() {
        return status == ProofStatus.PROVED;
    }

    /**
     * Step by its 1-based number.
     */
    public ProofStep getStep(int stepNumber) {
        return steps.get(stepNumber - 1);
    }

    public List<ProofStep> getDerivedSteps() {
        List<ProofStep> derived = new ArrayList<>();
        for (ProofStep step : steps) {
            if (!step.isAxiom()) {
                derived.add(step);
            }
        }
        return derived;
    }

    @Override
    public String toString() {
        return "ProofTree{" +
                "goal=" + goal.render() +
                ", status=" + status +
                ", axioms=" + axioms.size() +
                ", steps=" + steps.size() +
                '}';
    }
}
