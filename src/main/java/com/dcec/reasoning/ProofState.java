package com.dcec.reasoning;

import com.dcec.formula.Formula;
import com.dcec.reasoning.rules.DerivationContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Mutable trail of one proof run. Every formula appears at most once, under
 * the step number of its first derivation.
 */
class ProofState {
    private final Formula goal;
    private final List<Formula> axioms;
    private final List<ProofStep> steps = new ArrayList<>();
    private final Map<Formula, Integer> stepIndex = new HashMap<>();

    ProofState(Formula goal, List<Formula> axioms) {
        this.goal = goal;
        this.axioms = axioms;
    }

    boolean addAxiom(Formula axiom) {
        if (stepIndex.containsKey(axiom)) {
            return false;
        }
        append(axiom, ProofStep.AXIOM, ProofStep.AXIOM, Collections.emptyList());
        return true;
    }

    /**
     * Record a derived formula. Returns false when it is already on the trail.
     */
    boolean addDerived(Formula formula, String ruleName, List<Formula> premises) {
        if (stepIndex.containsKey(formula)) {
            return false;
        }
        List<Integer> premiseSteps = new ArrayList<>(premises.size());
        for (Formula premise : premises) {
            Integer step = stepIndex.get(premise);
            if (step == null) {
                throw new IllegalStateException(ruleName + " cited a premise not on the trail: " + premise);
            }
            premiseSteps.add(step);
        }
        String justification = premiseSteps.isEmpty()
                ? ruleName
                : ruleName + ": " + premiseSteps.stream().map(String::valueOf).collect(Collectors.joining(", "));
        append(formula, ruleName, justification, premiseSteps);
        return true;
    }

    private void append(Formula formula, String ruleName, String justification, List<Integer> premiseSteps) {
        int number = steps.size() + 1;
        steps.add(new ProofStep(number, formula, ruleName, justification, premiseSteps));
        stepIndex.put(formula, number);
    }

    boolean contains(Formula formula) {
        return stepIndex.containsKey(formula);
    }

    int size() {
        return steps.size();
    }

    DerivationContext newContext() {
        List<Formula> formulas = new ArrayList<>(steps.size());
        for (ProofStep step : steps) {
            formulas.add(step.getFormula());
        }
        return new DerivationContext(formulas, goal);
    }

    ProofTree toTree(ProofStatus status) {
        return new ProofTree(goal, axioms, steps, status);
    }
}
