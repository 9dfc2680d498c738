package com.dcec.reasoning.rules;

import com.dcec.formula.ConnectiveFormula;
import com.dcec.formula.Formula;
import com.dcec.formula.LogicalConnective;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only view of the formulas derived so far, handed to every rule in a
 * pass. Indexes are computed on first use.
 */
public class DerivationContext {
    private final List<Formula> formulas;
    private final Set<Formula> known;
    private final Formula goal;
    private final Map<LogicalConnective, List<ConnectiveFormula>> byConnective = new EnumMap<>(LogicalConnective.class);
    private Set<Formula> introductionTargets;

    public DerivationContext(List<Formula> formulas, Formula goal) {
        this.formulas = Collections.unmodifiableList(new ArrayList<>(formulas));
        this.known = new LinkedHashSet<>(formulas);
        this.goal = goal;
    }

    public List<Formula> getFormulas() { return formulas; }
    public Formula getGoal() { return goal; }

    public boolean contains(Formula formula) {
        return known.contains(formula);
    }

    /**
     * Known formulas whose main operator is {@code connective}, in derivation order.
     */
    public List<ConnectiveFormula> getConnectives(LogicalConnective connective) {
        return byConnective.computeIfAbsent(connective, op -> {
            List<ConnectiveFormula> matching = new ArrayList<>();
            for (Formula formula : formulas) {
                if (formula instanceof ConnectiveFormula && ((ConnectiveFormula) formula).is(op)) {
                    matching.add((ConnectiveFormula) formula);
                }
            }
            return matching;
        });
    }

    /**
     * Formulas worth building by an introduction rule: every sub-formula of
     * the goal, of the antecedents of known implications, and of both sides of
     * known biconditionals. Keeping introductions inside this set keeps the
     * search finite.
     */
    public Set<Formula> getIntroductionTargets() {
        if (introductionTargets == null) {
            Set<Formula> targets = new LinkedHashSet<>();
            addClosure(goal, targets);
            for (ConnectiveFormula implication : getConnectives(LogicalConnective.IMPLIES)) {
                if (implication.getOperands().size() == 2) {
                    addClosure(implication.getOperand(0), targets);
                }
            }
            for (ConnectiveFormula biconditional : getConnectives(LogicalConnective.IFF)) {
                for (Formula side : biconditional.getOperands()) {
                    addClosure(side, targets);
                }
            }
            introductionTargets = Collections.unmodifiableSet(targets);
        }
        return introductionTargets;
    }

    private static void addClosure(Formula formula, Set<Formula> targets) {
        if (formula != null && targets.add(formula)) {
            for (Formula sub : formula.getSubformulas()) {
                addClosure(sub, targets);
            }
        }
    }
}
