package com.dcec.reasoning;

import com.dcec.formula.AtomicFormula;
import com.dcec.formula.CognitiveFormula;
import com.dcec.formula.CognitiveOperator;
import com.dcec.formula.ConnectiveFormula;
import com.dcec.formula.DeonticFormula;
import com.dcec.formula.DeonticOperator;
import com.dcec.formula.Formula;
import com.dcec.formula.FunctionTerm;
import com.dcec.reasoning.rules.BaseInferenceRule;
import com.dcec.reasoning.rules.Derivation;
import com.dcec.reasoning.rules.DerivationContext;
import com.dcec.reasoning.rules.InferenceRuleRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ForwardChainingStrategyTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private static final Formula P = AtomicFormula.proposition("P");
    private static final Formula Q = AtomicFormula.proposition("Q");
    private static final Formula R = AtomicFormula.proposition("R");

    private ForwardChainingStrategy strategy;

    @BeforeEach
    void setUp() {
        strategy = new ForwardChainingStrategy(InferenceRuleRegistry.createDefault(), 50);
    }

    private ProofAttempt prove(Formula goal, Formula... axioms) {
        return strategy.prove(goal, Arrays.asList(axioms), TIMEOUT);
    }

    private static ProofStep lastStep(ProofAttempt attempt) {
        List<ProofStep> steps = attempt.getProofTree().getSteps();
        return steps.get(steps.size() - 1);
    }

    @Nested
    @DisplayName("Proved")
    class ProvedTests {

        @Test
        @DisplayName("modus ponens should close a one-step proof")
        void modusPonens() {
            ProofAttempt attempt = prove(Q, P, ConnectiveFormula.implies(P, Q));

            assertThat(attempt.getStatus()).isEqualTo(ProofStatus.PROVED);
            assertThat(attempt.getStrategyName()).isEqualTo(ForwardChainingStrategy.NAME);
            assertThat(attempt.getProofTree().getStepCount()).isEqualTo(3);
            ProofStep last = lastStep(attempt);
            assertThat(last.getFormula()).isEqualTo(Q);
            assertThat(last.getRuleName()).isEqualTo("Modus Ponens");
            assertThat(last.getJustification()).isEqualTo("Modus Ponens: 1, 2");
            assertThat(last.getPremises()).containsExactly(1, 2);
        }

        @Test
        @DisplayName("a goal among the axioms should be proved by a single step")
        void goalInAxioms() {
            ProofAttempt attempt = prove(P, P, Q);

            assertThat(attempt.getStatus()).isEqualTo(ProofStatus.PROVED);
            assertThat(attempt.getProofTree().getSteps()).hasSize(1);
            assertThat(attempt.getProofTree().getStep(1).isAxiom()).isTrue();
        }

        @Test
        @DisplayName("simplification should extract a conjunct")
        void simplification() {
            ProofAttempt attempt = prove(P, ConnectiveFormula.and(P, Q));

            assertThat(attempt.getStatus()).isEqualTo(ProofStatus.PROVED);
            assertThat(lastStep(attempt).getJustification()).isEqualTo("Simplification: 1");
        }

        @Test
        @DisplayName("conjunction introduction should build the goal from its parts")
        void conjunctionIntroduction() {
            ProofAttempt attempt = prove(ConnectiveFormula.and(P, Q), P, Q);

            assertThat(attempt.getStatus()).isEqualTo(ProofStatus.PROVED);
            assertThat(lastStep(attempt).getJustification()).isEqualTo("Conjunction Introduction: 1, 2");
        }

        @Test
        @DisplayName("disjunction introduction should build the goal from one disjunct")
        void disjunctionIntroduction() {
            ProofAttempt attempt = prove(ConnectiveFormula.or(P, R), P);

            assertThat(attempt.getStatus()).isEqualTo(ProofStatus.PROVED);
            assertThat(lastStep(attempt).getRuleName()).isEqualTo("Disjunction Introduction");
        }

        @Test
        @DisplayName("modus tollens should deny the antecedent")
        void modusTollens() {
            ProofAttempt attempt = prove(ConnectiveFormula.not(P), ConnectiveFormula.implies(P, Q),
                    ConnectiveFormula.not(Q));

            assertThat(attempt.getStatus()).isEqualTo(ProofStatus.PROVED);
            assertThat(lastStep(attempt).getJustification()).isEqualTo("Modus Tollens: 1, 2");
        }

        @Test
        @DisplayName("hypothetical syllogism should chain implications")
        void hypotheticalSyllogism() {
            ProofAttempt attempt = prove(ConnectiveFormula.implies(P, R),
                    ConnectiveFormula.implies(P, Q), ConnectiveFormula.implies(Q, R));

            assertThat(attempt.getStatus()).isEqualTo(ProofStatus.PROVED);
            assertThat(lastStep(attempt).getRuleName()).isEqualTo("Hypothetical Syllogism");
        }

        @Test
        @DisplayName("resolution should combine clauses with a complementary pair")
        void resolution() {
            ProofAttempt attempt = prove(ConnectiveFormula.or(Q, R),
                    ConnectiveFormula.or(P, Q), ConnectiveFormula.or(ConnectiveFormula.not(P), R));

            assertThat(attempt.getStatus()).isEqualTo(ProofStatus.PROVED);
            assertThat(lastStep(attempt).getJustification()).isEqualTo("Resolution: 1, 2");
        }

        @Test
        @DisplayName("should chain De Morgan and disjunctive syllogism across passes")
        void multiPassProof() {
            ProofAttempt attempt = prove(ConnectiveFormula.not(Q), ConnectiveFormula.not(ConnectiveFormula.and(P, Q)), P);

            assertThat(attempt.getStatus()).isEqualTo(ProofStatus.PROVED);
            ProofTree tree = attempt.getProofTree();
            assertThat(tree.getStepCount()).isEqualTo(4);
            assertThat(tree.getStep(3).getFormula().render()).isEqualTo("(not(P) or not(Q))");
            assertThat(tree.getStep(3).getJustification()).isEqualTo("De Morgan: 1");
            assertThat(tree.getStep(4).getJustification()).isEqualTo("Disjunctive Syllogism: 3, 2");
            assertThat(tree.getDerivedSteps()).hasSize(2);
        }

        @Test
        @DisplayName("premises should always cite earlier steps")
        void premisesPointBackwards() {
            ProofAttempt attempt = prove(R, P, ConnectiveFormula.implies(P, Q), ConnectiveFormula.implies(Q, R));

            assertThat(attempt.getStatus()).isEqualTo(ProofStatus.PROVED);
            for (ProofStep step : attempt.getProofTree().getSteps()) {
                assertThat(step.getPremises()).allMatch(premise -> premise < step.getStepNumber());
            }
        }

        @Test
        @DisplayName("contradictory axioms should prove any goal")
        void contradiction() {
            ProofAttempt attempt = prove(R, P, ConnectiveFormula.not(P));

            assertThat(attempt.getStatus()).isEqualTo(ProofStatus.PROVED);
            assertThat(attempt.getProofTree().getStepCount()).isEqualTo(3);
            assertThat(lastStep(attempt).getJustification()).isEqualTo("Contradiction Elimination: 1, 2");
        }

        @Test
        @DisplayName("a conjunctive antecedent should be usable once exported")
        void exportation() {
            Formula curried = ConnectiveFormula.implies(P, ConnectiveFormula.implies(Q, R));

            ProofAttempt attempt = prove(curried, ConnectiveFormula.implies(ConnectiveFormula.and(P, Q), R));

            assertThat(attempt.getStatus()).isEqualTo(ProofStatus.PROVED);
            assertThat(lastStep(attempt).getJustification()).isEqualTo("Exportation: 1");
        }
    }

    @Nested
    @DisplayName("Other outcomes")
    class OutcomeTests {

        @Test
        @DisplayName("deriving the negated goal should disprove it")
        void disproved() {
            ProofAttempt attempt = prove(Q, P, ConnectiveFormula.implies(P, ConnectiveFormula.not(Q)));

            assertThat(attempt.getStatus()).isEqualTo(ProofStatus.DISPROVED);
            assertThat(lastStep(attempt).getFormula()).isEqualTo(ConnectiveFormula.not(Q));
        }

        @Test
        @DisplayName("a negated goal whose operand is an axiom should be disproved at once")
        void negatedGoalRefutedByAxiom() {
            ProofAttempt attempt = prove(ConnectiveFormula.not(P), P);

            assertThat(attempt.getStatus()).isEqualTo(ProofStatus.DISPROVED);
            assertThat(attempt.getProofTree().getStepCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("a pass that derives nothing should end the search as unknown")
        void fixpoint() {
            ProofAttempt attempt = prove(R, P);

            assertThat(attempt.getStatus()).isEqualTo(ProofStatus.UNKNOWN);
            assertThat(attempt.getProofTree().getSteps()).hasSize(1);
        }

        @Test
        @DisplayName("reaching the pass limit should give unknown")
        void passLimit() {
            Formula[] axioms = {P, ConnectiveFormula.implies(P, Q), ConnectiveFormula.implies(Q, R)};

            ProofAttempt limited = new ForwardChainingStrategy(InferenceRuleRegistry.createDefault(), 1)
                    .prove(R, Arrays.asList(axioms), TIMEOUT);
            ProofAttempt unlimited = prove(R, axioms);

            assertThat(limited.getStatus()).isEqualTo(ProofStatus.UNKNOWN);
            assertThat(unlimited.getStatus()).isEqualTo(ProofStatus.PROVED);
        }

        @Test
        @DisplayName("a zero timeout should stop before any rule runs")
        void zeroTimeout() {
            ProofAttempt attempt = strategy.prove(Q, Arrays.asList(P, ConnectiveFormula.implies(P, Q)), Duration.ZERO);

            assertThat(attempt.getStatus()).isEqualTo(ProofStatus.TIMEOUT);
            assertThat(attempt.getProofTree().getSteps()).hasSize(2).allMatch(ProofStep::isAxiom);
        }

        @Test
        @DisplayName("a zero timeout should still prove a goal found among the axioms")
        void zeroTimeoutGoalInAxioms() {
            ProofAttempt attempt = strategy.prove(P, Collections.singletonList(P), Duration.ZERO);

            assertThat(attempt.getStatus()).isEqualTo(ProofStatus.PROVED);
        }

        @Test
        @DisplayName("a slow search should time out with a partial trail")
        void timeoutKeepsPartialTrail() {
            InferenceRuleRegistry registry = new InferenceRuleRegistry().register(new SlowRule(30));
            ForwardChainingStrategy slow = new ForwardChainingStrategy(registry, 1000);

            ProofAttempt attempt = slow.prove(R, Collections.singletonList(P), Duration.ofMillis(50));

            assertThat(attempt.getStatus()).isEqualTo(ProofStatus.TIMEOUT);
            assertThat(attempt.getProofTree().getStepCount()).isGreaterThan(1);
        }

        @Test
        @DisplayName("a failing rule should give an error naming the rule")
        void failingRule() {
            InferenceRuleRegistry registry = InferenceRuleRegistry.createDefault().register(new FailingRule());
            ForwardChainingStrategy failing = new ForwardChainingStrategy(registry, 10);

            ProofAttempt attempt = failing.prove(R, Arrays.asList(P, ConnectiveFormula.implies(P, Q)), TIMEOUT);

            assertThat(attempt.getStatus()).isEqualTo(ProofStatus.ERROR);
            assertThat(attempt.getErrorMessage()).isEqualTo("Failing failed: rule exploded");
            assertThat(attempt.getProofTree().getSteps()).extracting(ProofStep::getFormula).contains(Q);
        }

        @Test
        @DisplayName("a derivation citing a premise off the trail should end in ERROR with the partial trail")
        void unrecordableDerivation() {
            InferenceRuleRegistry registry = InferenceRuleRegistry.createDefault().register(new StrayPremiseRule());
            ForwardChainingStrategy stray = new ForwardChainingStrategy(registry, 10);

            ProofAttempt attempt = stray.prove(R, Arrays.asList(P, ConnectiveFormula.implies(P, Q)), TIMEOUT);

            assertThat(attempt.getStatus()).isEqualTo(ProofStatus.ERROR);
            assertThat(attempt.getErrorMessage())
                    .startsWith("Stray Premise failed: Stray Premise cited a premise not on the trail");
            assertThat(attempt.getProofTree().getSteps()).extracting(ProofStep::getFormula)
                    .contains(P, Q)
                    .doesNotContain(STRAY_CONCLUSION);
        }

        @Test
        @DisplayName("a rule handing back no list should end in ERROR instead of throwing")
        void missingDerivationList() {
            InferenceRuleRegistry registry = InferenceRuleRegistry.createDefault().register(new NullListRule());
            ForwardChainingStrategy broken = new ForwardChainingStrategy(registry, 10);

            ProofAttempt attempt = broken.prove(R, Arrays.asList(P, ConnectiveFormula.implies(P, Q)), TIMEOUT);

            assertThat(attempt.getStatus()).isEqualTo(ProofStatus.ERROR);
            assertThat(attempt.getErrorMessage()).startsWith("Null List failed");
            assertThat(attempt.getProofTree().getStepCount()).isGreaterThanOrEqualTo(3);
        }
    }

    @Nested
    @DisplayName("Modal rules")
    class ModalTests {

        private final Formula knowsP = new CognitiveFormula(CognitiveOperator.KNOWLEDGE,
                FunctionTerm.constant("Alice", "Agent"), P);

        @Test
        @DisplayName("knowledge should not imply truth with the propositional rules only")
        void disabledByDefault() {
            assertThat(prove(P, knowsP).getStatus()).isEqualTo(ProofStatus.UNKNOWN);
        }

        @Test
        @DisplayName("knowledge should imply truth once modal rules are registered")
        void enabled() {
            ForwardChainingStrategy modal = new ForwardChainingStrategy(InferenceRuleRegistry.createWithModalRules(), 50);

            ProofAttempt attempt = modal.prove(P, Collections.singletonList(knowsP), TIMEOUT);

            assertThat(attempt.getStatus()).isEqualTo(ProofStatus.PROVED);
            assertThat(lastStep(attempt).getRuleName()).isEqualTo("Knowledge Implies Truth");
        }

        @Test
        @DisplayName("a forbidden act should be shown not obligatory")
        void forbiddenNotObligatory() {
            ForwardChainingStrategy modal = new ForwardChainingStrategy(InferenceRuleRegistry.createWithModalRules(), 50);
            Formula forbidden = new DeonticFormula(DeonticOperator.FORBIDDEN, P);
            Formula goal = ConnectiveFormula.not(new DeonticFormula(DeonticOperator.OBLIGATORY, P));

            ProofAttempt attempt = modal.prove(goal, Collections.singletonList(forbidden), TIMEOUT);

            assertThat(attempt.getStatus()).isEqualTo(ProofStatus.PROVED);
            assertThat(lastStep(attempt).getRuleName()).isEqualTo("Forbidden To Not Obligatory");
        }
    }

    @Test
    @DisplayName("should reject a non-positive pass limit")
    void rejectsZeroPasses() {
        assertThatThrownBy(() -> new ForwardChainingStrategy(InferenceRuleRegistry.createDefault(), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("the refutation of a negation should be its operand")
    void refutationOf() {
        assertThat(ForwardChainingStrategy.refutationOf(ConnectiveFormula.not(P))).isEqualTo(P);
        assertThat(ForwardChainingStrategy.refutationOf(P)).isEqualTo(ConnectiveFormula.not(P));
    }

    private static class SlowRule extends BaseInferenceRule {
        private final long sleepMillis;
        private int calls;

        SlowRule(long sleepMillis) {
            super("Slow", 10);
            this.sleepMillis = sleepMillis;
        }

        @Override
        public boolean canApply(DerivationContext context) {
            return true;
        }

        @Override
        public List<Derivation> apply(DerivationContext context) {
            try {
                Thread.sleep(sleepMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
            calls++;
            return Collections.singletonList(derive(AtomicFormula.proposition("Fresh" + calls)));
        }
    }

    private static class FailingRule extends BaseInferenceRule {

        FailingRule() {
            super("Failing", 15);
        }

        @Override
        public boolean canApply(DerivationContext context) {
            return true;
        }

        @Override
        public List<Derivation> apply(DerivationContext context) {
            throw new IllegalStateException("rule exploded");
        }
    }

    private static final Formula STRAY_CONCLUSION = AtomicFormula.proposition("Z");

    private static class StrayPremiseRule extends BaseInferenceRule {

        StrayPremiseRule() {
            super("Stray Premise", 15);
        }

        @Override
        public boolean canApply(DerivationContext context) {
            return true;
        }

        @Override
        public List<Derivation> apply(DerivationContext context) {
            return Collections.singletonList(derive(STRAY_CONCLUSION, AtomicFormula.proposition("NotOnTrail")));
        }
    }

    private static class NullListRule extends BaseInferenceRule {

        NullListRule() {
            super("Null List", 15);
        }

        @Override
        public boolean canApply(DerivationContext context) {
            return true;
        }

        @Override
        public List<Derivation> apply(DerivationContext context) {
            return null;
        }
    }
}
