package com.dcec.reasoning.rules.modal;

import com.dcec.formula.AtomicFormula;
import com.dcec.formula.CognitiveFormula;
import com.dcec.formula.CognitiveOperator;
import com.dcec.formula.ConnectiveFormula;
import com.dcec.formula.DeonticFormula;
import com.dcec.formula.DeonticOperator;
import com.dcec.formula.Formula;
import com.dcec.formula.FunctionTerm;
import com.dcec.formula.TemporalFormula;
import com.dcec.formula.TemporalOperator;
import com.dcec.formula.Term;
import com.dcec.reasoning.rules.Derivation;
import com.dcec.reasoning.rules.DerivationContext;
import com.dcec.reasoning.rules.InferenceRule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class ModalRulesTest {

    private static final Formula P = AtomicFormula.proposition("P");
    private static final Formula Q = AtomicFormula.proposition("Q");
    private static final Term ALICE = FunctionTerm.constant("Alice", "Agent");

    private static List<Formula> conclusions(InferenceRule rule, Formula... formulas) {
        DerivationContext context = new DerivationContext(Arrays.asList(formulas), Q);
        return rule.apply(context).stream().map(Derivation::getFormula).collect(Collectors.toList());
    }

    private static Formula cognitive(CognitiveOperator operator, Formula inner) {
        return new CognitiveFormula(operator, ALICE, inner);
    }

    @Nested
    @DisplayName("Cognitive")
    class CognitiveTests {

        @Test
        @DisplayName("knowledge should give the known formula")
        void knowledgeImpliesTruth() {
            assertThat(conclusions(new KnowledgeImpliesTruth(), cognitive(CognitiveOperator.KNOWLEDGE, P)))
                    .containsExactly(P);
        }

        @Test
        @DisplayName("knowledge should give belief by the same agent")
        void knowledgeImpliesBelief() {
            assertThat(conclusions(new KnowledgeImpliesBelief(), cognitive(CognitiveOperator.KNOWLEDGE, P)))
                    .containsExactly(cognitive(CognitiveOperator.BELIEF, P));
        }

        @Test
        @DisplayName("belief in a conjunction should give belief in each conjunct")
        void beliefDistribution() {
            Formula belief = cognitive(CognitiveOperator.BELIEF, ConnectiveFormula.and(P, Q));

            assertThat(conclusions(new BeliefDistribution(), belief))
                    .containsExactly(cognitive(CognitiveOperator.BELIEF, P), cognitive(CognitiveOperator.BELIEF, Q));
        }

        @Test
        @DisplayName("perception should give knowledge")
        void perceptionImpliesKnowledge() {
            assertThat(conclusions(new PerceptionImpliesKnowledge(), cognitive(CognitiveOperator.PERCEPTION, P)))
                    .containsExactly(cognitive(CognitiveOperator.KNOWLEDGE, P));
        }

        @Test
        @DisplayName("knowledge of a conjunction should give knowledge of each conjunct")
        void knowledgeDistribution() {
            Formula knowledge = cognitive(CognitiveOperator.KNOWLEDGE, ConnectiveFormula.and(P, Q));

            assertThat(conclusions(new KnowledgeDistribution(), knowledge))
                    .containsExactly(cognitive(CognitiveOperator.KNOWLEDGE, P), cognitive(CognitiveOperator.KNOWLEDGE, Q));
        }

        @Test
        @DisplayName("an intention should carry over to a believed consequence")
        void intentionCommitment() {
            Formula intention = cognitive(CognitiveOperator.INTENTION, P);
            Formula belief = cognitive(CognitiveOperator.BELIEF, ConnectiveFormula.implies(P, Q));

            assertThat(conclusions(new IntentionCommitment(), intention, belief))
                    .containsExactly(cognitive(CognitiveOperator.INTENTION, Q));
            assertThat(conclusions(new IntentionCommitment(), belief)).isEmpty();
        }

        @Test
        @DisplayName("an intention with a consequence believed false should be dropped")
        void intentionSideEffect() {
            Formula intention = cognitive(CognitiveOperator.INTENTION, P);
            Formula belief = cognitive(CognitiveOperator.BELIEF, ConnectiveFormula.implies(P, Q));
            Formula disbelief = cognitive(CognitiveOperator.BELIEF, ConnectiveFormula.not(Q));

            List<Derivation> derivations = new IntentionSideEffect()
                    .apply(new DerivationContext(Arrays.asList(intention, belief, disbelief), Q));

            assertThat(derivations).containsExactly(
                    new Derivation(ConnectiveFormula.not(intention), Arrays.asList(intention, belief, disbelief)));
            assertThat(conclusions(new IntentionSideEffect(), intention, belief)).isEmpty();
        }

        @Test
        @DisplayName("other mental states should not be touched")
        void otherOperators() {
            Formula intention = cognitive(CognitiveOperator.INTENTION, P);

            assertThat(conclusions(new KnowledgeImpliesTruth(), intention)).isEmpty();
            assertThat(conclusions(new BeliefDistribution(),
                    cognitive(CognitiveOperator.DESIRE, ConnectiveFormula.and(P, Q)))).isEmpty();
        }
    }

    @Nested
    @DisplayName("Deontic")
    class DeonticTests {

        @Test
        @DisplayName("obligation over a conjunction should distribute")
        void obligationDistribution() {
            Formula obligation = new DeonticFormula(DeonticOperator.OBLIGATORY, ConnectiveFormula.and(P, Q));

            assertThat(conclusions(new ObligationDistribution(), obligation)).containsExactly(
                    new DeonticFormula(DeonticOperator.OBLIGATORY, P),
                    new DeonticFormula(DeonticOperator.OBLIGATORY, Q));
        }

        @Test
        @DisplayName("obligation should give permission")
        void obligationImpliesPermission() {
            assertThat(conclusions(new ObligationImpliesPermission(), new DeonticFormula(DeonticOperator.OBLIGATORY, P)))
                    .containsExactly(new DeonticFormula(DeonticOperator.PERMISSIBLE, P));
        }

        @Test
        @DisplayName("a forbidden formula should make its negation obligatory")
        void forbidden() {
            List<Formula> derived = conclusions(new ForbiddenAsObligatoryNegation(),
                    new DeonticFormula(DeonticOperator.FORBIDDEN, P));

            assertThat(derived).extracting(Formula::render).containsExactly("obligatory(not(P))");
        }

        @Test
        @DisplayName("a forbidden formula should not be obligatory")
        void forbiddenToNotObligatory() {
            assertThat(conclusions(new ForbiddenToNotObligatory(), new DeonticFormula(DeonticOperator.FORBIDDEN, P)))
                    .containsExactly(ConnectiveFormula.not(new DeonticFormula(DeonticOperator.OBLIGATORY, P)));
        }

        @Test
        @DisplayName("an obligation should extend to what it implies")
        void obligationImplication() {
            Formula obligation = new DeonticFormula(DeonticOperator.OBLIGATORY, P);

            assertThat(conclusions(new ObligationImplication(), obligation, ConnectiveFormula.implies(P, Q)))
                    .containsExactly(new DeonticFormula(DeonticOperator.OBLIGATORY, Q));
            assertThat(conclusions(new ObligationImplication(), obligation, ConnectiveFormula.implies(Q, P))).isEmpty();
        }

        @Test
        @DisplayName("no obligation to refrain should give permission")
        void permissionFromNonObligation() {
            Formula notObligedToRefrain = ConnectiveFormula.not(
                    new DeonticFormula(DeonticOperator.OBLIGATORY, ConnectiveFormula.not(P)));

            assertThat(conclusions(new PermissionFromNonObligation(), notObligedToRefrain))
                    .containsExactly(new DeonticFormula(DeonticOperator.PERMISSIBLE, P));
            assertThat(conclusions(new PermissionFromNonObligation(),
                    ConnectiveFormula.not(new DeonticFormula(DeonticOperator.OBLIGATORY, P)))).isEmpty();
        }
    }

    @Nested
    @DisplayName("Temporal")
    class TemporalTests {

        private final Formula alwaysP = new TemporalFormula(TemporalOperator.ALWAYS, P);

        @Test
        @DisplayName("always should give now, eventually and next")
        void alwaysConsequences() {
            assertThat(conclusions(new AlwaysElimination(), alwaysP)).containsExactly(P);
            assertThat(conclusions(new AlwaysImpliesEventually(), alwaysP))
                    .containsExactly(new TemporalFormula(TemporalOperator.EVENTUALLY, P));
            assertThat(conclusions(new AlwaysImpliesNext(), alwaysP))
                    .containsExactly(new TemporalFormula(TemporalOperator.NEXT, P));
        }

        @Test
        @DisplayName("eventually should not be strengthened")
        void eventuallyUntouched() {
            Formula eventually = new TemporalFormula(TemporalOperator.EVENTUALLY, P);

            assertThat(conclusions(new AlwaysElimination(), eventually)).isEmpty();
        }

        @Test
        @DisplayName("always and next should distribute over a conjunction")
        void distribution() {
            Formula conjunction = ConnectiveFormula.and(P, Q);

            assertThat(conclusions(new AlwaysDistribution(), new TemporalFormula(TemporalOperator.ALWAYS, conjunction)))
                    .containsExactly(alwaysP, new TemporalFormula(TemporalOperator.ALWAYS, Q));
            assertThat(conclusions(new NextDistribution(), new TemporalFormula(TemporalOperator.NEXT, conjunction)))
                    .containsExactly(new TemporalFormula(TemporalOperator.NEXT, P),
                            new TemporalFormula(TemporalOperator.NEXT, Q));
        }

        @Test
        @DisplayName("an implication under always or next should carry its antecedent forward")
        void implication() {
            Formula alwaysImplies = new TemporalFormula(TemporalOperator.ALWAYS, ConnectiveFormula.implies(P, Q));
            Formula nextImplies = new TemporalFormula(TemporalOperator.NEXT, ConnectiveFormula.implies(P, Q));
            Formula nextP = new TemporalFormula(TemporalOperator.NEXT, P);
            Formula eventuallyP = new TemporalFormula(TemporalOperator.EVENTUALLY, P);

            assertThat(conclusions(new AlwaysImplication(), alwaysP, alwaysImplies))
                    .containsExactly(new TemporalFormula(TemporalOperator.ALWAYS, Q));
            assertThat(conclusions(new NextImplication(), nextP, nextImplies))
                    .containsExactly(new TemporalFormula(TemporalOperator.NEXT, Q));
            assertThat(conclusions(new EventuallyImplication(), eventuallyP, alwaysImplies))
                    .containsExactly(new TemporalFormula(TemporalOperator.EVENTUALLY, Q));
            assertThat(conclusions(new EventuallyImplication(), eventuallyP, nextImplies)).isEmpty();
        }

        @Test
        @DisplayName("a doubled always or eventually should collapse")
        void transitivity() {
            Formula eventuallyP = new TemporalFormula(TemporalOperator.EVENTUALLY, P);

            assertThat(conclusions(new AlwaysTransitive(), new TemporalFormula(TemporalOperator.ALWAYS, alwaysP)))
                    .containsExactly(alwaysP);
            assertThat(conclusions(new EventuallyTransitive(),
                    new TemporalFormula(TemporalOperator.EVENTUALLY, eventuallyP))).containsExactly(eventuallyP);
            assertThat(conclusions(new AlwaysTransitive(), alwaysP)).isEmpty();
        }
    }
}
