package com.dcec.output;

import com.dcec.formula.AtomicFormula;
import com.dcec.formula.ConnectiveFormula;
import com.dcec.formula.Formula;
import com.dcec.reasoning.ProofAttempt;
import com.dcec.reasoning.ProofStatus;
import com.dcec.reasoning.ProofStep;
import com.dcec.reasoning.ProofTree;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProofFormatterTest {

    private static final Formula P = AtomicFormula.proposition("P");
    private static final Formula Q = AtomicFormula.proposition("Q");
    private static final Formula P_IMPLIES_Q = ConnectiveFormula.implies(P, Q);

    static ProofTree modusPonens() {
        List<ProofStep> steps = Arrays.asList(
                new ProofStep(1, P, ProofStep.AXIOM, ProofStep.AXIOM, Collections.emptyList()),
                new ProofStep(2, P_IMPLIES_Q, ProofStep.AXIOM, ProofStep.AXIOM, Collections.emptyList()),
                new ProofStep(3, Q, "Modus Ponens", "Modus Ponens: 1, 2", Arrays.asList(1, 2)));
        return new ProofTree(Q, Arrays.asList(P, P_IMPLIES_Q), steps, ProofStatus.PROVED);
    }

    @Nested
    @DisplayName("Text")
    class TextTests {

        @Test
        @DisplayName("each step is numbered with its justification")
        void formatsTrail() {
            assertThat(ProofFormatter.format(modusPonens())).isEqualTo(
                    "Goal: Q\n" +
                            "Status: Proved\n" +
                            "  1. P  [Axiom]\n" +
                            "  2. (P -> Q)  [Axiom]\n" +
                            "  3. Q  [Modus Ponens: 1, 2]\n");
        }

        @Test
        @DisplayName("step numbers are right-aligned to the widest one")
        void alignsStepNumbers() {
            List<ProofStep> steps = new ArrayList<>();
            for (int i = 1; i <= 10; i++) {
                steps.add(new ProofStep(i, P, ProofStep.AXIOM, ProofStep.AXIOM, Collections.emptyList()));
            }
            String text = ProofFormatter.format(new ProofTree(Q, Collections.singletonList(P), steps,
                    ProofStatus.UNKNOWN));

            assertThat(text).contains("Status: Unknown\n")
                    .contains("   1. P  [Axiom]\n")
                    .contains("  10. P  [Axiom]\n");
        }

        @Test
        @DisplayName("an empty trail prints only the header")
        void emptyTrail() {
            ProofTree tree = new ProofTree(Q, Collections.emptyList(), Collections.emptyList(), ProofStatus.TIMEOUT);

            assertThat(ProofFormatter.format(tree)).isEqualTo("Goal: Q\nStatus: Timeout\n");
        }
    }

    @Nested
    @DisplayName("JSON")
    class JsonTests {

        private final ObjectMapper mapper = new ObjectMapper();

        @Test
        @DisplayName("the attempt and every step are serialized")
        void serializesAttempt() {
            ProofAttempt attempt = new ProofAttempt(modusPonens(), Duration.ofMillis(42), "forward-chaining", null);

            ObjectNode node = ProofFormatter.toJson(mapper, "modus", attempt);

            assertThat(node.get("problemId").asText()).isEqualTo("modus");
            assertThat(node.get("goal").asText()).isEqualTo("Q");
            assertThat(node.get("status").asText()).isEqualTo("PROVED");
            assertThat(node.get("strategy").asText()).isEqualTo("forward-chaining");
            assertThat(node.get("cached").asBoolean()).isFalse();
            assertThat(node.get("elapsedMs").asLong()).isEqualTo(42L);
            assertThat(node.has("error")).isFalse();

            JsonNode steps = node.get("steps");
            assertThat(steps).hasSize(3);
            JsonNode last = steps.get(2);
            assertThat(last.get("step").asInt()).isEqualTo(3);
            assertThat(last.get("formula").asText()).isEqualTo("Q");
            assertThat(last.get("rule").asText()).isEqualTo("Modus Ponens");
            assertThat(last.get("justification").asText()).isEqualTo("Modus Ponens: 1, 2");
            assertThat(last.get("premises").get(0).asInt()).isEqualTo(1);
            assertThat(last.get("premises").get(1).asInt()).isEqualTo(2);
            assertThat(steps.get(0).get("premises")).isEmpty();
        }

        @Test
        @DisplayName("a cached failed attempt carries its error")
        void serializesError() {
            ProofTree tree = new ProofTree(Q, Collections.emptyList(), Collections.emptyList(), ProofStatus.ERROR);
            ProofAttempt attempt = new ProofAttempt(tree, Duration.ZERO, "forward-chaining", "boom").asCached();

            ObjectNode node = ProofFormatter.toJson(mapper, "broken", attempt);

            assertThat(node.get("status").asText()).isEqualTo("ERROR");
            assertThat(node.get("cached").asBoolean()).isTrue();
            assertThat(node.get("error").asText()).isEqualTo("boom");
            assertThat(node.get("steps")).isEmpty();
        }
    }
}
