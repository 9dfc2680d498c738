package com.dcec.parsing;

import com.dcec.cache.CacheManager;
import com.dcec.formula.AtomicFormula;
import com.dcec.formula.ConnectiveFormula;
import com.dcec.formula.Formula;
import com.dcec.formula.QuantifiedFormula;
import com.dcec.namespace.Namespace;
import com.dcec.reasoning.ForwardChainingStrategy;
import com.dcec.reasoning.ProofAttempt;
import com.dcec.reasoning.ProofStatus;
import com.dcec.reasoning.rules.InferenceRuleRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DcecParserTest {

    private CacheManager cacheManager;
    private DcecParser parser;

    @BeforeEach
    void setUp() {
        cacheManager = new CacheManager(100, 100, Duration.ZERO);
        parser = new DcecParser(Namespace.seeded(), cacheManager);
    }

    @AfterEach
    void tearDown() {
        cacheManager.close();
    }

    @Nested
    @DisplayName("Parsing")
    class ParsingTests {

        @Test
        @DisplayName("a bare name should equal the proposition of that name")
        void propositionEquality() {
            assertThat(parser.parseFormula("P")).isEqualTo(AtomicFormula.proposition("P"));
        }

        @Test
        @DisplayName("should keep the token tree and source text alongside the formula")
        void keepsTokenAndText() {
            ParsedFormula parsed = parser.parse("P -> Q").orElseThrow();

            assertThat(parsed.getText()).isEqualTo("P -> Q");
            assertThat(parsed.getToken()).hasToString("(implies P Q)");
            assertThat(parsed.getFormula()).isInstanceOf(ConnectiveFormula.class);
        }

        @ParameterizedTest
        @ValueSource(strings = {"((P and Q) -> not(R))", "forall(x, P(x))", "believes(Alice, P)"})
        @DisplayName("rendering a parsed formula should give back the canonical text")
        void canonicalRoundTrip(String text) {
            Formula formula = parser.parseFormula(text);

            assertThat(formula.render()).isEqualTo(text);
            assertThat(parser.parseFormula(formula.render())).isEqualTo(formula);
        }

        @Test
        @DisplayName("should build a closed quantified formula")
        void quantifiedFormula() {
            Formula formula = parser.parseFormula("∀x.P(x)");

            assertThat(formula).isInstanceOf(QuantifiedFormula.class);
            assertThat(formula.isClosed()).isTrue();
        }

        @Test
        @DisplayName("should return nothing for text holding only a comment")
        void commentOnly() {
            assertThat(parser.parse("; nothing here")).isEmpty();
        }

        @Test
        @DisplayName("should return nothing when the operand count is wrong")
        void invalidOperandCount() {
            assertThat(parser.parse("(and P)")).isEmpty();
        }

        @Test
        @DisplayName("parseFormula should fail when nothing can be built")
        void parseFormulaFails() {
            assertThatThrownBy(() -> parser.parseFormula("(and P)"))
                    .isInstanceOf(DcecParseException.class)
                    .hasMessageContaining("No formula could be built");
        }

        @Test
        @DisplayName("should surface malformed text as a parse exception")
        void malformedText() {
            assertThatThrownBy(() -> parser.parse("(P and Q"))
                    .isInstanceOf(DcecParseException.class);
        }

        @Test
        @DisplayName("should reject any input language other than dcec")
        void unsupportedLanguage() {
            assertThatThrownBy(() -> parser.parse("P", "tptp"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("tptp");
        }

        @Test
        @DisplayName("should parse a list of texts in order")
        void parseAll() {
            List<Formula> formulas = parser.parseAll(Arrays.asList("P", "P -> Q"));

            assertThat(formulas).hasSize(2);
            assertThat(formulas.get(0).render()).isEqualTo("P");
            assertThat(formulas.get(1).render()).isEqualTo("(P -> Q)");
        }
    }

    @Nested
    @DisplayName("Caching")
    class CachingTests {

        @Test
        @DisplayName("a repeated parse should be served from the parse cache")
        void repeatedParseHitsCache() {
            ParsedFormula first = parser.parse("P and Q").orElseThrow();
            ParsedFormula second = parser.parse("P and Q").orElseThrow();

            assertThat(second).isSameAs(first);
            assertThat(cacheManager.getParseCache().getStats().getHits()).isEqualTo(1);
            assertThat(cacheManager.getParseCache().getStats().getMisses()).isEqualTo(1);
        }

        @Test
        @DisplayName("failed parses should not be cached")
        void failedParseNotCached() {
            parser.parse("(and P)");

            assertThat(cacheManager.getParseCache().size()).isZero();
        }

        @Test
        @DisplayName("equal formulas from different texts should share one instance")
        void interning() {
            Formula first = parser.parseFormula("P -> Q");
            Formula second = parser.parseFormula("implies(P, Q)");

            assertThat(second).isSameAs(first);
            assertThat(cacheManager.getInterner().getStats().getHits()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Constant sorts")
    class ConstantSortTests {

        @Test
        @DisplayName("a constant seen first as a term should build the same formula in later parses")
        void goalBeforeAxioms() {
            Formula goal = parser.parseFormula("P(A)");
            Formula fact = parser.parseFormula("A");
            ConnectiveFormula rule = (ConnectiveFormula) parser.parseFormula("A -> P(A)");

            assertThat(fact).isEqualTo(AtomicFormula.proposition("A"));
            assertThat(rule.getOperand(1)).isEqualTo(goal);
            assertThat(((AtomicFormula) goal).getArguments().get(0).getSort()).isEqualTo(Namespace.WILDCARD);
        }

        @Test
        @DisplayName("a goal parsed before its axioms should still be proved")
        void goalFirstIsProved() {
            Formula goal = parser.parseFormula("P(A)");
            List<Formula> axioms = parser.parseAll(Arrays.asList("A", "A -> P(A)"));

            ProofAttempt attempt = new ForwardChainingStrategy(InferenceRuleRegistry.createDefault(), 10)
                    .prove(goal, axioms, Duration.ofSeconds(5));

            assertThat(attempt.getStatus()).isEqualTo(ProofStatus.PROVED);
            assertThat(attempt.getProofTree().getStepCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("a constant keeps its first sort after the caches are cleared")
        void sortSurvivesClearedCaches() {
            Formula before = parser.parseFormula("Q(B) -> R");
            parser.parseFormula("B");
            cacheManager.clearAll();
            Formula after = parser.parseFormula("Q(B) -> R");

            assertThat(after).isEqualTo(before);
        }

        @Test
        @DisplayName("a proposition fixes the sort of the same name used as a term")
        void propositionFirst() {
            parser.parseFormula("C");
            AtomicFormula formula = (AtomicFormula) parser.parseFormula("P(C)");

            assertThat(formula.getArguments().get(0).getSort()).isEqualTo(Namespace.BOOLEAN);
            assertThat(parser.parseFormula("C -> P(C)")).isEqualTo(ConnectiveFormula.implies(
                    AtomicFormula.proposition("C"), formula));
        }
    }
}
