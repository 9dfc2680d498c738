package com.dcec.parsing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class LexicalNormalizerTest {

    @Nested
    @DisplayName("Separators")
    class SeparatorTests {

        @Test
        @DisplayName("should turn whitespace between words into commas")
        void wordsBecomeCommaSeparated() {
            assertThat(LexicalNormalizer.stripWhitespace("a and b")).isEqualTo("a,and,b");
        }

        @Test
        @DisplayName("should drop the space after a comma in an argument list")
        void argumentListSpacesCollapse() {
            assertThat(LexicalNormalizer.stripWhitespace("f(a, b)")).isEqualTo("f(a,b)");
        }

        @Test
        @DisplayName("should split operator symbols from their operands")
        void operatorSymbolsArePadded() {
            assertThat(LexicalNormalizer.stripWhitespace("P->Q")).isEqualTo("P,->,Q");
            assertThat(LexicalNormalizer.stripWhitespace("P∧Q")).isEqualTo("P,∧,Q");
        }

        @Test
        @DisplayName("should turn the dot after a quantified variable into a separator")
        void quantifierDotBecomesSeparator() {
            assertThat(LexicalNormalizer.stripWhitespace("∀x.P(x)")).isEqualTo("∀,x,P(x)");
        }

        @ParameterizedTest
        @ValueSource(strings = {"a and b", "P -> (Q and R)", "f(a, b)", "  (P , Q)  ", "¬(P ∨ Q)"})
        @DisplayName("should be idempotent")
        void stripWhitespaceIsIdempotent(String text) {
            String once = LexicalNormalizer.stripWhitespace(text);
            assertThat(LexicalNormalizer.stripWhitespace(once)).isEqualTo(once);
        }

        @Test
        @DisplayName("should remove separators next to parentheses")
        void collapseSeparatorsTrimsAroundParens() {
            assertThat(LexicalNormalizer.collapseSeparators(",(,a,,b,),")).isEqualTo("(a,b)");
            assertThat(LexicalNormalizer.collapseSeparators("(a)(b)")).isEqualTo("(a),(b)");
        }
    }

    @Test
    @DisplayName("should drop everything after the comment character")
    void stripComments() {
        assertThat(LexicalNormalizer.stripComments("P and Q ; why")).isEqualTo("P and Q ");
        assertThat(LexicalNormalizer.stripComments("; only a comment")).isEmpty();
        assertThat(LexicalNormalizer.stripComments("P")).isEqualTo("P");
    }

    @Nested
    @DisplayName("Parentheses")
    class ParenthesisTests {

        @Test
        @DisplayName("should compare opening and closing counts")
        void checkParens() {
            assertThat(LexicalNormalizer.checkParens("(a)(b)")).isTrue();
            assertThat(LexicalNormalizer.checkParens("((a)")).isFalse();
            assertThat(LexicalNormalizer.checkParens("a")).isTrue();
        }

        @Test
        @DisplayName("should find the matching close parenthesis")
        void matchingCloseParen() {
            assertThat(LexicalNormalizer.getMatchingCloseParen("(a(b)c)", 0)).isEqualTo(6);
            assertThat(LexicalNormalizer.getMatchingCloseParen("(a(b)c)", 2)).isEqualTo(4);
        }

        @Test
        @DisplayName("should return -1 when no parenthesis closes the group")
        void unmatchedParen() {
            assertThat(LexicalNormalizer.getMatchingCloseParen("((a)", 0)).isEqualTo(-1);
            assertThat(LexicalNormalizer.getMatchingCloseParen("a(b)", 0)).isEqualTo(-1);
        }

        @Test
        @DisplayName("should remove redundant pairs and wrap the whole text once")
        void consolidateParens() {
            assertThat(LexicalNormalizer.consolidateParens("((a,b))")).isEqualTo("(a,b)");
            assertThat(LexicalNormalizer.consolidateParens("a,b")).isEqualTo("(a,b)");
            assertThat(LexicalNormalizer.consolidateParens("(a),(b)")).isEqualTo("((a),(b))");
        }

        @ParameterizedTest
        @ValueSource(strings = {"((a,b))", "a,b", "(a),(b)", "(((P)))", "(f,(g,a),b)"})
        @DisplayName("consolidation should be idempotent")
        void consolidateIsIdempotent(String text) {
            String once = LexicalNormalizer.consolidateParens(text);
            assertThat(LexicalNormalizer.consolidateParens(once)).isEqualTo(once);
        }
    }
}
