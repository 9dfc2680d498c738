package com.dcec.reasoning.rules;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InferenceRuleRegistryTest {

    @Test
    @DisplayName("the default registry should hold the propositional rules in priority order")
    void defaultRules() {
        List<InferenceRule> rules = InferenceRuleRegistry.createDefault().getRules();

        assertThat(rules).hasSize(21);
        assertThat(rules).extracting(InferenceRule::getName)
                .startsWith("Modus Ponens", "Simplification", "Modus Tollens")
                .contains("Conjunction Introduction", "Disjunction Introduction", "Exportation")
                .endsWith("Destructive Dilemma", "Contradiction Elimination");
        assertThat(rules).extracting(InferenceRule::getPriority).isSorted();
    }

    @Test
    @DisplayName("modal rules should follow every propositional rule")
    void modalRules() {
        InferenceRuleRegistry registry = InferenceRuleRegistry.createWithModalRules();

        assertThat(registry.size()).isEqualTo(44);
        assertThat(registry.getRules().get(21).getName()).isEqualTo("Knowledge Implies Truth");
        assertThat(registry.getRules()).extracting(InferenceRule::getPriority).isSorted();
        assertThat(registry.getRules().get(43).getName()).isEqualTo("Eventually Implication");
        assertThat(registry.getRule("Always Implies Next")).isPresent();
        assertThat(InferenceRuleRegistry.create(false).getRule("Always Implies Next")).isEmpty();
    }

    @Test
    @DisplayName("should reject a second rule with the same name")
    void duplicateName() {
        InferenceRuleRegistry registry = new InferenceRuleRegistry().register(new ModusPonens());

        assertThatThrownBy(() -> registry.register(new ModusPonens()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Modus Ponens");
    }

    @Test
    @DisplayName("rules with equal priority should keep their registration order")
    void stableOrder() {
        InferenceRuleRegistry registry = new InferenceRuleRegistry()
                .register(new NamedRule("Second", 5))
                .register(new NamedRule("First", 1))
                .register(new NamedRule("Third", 5));

        assertThat(registry.getRules()).extracting(InferenceRule::getName)
                .containsExactly("First", "Second", "Third");
    }

    @Test
    @DisplayName("the rule list handed out should be immutable")
    void immutableSnapshot() {
        List<InferenceRule> rules = InferenceRuleRegistry.createDefault().getRules();

        assertThatThrownBy(() -> rules.add(new ModusPonens()))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    private static class NamedRule extends BaseInferenceRule {

        NamedRule(String name, int priority) {
            super(name, priority);
        }

        @Override
        public boolean canApply(DerivationContext context) {
            return false;
        }

        @Override
        public List<Derivation> apply(DerivationContext context) {
            return Collections.emptyList();
        }
    }
}
