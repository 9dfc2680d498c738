package com.dcec.reasoning.rules;

import java.util.List;

public interface InferenceRule {
    /**
     * Name recorded in proof steps derived by this rule
     */
    String getName();

    /**
     * Cheap check whether the rule could fire on the current formulas
     */
    boolean canApply(DerivationContext context);

    /**
     * All conclusions the rule draws from the current formulas, with premises
     */
    List<Derivation> apply(DerivationContext context);

    /**
     * Get the priority of this rule (lower numbers run first)
     */
    default int getPriority() {
        return 100;
    }
}
