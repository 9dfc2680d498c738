package com.dcec.reasoning.rules;

import com.dcec.reasoning.rules.modal.AlwaysDistribution;
import com.dcec.reasoning.rules.modal.AlwaysElimination;
import com.dcec.reasoning.rules.modal.AlwaysImplication;
import com.dcec.reasoning.rules.modal.AlwaysImpliesEventually;
import com.dcec.reasoning.rules.modal.AlwaysImpliesNext;
import com.dcec.reasoning.rules.modal.AlwaysTransitive;
import com.dcec.reasoning.rules.modal.BeliefDistribution;
import com.dcec.reasoning.rules.modal.EventuallyImplication;
import com.dcec.reasoning.rules.modal.EventuallyTransitive;
import com.dcec.reasoning.rules.modal.ForbiddenAsObligatoryNegation;
import com.dcec.reasoning.rules.modal.ForbiddenToNotObligatory;
import com.dcec.reasoning.rules.modal.IntentionCommitment;
import com.dcec.reasoning.rules.modal.IntentionSideEffect;
import com.dcec.reasoning.rules.modal.KnowledgeDistribution;
import com.dcec.reasoning.rules.modal.KnowledgeImpliesBelief;
import com.dcec.reasoning.rules.modal.KnowledgeImpliesTruth;
import com.dcec.reasoning.rules.modal.NextDistribution;
import com.dcec.reasoning.rules.modal.NextImplication;
import com.dcec.reasoning.rules.modal.ObligationDistribution;
import com.dcec.reasoning.rules.modal.ObligationImplication;
import com.dcec.reasoning.rules.modal.ObligationImpliesPermission;
import com.dcec.reasoning.rules.modal.PerceptionImpliesKnowledge;
import com.dcec.reasoning.rules.modal.PermissionFromNonObligation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Inference rules by name, handed out in priority order. Rules with the same
 * priority keep their registration order. Registration is expected to finish
 * before proving starts; readers get an immutable snapshot.
 */
public class InferenceRuleRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(InferenceRuleRegistry.class);

    private final Map<String, InferenceRule> rules = new LinkedHashMap<>();
    private volatile List<InferenceRule> ordered = Collections.emptyList();

    public synchronized InferenceRuleRegistry register(InferenceRule rule) {
        if (rules.containsKey(rule.getName())) {
            throw new IllegalArgumentException("Inference rule already registered: " + rule.getName());
        }
        rules.put(rule.getName(), rule);
        List<InferenceRule> sorted = new ArrayList<>(rules.values());
        sorted.sort(Comparator.comparingInt(InferenceRule::getPriority));
        ordered = Collections.unmodifiableList(sorted);
        LOGGER.debug("Registered inference rule {} (priority {})", rule.getName(), rule.getPriority());
        return this;
    }

    public List<InferenceRule> getRules() {
        return ordered;
    }

    public synchronized Optional<InferenceRule> getRule(String name) {
        return Optional.ofNullable(rules.get(name));
    }

    public int size() {
        return ordered.size();
    }

    /**
     * The propositional rule set.
     */
    public static InferenceRuleRegistry createDefault() {
        InferenceRuleRegistry registry = new InferenceRuleRegistry();
        registry.register(new ModusPonens())                  // 10
                .register(new Simplification())               // 20
                .register(new ModusTollens())                 // 30
                .register(new DisjunctiveSyllogism())         // 40
                .register(new HypotheticalSyllogism())        // 50
                .register(new BiconditionalElimination())     // 60
                .register(new DoubleNegation())               // 70
                .register(new DeMorgan())                     // 80
                .register(new Resolution())                   // 90
                .register(new ConstructiveDilemma())          // 100
                .register(new BiconditionalIntroduction())    // 110
                .register(new ConjunctionIntroduction())      // 120
                .register(new DisjunctionIntroduction())      // 130
                .register(new ClaviusLaw())                   // 140
                .register(new Idempotence())                  // 145
                .register(new Absorption())                   // 150
                .register(new Exportation())                  // 155
                .register(new Transposition())                // 160
                .register(new MaterialImplication())          // 165
                .register(new DestructiveDilemma())           // 170
                .register(new ContradictionElimination());    // 180
        return registry;
    }

    /**
     * The propositional rules plus the cognitive, deontic and temporal axioms.
     */
    public static InferenceRuleRegistry createWithModalRules() {
        InferenceRuleRegistry registry = createDefault();
        registry.register(new KnowledgeImpliesTruth())
                .register(new KnowledgeImpliesBelief())
                .register(new BeliefDistribution())
                .register(new ObligationDistribution())
                .register(new ObligationImpliesPermission())
                .register(new ForbiddenAsObligatoryNegation())
                .register(new AlwaysElimination())
                .register(new AlwaysImpliesEventually())
                .register(new AlwaysImpliesNext())
                .register(new PerceptionImpliesKnowledge())
                .register(new KnowledgeDistribution())
                .register(new IntentionCommitment())
                .register(new IntentionSideEffect())
                .register(new ForbiddenToNotObligatory())
                .register(new ObligationImplication())
                .register(new PermissionFromNonObligation())
                .register(new AlwaysDistribution())
                .register(new AlwaysImplication())
                .register(new AlwaysTransitive())
                .register(new EventuallyTransitive())
                .register(new NextDistribution())
                .register(new NextImplication())
                .register(new EventuallyImplication());
        return registry;
    }

    public static InferenceRuleRegistry create(boolean modalRulesEnabled) {
        InferenceRuleRegistry registry = modalRulesEnabled ? createWithModalRules() : createDefault();
        LOGGER.info("Inference rule registry created with {} rules (modal rules {})",
                registry.size(), modalRulesEnabled ? "enabled" : "disabled");
        return registry;
    }
}
