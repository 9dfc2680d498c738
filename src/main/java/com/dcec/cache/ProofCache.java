package com.dcec.cache;

import com.dcec.formula.Formula;
import com.dcec.reasoning.ProofAttempt;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Proof results keyed by goal, axiom set and strategy. Axiom order does not
 * affect the key.
 */
public class ProofCache {
    private final LruCache<String, ProofAttempt> cache;

    public ProofCache(int maxSize, Duration ttl) {
        this.cache = new LruCache<>("proof-cache", maxSize, ttl);
    }

    public ProofCache(int maxSize, Duration ttl, Clock clock) {
        this.cache = new LruCache<>("proof-cache", maxSize, ttl, clock);
    }

    public static String key(Formula goal, List<Formula> axioms, String strategyName) {
        List<String> axiomTexts = new ArrayList<>(axioms.size());
        for (Formula axiom : axioms) {
            axiomTexts.add(axiom.render());
        }
        Collections.sort(axiomTexts);
        List<String> parts = new ArrayList<>(axiomTexts.size() + 2);
        parts.add(goal.render());
        parts.add(strategyName);
        parts.addAll(axiomTexts);
        return CacheKeys.sha256(parts);
    }

    /**
     * One lookup, counted as exactly one hit or one miss.
     */
    public Optional<ProofAttempt> get(Formula goal, List<Formula> axioms, String strategyName) {
        return cache.get(key(goal, axioms, strategyName));
    }

    public void put(Formula goal, List<Formula> axioms, String strategyName, ProofAttempt attempt) {
        cache.put(key(goal, axioms, strategyName), attempt);
    }

    public boolean contains(Formula goal, List<Formula> axioms, String strategyName) {
        return cache.containsKey(key(goal, axioms, strategyName));
    }

    public void clear() {
        cache.clear();
    }

    public int size() {
        return cache.size();
    }

    public CacheStats getStats() {
        return cache.getStats();
    }
}
