package com.dcec.cache;

import com.dcec.formula.AtomicFormula;
import com.dcec.formula.ConnectiveFormula;
import com.dcec.formula.Formula;
import com.dcec.reasoning.ProofAttempt;
import com.dcec.reasoning.ProofStatus;
import com.dcec.reasoning.ProofTree;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProofCacheTest {

    private static final Formula P = AtomicFormula.proposition("P");
    private static final Formula Q = AtomicFormula.proposition("Q");
    private static final Formula P_IMPLIES_Q = ConnectiveFormula.implies(P, Q);

    private final ProofCache cache = new ProofCache(10, Duration.ZERO);

    private static ProofAttempt attempt(ProofStatus status) {
        ProofTree tree = new ProofTree(Q, Arrays.asList(P, P_IMPLIES_Q), Collections.emptyList(), status);
        return new ProofAttempt(tree, Duration.ofMillis(3), "forward-chaining", null);
    }

    @Test
    @DisplayName("the key should not depend on axiom order")
    void axiomOrder() {
        assertThat(ProofCache.key(Q, Arrays.asList(P, P_IMPLIES_Q), "s"))
                .isEqualTo(ProofCache.key(Q, Arrays.asList(P_IMPLIES_Q, P), "s"));
    }

    @Test
    @DisplayName("the key should distinguish goal, axioms and strategy")
    void keyDistinguishes() {
        List<Formula> axioms = Arrays.asList(P, P_IMPLIES_Q);
        String base = ProofCache.key(Q, axioms, "s");

        assertThat(ProofCache.key(P, axioms, "s")).isNotEqualTo(base);
        assertThat(ProofCache.key(Q, Collections.singletonList(P), "s")).isNotEqualTo(base);
        assertThat(ProofCache.key(Q, axioms, "other")).isNotEqualTo(base);
        assertThat(base).hasSize(64);
    }

    @Test
    @DisplayName("a stored attempt should be found again under the same request")
    void putAndGet() {
        ProofAttempt stored = attempt(ProofStatus.PROVED);
        cache.put(Q, Arrays.asList(P, P_IMPLIES_Q), "forward-chaining", stored);

        assertThat(cache.get(Q, Arrays.asList(P_IMPLIES_Q, P), "forward-chaining")).containsSame(stored);
        assertThat(cache.get(Q, Arrays.asList(P, P_IMPLIES_Q), "external:vampire")).isEmpty();
        assertThat(cache.getStats().getHits()).isEqualTo(1);
        assertThat(cache.getStats().getMisses()).isEqualTo(1);
    }

    @Test
    @DisplayName("contains should not count as a lookup")
    void containsIsNotALookup() {
        cache.put(Q, Collections.singletonList(P), "s", attempt(ProofStatus.UNKNOWN));

        assertThat(cache.contains(Q, Collections.singletonList(P), "s")).isTrue();
        assertThat(cache.getStats().getRequests()).isZero();
    }

    @Test
    @DisplayName("entries should expire after the time-to-live")
    void expiry() {
        MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        ProofCache expiring = new ProofCache(10, Duration.ofMinutes(1), clock);
        expiring.put(Q, Collections.singletonList(P), "s", attempt(ProofStatus.PROVED));

        clock.advance(Duration.ofMinutes(2));

        assertThat(expiring.get(Q, Collections.singletonList(P), "s")).isEmpty();
    }
}
