package com.dcec.reasoning;

import com.dcec.cache.ProofCache;
import com.dcec.formula.Formula;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Entry point for proving. Looks each request up once in the proof cache,
 * runs the configured strategy on a miss and caches outcomes that do not
 * depend on the time budget. Safe to call from several threads.
 */
public class TheoremProver implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(TheoremProver.class);

    private final ProverStrategy strategy;
    private final ProofCache proofCache;
    private final Duration defaultTimeout;

    private final AtomicLong totalProofs = new AtomicLong();
    private final AtomicLong proved = new AtomicLong();
    private final AtomicLong disproved = new AtomicLong();
    private final AtomicLong timeouts = new AtomicLong();
    private final AtomicLong unknown = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong totalTimeMs = new AtomicLong();
    private volatile boolean closed;

    public TheoremProver(ProverStrategy strategy, ProofCache proofCache, Duration defaultTimeout) {
        this.strategy = strategy;
        this.proofCache = proofCache;
        this.defaultTimeout = defaultTimeout;
    }

    public ProofAttempt prove(Formula goal, List<Formula> axioms) {
        return prove(goal, axioms, defaultTimeout);
    }

    /**
     * @throws IllegalStateException if the prover has been closed
     */
    public ProofAttempt prove(Formula goal, List<Formula> axioms, Duration timeout) {
        if (closed) {
            throw new IllegalStateException("TheoremProver has been closed");
        }
        List<Formula> axiomList = Collections.unmodifiableList(new ArrayList<>(axioms));
        Optional<ProofAttempt> cached = proofCache.get(goal, axiomList, strategy.getName());
        ProofAttempt attempt;
        if (cached.isPresent()) {
            cacheHits.incrementAndGet();
            attempt = cached.get().asCached();
            LOGGER.debug("Proof cache hit for {}", goal);
        } else {
            attempt = runStrategy(goal, axiomList, timeout);
            if (attempt.getStatus().isCacheable()) {
                proofCache.put(goal, axiomList, strategy.getName(), attempt);
            }
        }
        record(attempt);
        return attempt;
    }

    private ProofAttempt runStrategy(Formula goal, List<Formula> axioms, Duration timeout) {
        long start = System.nanoTime();
        try {
            ProofAttempt attempt = strategy.prove(goal, axioms, timeout);
            LOGGER.debug("Proved {} with {}: {}", goal, strategy.getName(), attempt.getStatus());
            return attempt;
        } catch (RuntimeException e) {
            LOGGER.error("Strategy {} failed on goal {}: {}", strategy.getName(), goal, e.getMessage(), e);
            ProofTree tree = new ProofTree(goal, axioms, Collections.emptyList(), ProofStatus.ERROR);
            return new ProofAttempt(tree, Duration.ofNanos(System.nanoTime() - start), strategy.getName(),
                    e.getMessage());
        }
    }

    private void record(ProofAttempt attempt) {
        totalProofs.incrementAndGet();
        totalTimeMs.addAndGet(attempt.isFromCache() ? 0 : attempt.getElapsed().toMillis());
        switch (attempt.getStatus()) {
            case PROVED:
                proved.incrementAndGet();
                break;
            case DISPROVED:
                disproved.incrementAndGet();
                break;
            case TIMEOUT:
                timeouts.incrementAndGet();
                break;
            case UNKNOWN:
                unknown.incrementAndGet();
                break;
            default:
                errors.incrementAndGet();
                break;
        }
    }

    public ProverStatistics getStatistics() {
        return new ProverStatistics(totalProofs.get(), proved.get(), disproved.get(), timeouts.get(),
                unknown.get(), errors.get(), cacheHits.get(), totalTimeMs.get());
    }

    public ProverStrategy getStrategy() {
        return strategy;
    }

    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            LOGGER.info("TheoremProver closed: {}", getStatistics());
        }
    }
}
