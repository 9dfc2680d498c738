package com.dcec.reasoning;

import java.time.Duration;
import java.util.Objects;

/**
 * A proof tree together with how it was obtained.
 */
public class ProofAttempt {
    private final ProofTree proofTree;
    private final Duration elapsed;
    private final String strategyName;
    private final String errorMessage;
    private final boolean fromCache;

    public ProofAttempt(ProofTree proofTree, Duration elapsed, String strategyName, String errorMessage) {
        this(proofTree, elapsed, strategyName, errorMessage, false);
    }

    private ProofAttempt(ProofTree proofTree, Duration elapsed, String strategyName, String errorMessage,
                         boolean fromCache) {
        this.proofTree = Objects.requireNonNull(proofTree, "proofTree");
        this.elapsed = elapsed;
        this.strategyName = strategyName;
        this.errorMessage = errorMessage;
        this.fromCache = fromCache;
    }

    /**
     * The same attempt, flagged as served from the proof cache.
     */
    public ProofAttempt asCached() {
        return fromCache ? this : new ProofAttempt(proofTree, elapsed, strategyName, errorMessage, true);
    }

    public ProofTree getProofTree() { return proofTree; }
    public ProofStatus getStatus() { return proofTree.getStatus(); }
    public Duration getElapsed() { return elapsed; }
    public String getStrategyName() { return strategyName; }
    public String getErrorMessage() { return errorMessage; }
    public boolean isFromCache() { return fromCache; }

    public boolean isProved() {
        return proofTree.isProved();
    }

    @Override
    public String toString() {
        return String.format("ProofAttempt{status=%s, steps=%d, elapsedMs=%d, strategy=%s, cached=%s%s}",
                getStatus(), proofTree.getStepCount(), elapsed.toMillis(), strategyName, fromCache,
                errorMessage == null ? "" : ", error=" + errorMessage);
    }
}
