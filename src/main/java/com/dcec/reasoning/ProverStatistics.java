package com.dcec.reasoning;

/**
 * Snapshot of a {@link TheoremProver}'s counters.
 */
public class ProverStatistics {
    private final long totalProofs;
    private final long proved;
    private final long disproved;
    private final long timeouts;
    private final long unknown;
    private final long errors;
    private final long cacheHits;
    private final long totalTimeMs;

    public ProverStatistics(long totalProofs, long proved, long disproved, long timeouts, long unknown,
                            long errors, long cacheHits, long totalTimeMs) {
        this.totalProofs = totalProofs;
        this.proved = proved;
        this.disproved = disproved;
        this.timeouts = timeouts;
        this.unknown = unknown;
        this.errors = errors;
        this.cacheHits = cacheHits;
        this.totalTimeMs = totalTimeMs;
    }

    public long getTotalProofs() { return totalProofs; }
    public long getProved() { return proved; }
    public long getDisproved() { return disproved; }
    public long getTimeouts() { return timeouts; }
    public long getUnknown() { return unknown; }
    public long getErrors() { return errors; }
    public long getCacheHits() { return cacheHits; }
    public long getTotalTimeMs() { return totalTimeMs; }

    public double getAverageTimeMs() {
        return totalProofs == 0 ? 0.0 : (double) totalTimeMs / totalProofs;
    }

    public double getSuccessRate() {
        return totalProofs == 0 ? 0.0 : (double) proved / totalProofs;
    }

    @Override
    public String toString() {
        return String.format("ProverStatistics{total=%d, proved=%d, disproved=%d, timeouts=%d, unknown=%d, " +
                        "errors=%d, cacheHits=%d, avgTimeMs=%.2f}",
                totalProofs, proved, disproved, timeouts, unknown, errors, cacheHits, getAverageTimeMs());
    }
}
