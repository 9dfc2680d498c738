package com.dcec.processing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Wall-clock timings for named phases of a batch run. Repeated phases
 * accumulate: a phase timed once per problem reports its total.
 */
public class PerformanceTracker {
    private static final Logger LOGGER = LoggerFactory.getLogger(PerformanceTracker.class);

    private final Map<String, Long> startTimes = new ConcurrentHashMap<>();
    private final Map<String, Long> totals = new ConcurrentHashMap<>();
    private final Map<String, Integer> counts = new ConcurrentHashMap<>();

    public void start(String phase) {
        startTimes.put(phase, System.nanoTime());
        LOGGER.debug("Started timing phase: {}", phase);
    }

    /**
     * Stop timing {@code phase} and add the elapsed time to its total.
     *
     * @return elapsed milliseconds, or -1 when the phase was never started
     */
    public long end(String phase) {
        Long startTime = startTimes.remove(phase);
        if (startTime == null) {
            LOGGER.warn("No start time found for phase: {}", phase);
            return -1;
        }
        long elapsedMs = (System.nanoTime() - startTime) / 1_000_000;
        totals.merge(phase, elapsedMs, Long::sum);
        counts.merge(phase, 1, Integer::sum);
        LOGGER.debug("Completed phase '{}' in {} ms", phase, elapsedMs);
        return elapsedMs;
    }

    public long getDuration(String phase) {
        return totals.getOrDefault(phase, 0L);
    }

    public int getCount(String phase) {
        return counts.getOrDefault(phase, 0);
    }

    /**
     * Totals per phase, longest first
     */
    public Map<String, Long> getDurations() {
        Map<String, Long> sorted = new LinkedHashMap<>();
        totals.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed())
                .forEach(entry -> sorted.put(entry.getKey(), entry.getValue()));
        return Collections.unmodifiableMap(sorted);
    }

    public void logSummary() {
        LOGGER.info("=== Performance Summary ===");
        getDurations().forEach((phase, total) ->
                LOGGER.info("{}: {} ms over {} run(s)", phase, total, getCount(phase)));
    }

    public void clear() {
        startTimes.clear();
        totals.clear();
        counts.clear();
    }
}
