package com.dcec.processing;

import com.dcec.reasoning.ProofStatus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Outcome of one batch run: how many problems were found and proved, the
 * status breakdown, and per-file errors.
 */
public class BatchResult {
    private final AtomicLong problemsFound = new AtomicLong(0);
    private final AtomicLong problemsProcessed = new AtomicLong(0);
    private final AtomicLong cacheHits = new AtomicLong(0);
    private final Map<ProofStatus, AtomicLong> statusCounts = new EnumMap<>(ProofStatus.class);

    private final List<String> errors = Collections.synchronizedList(new ArrayList<>());
    private final List<String> warnings = Collections.synchronizedList(new ArrayList<>());
    private volatile String errorMessage;
    private volatile long processingTimeMs;

    public BatchResult() {
        for (ProofStatus status : ProofStatus.values()) {
            statusCounts.put(status, new AtomicLong(0));
        }
    }

    public long getProblemsFound() {
        return problemsFound.get();
    }

    public void setProblemsFound(long count) {
        problemsFound.set(count);
    }

    public long getProblemsProcessed() {
        return problemsProcessed.get();
    }

    public void recordOutcome(ProofStatus status, boolean fromCache) {
        problemsProcessed.incrementAndGet();
        statusCounts.get(status).incrementAndGet();
        if (fromCache) {
            cacheHits.incrementAndGet();
        }
    }

    public long getCount(ProofStatus status) {
        return statusCounts.get(status).get();
    }

    public long getCacheHits() {
        return cacheHits.get();
    }

    public List<String> getErrors() {
        synchronized (errors) {
            return new ArrayList<>(errors);
        }
    }

    public void addError(String error) {
        errors.add(error);
    }

    public List<String> getWarnings() {
        synchronized (warnings) {
            return new ArrayList<>(warnings);
        }
    }

    public void addWarning(String warning) {
        warnings.add(warning);
    }

    /**
     * A run-level failure, such as a missing problem directory
     */
    public void setError(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public boolean isSuccess() {
        return errorMessage == null && errors.isEmpty();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public int getErrorCount() {
        return errors.size();
    }

    public long getProcessingTimeMs() {
        return processingTimeMs;
    }

    public void setProcessingTimeMs(long processingTimeMs) {
        this.processingTimeMs = processingTimeMs;
    }

    @Override
    public String toString() {
        return String.format("BatchResult{success=%s, found=%d, processed=%d, proved=%d, disproved=%d, " +
                        "timeouts=%d, unknown=%d, errors=%d, cacheHits=%d, fileErrors=%d, timeMs=%d}",
                isSuccess(), problemsFound.get(), problemsProcessed.get(),
                getCount(ProofStatus.PROVED), getCount(ProofStatus.DISPROVED), getCount(ProofStatus.TIMEOUT),
                getCount(ProofStatus.UNKNOWN), getCount(ProofStatus.ERROR), cacheHits.get(),
                errors.size(), processingTimeMs);
    }
}
