package com.dcec.reasoning;

/**
 * Terminal outcome of a proof attempt
 */
public enum ProofStatus {
    PROVED("Proved"),
    DISPROVED("Disproved"),
    TIMEOUT("Timeout"),
    UNKNOWN("Unknown"),
    ERROR("Error");

    private final String displayName;

    ProofStatus(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Outcomes that do not depend on the time budget or on a fault, and so
     * can be reused for the same goal and axioms.
     */
    public boolean isCacheable() {
        return this == PROVED || this == DISPROVED || this == UNKNOWN;
    }
}
