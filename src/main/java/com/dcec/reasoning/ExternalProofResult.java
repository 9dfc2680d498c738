package com.dcec.reasoning;

/**
 * What an external prover reports back: whether it found a proof, how many
 * steps it took and how long it ran.
 */
public class ExternalProofResult {
    private final boolean proved;
    private final int steps;
    private final double timeSeconds;

    public ExternalProofResult(boolean proved, int steps, double timeSeconds) {
        this.proved = proved;
        this.steps = steps;
        this.timeSeconds = timeSeconds;
    }

    public boolean isProved() { return proved; }
    public int getSteps() { return steps; }
    public double getTimeSeconds() { return timeSeconds; }

    @Override
    public String toString() {
        return "ExternalProofResult{proved=" + proved + ", steps=" + steps + ", timeSeconds=" + timeSeconds + '}';
    }
}
