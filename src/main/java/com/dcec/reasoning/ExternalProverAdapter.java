package com.dcec.reasoning;

import com.dcec.formula.Formula;

import java.time.Duration;
import java.util.List;

/**
 * Bridge to an out-of-process theorem prover. Any failure is reported by
 * throwing a {@link RuntimeException}.
 */
public interface ExternalProverAdapter {

    String getName();

    /**
     * Whether the back end can be reached right now
     */
    boolean isAvailable();

    ExternalProofResult prove(Formula goal, List<Formula> axioms, Duration timeout);
}
