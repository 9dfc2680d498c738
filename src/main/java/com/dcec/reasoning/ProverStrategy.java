package com.dcec.reasoning;

import com.dcec.formula.Formula;

import java.time.Duration;
import java.util.List;

/**
 * A way of searching for a proof. Implementations return a terminal status
 * for every input and raise only for programmer errors.
 */
public interface ProverStrategy {

    String getName();

    ProofAttempt prove(Formula goal, List<Formula> axioms, Duration timeout);
}
