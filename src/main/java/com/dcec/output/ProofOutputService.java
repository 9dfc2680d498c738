package com.dcec.output;

import com.dcec.reasoning.ProofAttempt;

import java.io.IOException;

public interface ProofOutputService {
    void initialize() throws IOException;

    void writeProof(String problemId, ProofAttempt attempt);

    /**
     * Record a problem that never reached the prover, e.g. because its text did not parse
     */
    void writeFailure(String problemId, String goalText, String errorMessage);

    long getWrittenCount();

    void flush();

    void close() throws IOException;
}
