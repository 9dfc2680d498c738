package com.dcec.problem;

import java.nio.file.Path;
import java.util.List;

public interface ProblemService {
    /**
     * Problem files in a directory, sorted by name
     */
    List<Path> discoverProblemFiles(String directoryPath);

    /**
     * Read a single problem file
     */
    ProofProblem loadProblem(Path problemFile);

    /**
     * Read every problem in a directory, skipping files that fail to load
     */
    List<ProofProblem> loadProblems(String directoryPath);
}
