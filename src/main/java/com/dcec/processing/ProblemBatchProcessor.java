package com.dcec.processing;

import com.dcec.formula.Formula;
import com.dcec.output.ProofFormatter;
import com.dcec.output.ProofOutputService;
import com.dcec.parsing.DcecParseException;
import com.dcec.parsing.DcecParser;
import com.dcec.problem.ProblemService;
import com.dcec.problem.ProofProblem;
import com.dcec.reasoning.ProofAttempt;
import com.dcec.reasoning.TheoremProver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;

/**
 * Runs every problem file in a directory through the parser and the prover,
 * one at a time, writing each proof as soon as it is done. A file that fails
 * to load or parse is recorded as an error and the run continues.
 */
public class ProblemBatchProcessor implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProblemBatchProcessor.class);

    private final ProblemService problemService;
    private final DcecParser parser;
    private final TheoremProver prover;
    private final ProofOutputService outputService;
    private final boolean detailedLogging;
    private final PerformanceTracker performanceTracker = new PerformanceTracker();

    public ProblemBatchProcessor(ProblemService problemService, DcecParser parser, TheoremProver prover,
                                 ProofOutputService outputService, boolean detailedLogging) {
        this.problemService = problemService;
        this.parser = parser;
        this.prover = prover;
        this.outputService = outputService;
        this.detailedLogging = detailedLogging;
    }

    public BatchResult process(String problemsDirectory) {
        BatchResult result = new BatchResult();
        performanceTracker.start("total_processing");
        try {
            LOGGER.info("Processing problems from: {}", problemsDirectory);
            outputService.initialize();

            performanceTracker.start("file_discovery");
            List<Path> files = problemService.discoverProblemFiles(problemsDirectory);
            performanceTracker.end("file_discovery");
            result.setProblemsFound(files.size());

            if (files.isEmpty()) {
                LOGGER.warn("No problem files found in directory: {}", problemsDirectory);
                result.addWarning("No problem files found in " + problemsDirectory);
            }
            for (int i = 0; i < files.size(); i++) {
                LOGGER.info("Processing file {}/{}: {}", i + 1, files.size(), files.get(i).getFileName());
                processFile(files.get(i), result);
            }
            outputService.flush();
        } catch (Exception e) {
            LOGGER.error("Batch processing failed", e);
            result.setError("Processing failed: " + e.getMessage());
        } finally {
            result.setProcessingTimeMs(Math.max(performanceTracker.end("total_processing"), 0));
            performanceTracker.logSummary();
        }
        return result;
    }

    private void processFile(Path file, BatchResult result) {
        ProofProblem problem;
        try {
            performanceTracker.start("loading");
            problem = problemService.loadProblem(file);
        } catch (RuntimeException e) {
            LOGGER.warn("Failed to load problem from file {}: {}", file.getFileName(), e.getMessage());
            result.addError(file.getFileName() + ": " + e.getMessage());
            return;
        } finally {
            performanceTracker.end("loading");
        }

        Formula goal;
        List<Formula> axioms;
        try {
            performanceTracker.start("parsing");
            goal = parser.parseFormula(problem.getGoalText());
            axioms = parser.parseAll(problem.getAxiomTexts());
        } catch (DcecParseException e) {
            LOGGER.warn("Problem {} does not parse: {}", problem.getId(), e.getMessage());
            result.addError(problem.getId() + ": " + e.getMessage());
            outputService.writeFailure(problem.getId(), problem.getGoalText(), e.getMessage());
            return;
        } finally {
            performanceTracker.end("parsing");
        }

        performanceTracker.start("proving");
        ProofAttempt attempt = problem.getTimeout().isPresent()
                ? prover.prove(goal, axioms, problem.getTimeout().get())
                : prover.prove(goal, axioms);
        performanceTracker.end("proving");

        result.recordOutcome(attempt.getStatus(), attempt.isFromCache());
        outputService.writeProof(problem.getId(), attempt);
        LOGGER.info("Problem {}: {} in {} ms ({} steps)", problem.getId(), attempt.getStatus(),
                attempt.getElapsed().toMillis(), attempt.getProofTree().getStepCount());
        if (detailedLogging) {
            LOGGER.info("Proof of {}:\n{}", problem.getId(), ProofFormatter.format(attempt.getProofTree()));
        }
    }

    public PerformanceTracker getPerformanceTracker() {
        return performanceTracker;
    }

    @Override
    public void close() throws Exception {
        LOGGER.info("Closing ProblemBatchProcessor...");
        outputService.close();
        LOGGER.info("ProblemBatchProcessor closed successfully");
    }
}
