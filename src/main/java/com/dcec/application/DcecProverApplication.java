package com.dcec.application;

import com.dcec.config.DcecProperties;
import com.dcec.output.StreamingProofOutputService;
import com.dcec.parsing.DcecParser;
import com.dcec.problem.ProblemService;
import com.dcec.processing.BatchResult;
import com.dcec.processing.ProblemBatchProcessor;
import com.dcec.reasoning.ProofStatus;
import com.dcec.reasoning.TheoremProver;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Batch DCEC prover: reads every problem file in a directory, proves it and
 * writes the proofs. Argument 0 overrides the problems directory, argument 1
 * the output directory.
 */
@SpringBootApplication(scanBasePackages = "com.dcec")
@EnableConfigurationProperties(DcecProperties.class)
public class DcecProverApplication implements CommandLineRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(DcecProverApplication.class);

    @Autowired
    private DcecProperties config;

    @Autowired
    private ProblemService problemService;

    @Autowired
    private DcecParser parser;

    @Autowired
    private TheoremProver prover;

    private ProblemBatchProcessor processor;

    public static void main(String[] args) {
        SpringApplication.run(DcecProverApplication.class, args);
    }

    @Override
    public void run(String... args) throws Exception {
        if (args.length > 0) {
            config.setProblemsDirectory(args[0]);
        }
        if (args.length > 1) {
            config.setOutputDirectory(args[1]);
        }

        LOGGER.info("=== DCEC Prover ===");
        logConfiguration();

        processor = new ProblemBatchProcessor(problemService, parser, prover,
                new StreamingProofOutputService(config.getOutputDirectory()), config.isEnableDetailedLogging());
        try {
            BatchResult result = processor.process(config.getProblemsDirectory());
            logResults(result);
        } catch (Exception e) {
            LOGGER.error("Processing failed", e);
            throw e;
        } finally {
            processor.close();
        }
    }

    private void logConfiguration() {
        LOGGER.info("Configuration:");
        LOGGER.info("  Problems directory: {}", config.getProblemsDirectory());
        LOGGER.info("  Output directory: {}", config.getOutputDirectory());
        LOGGER.info("  Strategy: {}", prover.getStrategy().getName());
        LOGGER.info("  Default timeout: {} ms", config.getProverTimeoutMs());
        LOGGER.info("  Max passes: {}", config.getMaxPasses());
        LOGGER.info("  Modal rules: {}", config.isModalRulesEnabled() ? "enabled" : "disabled");
    }

    private void logResults(BatchResult result) {
        LOGGER.info("=== PROCESSING COMPLETED ===");
        LOGGER.info("  Problem files found: {}", result.getProblemsFound());
        LOGGER.info("  Problems proved/attempted: {}/{}",
                result.getCount(ProofStatus.PROVED), result.getProblemsProcessed());
        for (ProofStatus status : ProofStatus.values()) {
            LOGGER.info("  {}: {}", status.getDisplayName(), result.getCount(status));
        }
        LOGGER.info("  Proof cache hits: {}", result.getCacheHits());
        LOGGER.info("  Processing time: {} ms", result.getProcessingTimeMs());
        LOGGER.info("  Prover statistics: {}", prover.getStatistics());
        LOGGER.info("  Success: {}", result.isSuccess());

        if (result.getErrorMessage() != null) {
            LOGGER.error("Run failed: {}", result.getErrorMessage());
        }
        if (result.hasErrors()) {
            LOGGER.warn("Errors encountered ({}): ", result.getErrorCount());
            result.getErrors().forEach(error -> LOGGER.warn("  - {}", error));
        }
    }

    @PreDestroy
    public void cleanup() {
        if (processor == null) {
            return;
        }
        try {
            LOGGER.info("Shutting down processor...");
            processor.close();
        } catch (Exception e) {
            LOGGER.warn("Error during cleanup: {}", e.getMessage());
        }
    }
}
