package com.dcec.problem;

import com.dcec.parsing.LexicalNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads {@code .dcec} problem files. Each non-blank line after comment
 * removal is an axiom, except a {@code goal:} line naming the goal and an
 * optional {@code timeout:} line giving the time budget in milliseconds. An
 * {@code axiom:} prefix is accepted and ignored.
 */
@Service
public class DefaultProblemService implements ProblemService {

    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultProblemService.class);

    public static final String PROBLEM_EXTENSION = ".dcec";

    private static final String GOAL_PREFIX = "goal:";
    private static final String TIMEOUT_PREFIX = "timeout:";
    private static final String AXIOM_PREFIX = "axiom:";

    @Override
    public List<Path> discoverProblemFiles(String directoryPath) {
        Path directory = Paths.get(directoryPath);
        if (!Files.isDirectory(directory)) {
            throw new RuntimeException("Directory does not exist or is not a directory: " + directoryPath);
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files.filter(Files::isRegularFile)
                    .filter(file -> file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(PROBLEM_EXTENSION))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new RuntimeException("Failed to list problem directory: " + directoryPath, e);
        }
    }

    @Override
    public ProofProblem loadProblem(Path problemFile) {
        List<String> lines;
        try {
            lines = Files.readAllLines(problemFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read problem file: " + problemFile, e);
        }

        String goal = null;
        Duration timeout = null;
        List<String> axioms = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = LexicalNormalizer.stripComments(lines.get(i)).trim();
            if (line.isEmpty()) {
                continue;
            }
            String lower = line.toLowerCase(Locale.ROOT);
            if (lower.startsWith(GOAL_PREFIX)) {
                if (goal != null) {
                    throw new IllegalArgumentException(problemFile.getFileName() + " line " + (i + 1)
                            + ": more than one goal");
                }
                goal = line.substring(GOAL_PREFIX.length()).trim();
            } else if (lower.startsWith(TIMEOUT_PREFIX)) {
                timeout = parseTimeout(line.substring(TIMEOUT_PREFIX.length()).trim(), problemFile, i + 1);
            } else if (lower.startsWith(AXIOM_PREFIX)) {
                axioms.add(line.substring(AXIOM_PREFIX.length()).trim());
            } else {
                axioms.add(line);
            }
        }
        if (goal == null || goal.isEmpty()) {
            throw new IllegalArgumentException(problemFile.getFileName() + ": no goal line");
        }

        ProofProblem problem = new ProofProblem(problemId(problemFile), problemFile, goal, axioms, timeout);
        LOGGER.debug("Loaded {}", problem);
        return problem;
    }

    private static Duration parseTimeout(String value, Path problemFile, int lineNumber) {
        try {
            long millis = Long.parseLong(value);
            if (millis < 0) {
                throw new IllegalArgumentException(problemFile.getFileName() + " line " + lineNumber
                        + ": negative timeout " + millis);
            }
            return Duration.ofMillis(millis);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(problemFile.getFileName() + " line " + lineNumber
                    + ": timeout is not a number of milliseconds: " + value, e);
        }
    }

    static String problemId(Path problemFile) {
        String name = problemFile.getFileName().toString();
        return name.toLowerCase(Locale.ROOT).endsWith(PROBLEM_EXTENSION)
                ? name.substring(0, name.length() - PROBLEM_EXTENSION.length())
                : name;
    }

    @Override
    public List<ProofProblem> loadProblems(String directoryPath) {
        LOGGER.info("Loading problems from directory: {}", directoryPath);
        List<ProofProblem> problems = new ArrayList<>();
        for (Path file : discoverProblemFiles(directoryPath)) {
            try {
                problems.add(loadProblem(file));
            } catch (RuntimeException e) {
                LOGGER.warn("Failed to load problem from file {}: {}", file.getFileName(), e.getMessage());
            }
        }
        LOGGER.info("Successfully loaded {} problems from directory", problems.size());
        return problems;
    }
}
