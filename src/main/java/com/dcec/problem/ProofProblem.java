package com.dcec.problem;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One goal with its axioms, as read from a problem file. Formulas are kept as
 * text until the batch runner parses them.
 */
public class ProofProblem {
    private final String id;
    private final Path sourceFile;
    private final String goalText;
    private final List<String> axiomTexts;
    private final Duration timeout;

    public ProofProblem(String id, Path sourceFile, String goalText, List<String> axiomTexts, Duration timeout) {
        this.id = Objects.requireNonNull(id, "id");
        this.sourceFile = sourceFile;
        this.goalText = Objects.requireNonNull(goalText, "goalText");
        this.axiomTexts = Collections.unmodifiableList(new ArrayList<>(axiomTexts));
        this.timeout = timeout;
    }

    public String getId() { return id; }
    public Path getSourceFile() { return sourceFile; }
    public String getGoalText() { return goalText; }
    public List<String> getAxiomTexts() { return axiomTexts; }

    /**
     * Per-problem time budget, when the file sets one
     */
    public Optional<Duration> getTimeout() {
        return Optional.ofNullable(timeout);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProofProblem that = (ProofProblem) o;
        return id.equals(that.id) && goalText.equals(that.goalText) && axiomTexts.equals(that.axiomTexts)
                && Objects.equals(timeout, that.timeout);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, goalText, axiomTexts, timeout);
    }

    @Override
    public String toString() {
        return "ProofProblem{" +
                "id='" + id + '\'' +
                ", goal='" + goalText + '\'' +
                ", axioms=" + axiomTexts.size() +
                ", timeout=" + timeout +
                '}';
    }
}
