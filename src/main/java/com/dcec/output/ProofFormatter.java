package com.dcec.output;

import com.dcec.reasoning.ProofAttempt;
import com.dcec.reasoning.ProofStep;
import com.dcec.reasoning.ProofTree;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Renders proofs as plain text and as JSON objects.
 */
public class ProofFormatter {

    /**
     * One line per step, numbered, with the justification in brackets:
     * <pre>
     * Goal: Q
     * Status: Proved
     *   1. P  [Axiom]
     *   2. (P -> Q)  [Axiom]
     *   3. Q  [Modus Ponens: 1, 2]
     * </pre>
     */
    public static String format(ProofTree tree) {
        StringBuilder text = new StringBuilder();
        text.append("Goal: ").append(tree.getGoal().render()).append('\n');
        text.append("Status: ").append(tree.getStatus().getDisplayName()).append('\n');
        int width = String.valueOf(tree.getStepCount()).length();
        for (ProofStep step : tree.getSteps()) {
            text.append("  ")
                    .append(String.format("%" + width + "d", step.getStepNumber()))
                    .append(". ")
                    .append(step.getFormula().render())
                    .append("  [")
                    .append(step.getJustification())
                    .append("]\n");
        }
        return text.toString();
    }

    public static ObjectNode toJson(ObjectMapper mapper, String problemId, ProofAttempt attempt) {
        ProofTree tree = attempt.getProofTree();
        ObjectNode node = mapper.createObjectNode();
        node.put("problemId", problemId);
        node.put("goal", tree.getGoal().render());
        node.put("status", attempt.getStatus().name());
        node.put("strategy", attempt.getStrategyName());
        node.put("cached", attempt.isFromCache());
        node.put("elapsedMs", attempt.getElapsed().toMillis());
        if (attempt.getErrorMessage() != null) {
            node.put("error", attempt.getErrorMessage());
        }
        ArrayNode steps = node.putArray("steps");
        for (ProofStep step : tree.getSteps()) {
            ObjectNode stepNode = steps.addObject();
            stepNode.put("step", step.getStepNumber());
            stepNode.put("formula", step.getFormula().render());
            stepNode.put("rule", step.getRuleName());
            stepNode.put("justification", step.getJustification());
            ArrayNode premises = stepNode.putArray("premises");
            step.getPremises().forEach(premises::add);
        }
        return node;
    }
}
