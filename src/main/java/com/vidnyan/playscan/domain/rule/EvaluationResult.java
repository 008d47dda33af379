package com.vidnyan.playscan.domain.rule;

import java.time.Duration;
import java.util.List;

/**
 * Result of evaluating one rule against one graph.
 */
public record EvaluationResult(
    String ruleId,
    List<Finding> findings,
    Duration executionTime,
    int nodesAnalyzed,
    EvaluationStatus status,
    String errorMessage
) {

    public enum EvaluationStatus {
        SUCCESS,
        ERROR,
        SKIPPED
    }

    public EvaluationResult {
        findings = List.copyOf(findings);
    }

    /**
     * Create a successful result.
     */
    public static EvaluationResult success(String ruleId, List<Finding> findings,
                                           Duration duration, int nodes) {
        return new EvaluationResult(ruleId, findings, duration, nodes,
                EvaluationStatus.SUCCESS, null);
    }

    /**
     * Create an error result.
     */
    public static EvaluationResult error(String ruleId, String message) {
        return new EvaluationResult(ruleId, List.of(), Duration.ZERO, 0,
                EvaluationStatus.ERROR, message);
    }

    /**
     * Create a skipped result.
     */
    public static EvaluationResult skipped(String ruleId, String reason) {
        return new EvaluationResult(ruleId, List.of(), Duration.ZERO, 0,
                EvaluationStatus.SKIPPED, reason);
    }

    public boolean hasFindings() {
        return !findings.isEmpty();
    }

    public int findingCount() {
        return findings.size();
    }
}
