package com.vidnyan.playscan.application.port.in;

import com.vidnyan.playscan.domain.error.Diagnostic;
import com.vidnyan.playscan.domain.graph.AnalysisUnit;
import com.vidnyan.playscan.domain.rule.EvaluationResult;
import com.vidnyan.playscan.domain.rule.Finding;
import com.vidnyan.playscan.domain.rule.RuleDefinition;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Primary use case: scan a project's playbooks and roles for security smells.
 * This is the main entry point to the application.
 */
public interface AnalyzePlaybookUseCase {

    /**
     * Analyze every unit of a project and return all findings.
     * @param request Analysis request parameters
     * @return Analysis result with findings and per-unit outcome
     */
    AnalysisResult analyze(AnalysisRequest request);

    /**
     * Analysis request parameters.
     */
    record AnalysisRequest(
        Path projectPath,
        List<String> ruleIds,           // Empty = all enabled rules
        Map<String, Object> extraVars
    ) {
        public AnalysisRequest {
            ruleIds = ruleIds == null ? List.of() : List.copyOf(ruleIds);
            extraVars = extraVars == null ? Map.of() : Map.copyOf(extraVars);
        }

        public static AnalysisRequest forPath(Path path) {
            return new AnalysisRequest(path, List.of(), Map.of());
        }
    }

    /**
     * Analysis result.
     */
    record AnalysisResult(
        List<Finding> findings,
        List<UnitResult> unitResults,
        List<EvaluationResult> ruleResults,
        AnalysisStats stats
    ) {
        public boolean hasCriticalFindings() {
            return findings.stream()
                    .anyMatch(f -> f.severity() == RuleDefinition.Severity.BLOCKER);
        }

        public int findingCount(RuleDefinition.Severity severity) {
            return (int) findings.stream()
                    .filter(f -> f.severity() == severity)
                    .count();
        }

        public List<UnitResult> failedUnits() {
            return unitResults.stream()
                    .filter(u -> u.status() == UnitStatus.FAILED)
                    .toList();
        }
    }

    enum UnitStatus {
        SUCCEEDED,
        FAILED
    }

    /**
     * Outcome of one playbook or role.
     */
    record UnitResult(
        String unitName,
        AnalysisUnit.UnitType type,
        UnitStatus status,
        int findingCount,
        int nodeCount,
        int edgeCount,
        List<Diagnostic> diagnostics,
        String errorMessage
    ) {}

    /**
     * Analysis statistics.
     */
    record AnalysisStats(
        int unitsAnalyzed,
        int unitsFailed,
        int nodesAnalyzed,
        int rulesEvaluated,
        long totalDurationMs
    ) {}
}
