package com.vidnyan.playscan.application.service;

import com.vidnyan.playscan.domain.graph.ProgramDependenceGraph;
import com.vidnyan.playscan.domain.rule.EvaluationContext;
import com.vidnyan.playscan.domain.rule.EvaluationResult;
import com.vidnyan.playscan.domain.rule.Finding;
import com.vidnyan.playscan.domain.rule.RuleDefinition;
import com.vidnyan.playscan.domain.rule.SmellDetector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs smell detectors over a finished graph.
 *
 * <p>Each rule is matched to the first detector that supports it. Detectors run one after the
 * other on the same immutable graph and never see each other's findings; a detector that throws
 * yields an ERROR result for its rule and the remaining rules still run.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GaselRuleEngine {

    private final List<SmellDetector> detectors;

    public List<EvaluationResult> run(ProgramDependenceGraph graph, List<RuleDefinition> rules) {
        List<EvaluationResult> results = new ArrayList<>();
        for (RuleDefinition rule : rules) {
            Optional<SmellDetector> detector = findDetector(rule);
            if (detector.isEmpty()) {
                log.warn("No detector found for rule: {}", rule.id());
                results.add(EvaluationResult.skipped(rule.id(), "No detector available"));
                continue;
            }
            try {
                EvaluationResult result = detector.get().evaluate(EvaluationContext.of(rule, graph));
                results.add(result);
                if (result.hasFindings()) {
                    log.info("  {} found {} findings in {}", rule.id(), result.findingCount(), graph.unitName());
                }
            } catch (RuntimeException e) {
                log.error("Error evaluating rule {} on {}: {}", rule.id(), graph.unitName(), e.getMessage(), e);
                results.add(EvaluationResult.error(rule.id(), e.getMessage()));
            }
        }
        return results;
    }

    /**
     * All findings of the results in report order.
     */
    public static List<Finding> findings(List<EvaluationResult> results) {
        return results.stream()
                .flatMap(r -> r.findings().stream())
                .sorted(Finding.ORDER)
                .toList();
    }

    public List<SmellDetector> detectors() {
        return List.copyOf(detectors);
    }

    private Optional<SmellDetector> findDetector(RuleDefinition rule) {
        return detectors.stream()
                .filter(d -> d.supports(rule))
                .findFirst();
    }
}
