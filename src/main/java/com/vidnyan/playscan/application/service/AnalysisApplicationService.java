package com.vidnyan.playscan.application.service;

import com.vidnyan.playscan.AnalysisProperties;
import com.vidnyan.playscan.application.port.in.AnalyzePlaybookUseCase;
import com.vidnyan.playscan.application.port.out.RawTreeLoader;
import com.vidnyan.playscan.application.port.out.RoleResolver;
import com.vidnyan.playscan.application.port.out.RuleRepository;
import com.vidnyan.playscan.application.port.out.UnitDiscovery;
import com.vidnyan.playscan.domain.error.AnalysisException;
import com.vidnyan.playscan.domain.graph.AnalysisUnit;
import com.vidnyan.playscan.domain.graph.PdgBuildResult;
import com.vidnyan.playscan.domain.graph.PdgBuilder;
import com.vidnyan.playscan.domain.graph.ProgramDependenceGraph;
import com.vidnyan.playscan.domain.graph.ScriptSource;
import com.vidnyan.playscan.domain.rule.EvaluationResult;
import com.vidnyan.playscan.domain.rule.Finding;
import com.vidnyan.playscan.domain.rule.RuleDefinition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

/**
 * Main application service that orchestrates the analysis workflow.
 * Implements the primary use case.
 *
 * <p>Units are independent: each one is built and checked on a worker thread with its own
 * builder state, and a failing unit is reported without stopping the others.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisApplicationService implements AnalyzePlaybookUseCase {

    private final UnitDiscovery unitDiscovery;
    private final RawTreeLoader rawTreeLoader;
    private final RoleResolver roleResolver;
    private final RuleRepository ruleRepository;
    private final GaselRuleEngine ruleEngine;
    private final PdgBuilder pdgBuilder;
    private final AnalysisProperties properties;

    @Override
    public AnalysisResult analyze(AnalysisRequest request) {
        Instant startTime = Instant.now();
        log.info("Starting analysis of: {}", request.projectPath());

        // Step 1: Discover playbooks and roles
        log.info("Step 1: Discovering units...");
        List<UnitDiscovery.DiscoveredUnit> discovered;
        try {
            discovered = unitDiscovery.discover(request.projectPath());
        } catch (IOException e) {
            throw new AnalysisException("Cannot scan project " + request.projectPath() + ": " + e.getMessage(), e);
        }
        log.info("Found {} units", discovered.size());

        // Step 2: Load rules
        log.info("Step 2: Loading rules...");
        List<RuleDefinition> rules = selectRules(request);
        log.info("Loaded {} rules", rules.size());

        // Step 3: Build graphs and run detectors
        log.info("Step 3: Analyzing units...");
        Map<String, Object> extraVars = new LinkedHashMap<>(properties.getExtraVars());
        extraVars.putAll(request.extraVars());
        ScriptSource source = new PortScriptSource(rawTreeLoader, roleResolver);
        List<UnitOutcome> outcomes = analyzeAll(discovered, source, extraVars, rules);

        List<Finding> findings = new ArrayList<>();
        List<UnitResult> unitResults = new ArrayList<>();
        List<EvaluationResult> evaluations = new ArrayList<>();
        for (UnitOutcome outcome : outcomes) {
            unitResults.add(outcome.unit());
            evaluations.addAll(outcome.evaluations());
            outcome.evaluations().forEach(r -> findings.addAll(r.findings()));
        }
        findings.sort(Finding.ORDER);

        Duration totalDuration = Duration.between(startTime, Instant.now());
        AnalysisStats stats = new AnalysisStats(
                unitResults.size(),
                (int) unitResults.stream().filter(u -> u.status() == UnitStatus.FAILED).count(),
                unitResults.stream().mapToInt(UnitResult::nodeCount).sum(),
                rules.size(),
                totalDuration.toMillis()
        );

        log.info("Analysis complete: {} findings in {} units in {}ms",
                findings.size(), stats.unitsAnalyzed(), stats.totalDurationMs());

        return new AnalysisResult(findings, unitResults, mergeByRule(rules, evaluations), stats);
    }

    private List<RuleDefinition> selectRules(AnalysisRequest request) {
        List<String> ids = !request.ruleIds().isEmpty() ? request.ruleIds() : properties.getEnabledRules();
        if (ids.isEmpty()) {
            return ruleRepository.findEnabled();
        }
        List<RuleDefinition> rules = new ArrayList<>();
        for (String id : ids) {
            Optional<RuleDefinition> rule = ruleRepository.findById(id);
            if (rule.isPresent()) {
                rules.add(rule.get());
            } else {
                log.warn("Unknown rule requested: {}", id);
            }
        }
        return rules;
    }

    private List<UnitOutcome> analyzeAll(List<UnitDiscovery.DiscoveredUnit> discovered, ScriptSource source,
                                         Map<String, Object> extraVars, List<RuleDefinition> rules) {
        if (discovered.isEmpty()) {
            return List.of();
        }
        int threads = Math.max(1, Math.min(properties.getThreads(), discovered.size()));
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<UnitOutcome>> futures = new ArrayList<>();
            for (UnitDiscovery.DiscoveredUnit unit : discovered) {
                AnalysisUnit analysisUnit = toAnalysisUnit(unit, source).withExtraVars(extraVars);
                futures.add(executor.submit(() -> analyzeUnit(analysisUnit, rules)));
            }
            List<UnitOutcome> outcomes = new ArrayList<>();
            for (Future<UnitOutcome> future : futures) {
                outcomes.add(future.get());
            }
            return outcomes;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AnalysisException("Analysis interrupted", e);
        } catch (ExecutionException e) {
            throw new AnalysisException("Unit analysis failed unexpectedly: " + e.getCause().getMessage(), e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    private static AnalysisUnit toAnalysisUnit(UnitDiscovery.DiscoveredUnit unit, ScriptSource source) {
        return unit.type() == AnalysisUnit.UnitType.ROLE
                ? AnalysisUnit.role(unit.path(), source)
                : AnalysisUnit.playbook(unit.path(), source);
    }

    private UnitOutcome analyzeUnit(AnalysisUnit unit, List<RuleDefinition> rules) {
        log.info("  Processing {}: {}", unit.type().name().toLowerCase(), unit.name());
        PdgBuildResult built;
        try {
            built = pdgBuilder.build(unit);
        } catch (AnalysisException e) {
            log.error("  Failed to analyze {}: {}", unit.name(), e.getMessage());
            return new UnitOutcome(new UnitResult(unit.name(), unit.type(), UnitStatus.FAILED, 0, 0, 0,
                    e.getDiagnostics(), e.getMessage()), List.of());
        } catch (RuntimeException e) {
            log.error("  Unexpected error while building {}", unit.name(), e);
            return new UnitOutcome(new UnitResult(unit.name(), unit.type(), UnitStatus.FAILED, 0, 0, 0,
                    List.of(), e.toString()), List.of());
        }

        ProgramDependenceGraph graph = built.graph();
        List<EvaluationResult> evaluations = ruleEngine.run(graph, rules);
        int findingCount = evaluations.stream().mapToInt(EvaluationResult::findingCount).sum();
        ProgramDependenceGraph.Stats stats = graph.stats();
        return new UnitOutcome(new UnitResult(unit.name(), unit.type(), UnitStatus.SUCCEEDED, findingCount,
                stats.nodeCount(), stats.edgeCount(), built.diagnostics(), null), evaluations);
    }

    /**
     * One result per rule across all units. Findings of units that succeeded are kept when the
     * rule failed on another unit; the merged result then carries the failure status and messages.
     */
    private static List<EvaluationResult> mergeByRule(List<RuleDefinition> rules, List<EvaluationResult> evaluations) {
        List<EvaluationResult> merged = new ArrayList<>();
        for (RuleDefinition rule : rules) {
            List<EvaluationResult> forRule = evaluations.stream()
                    .filter(r -> r.ruleId().equals(rule.id()))
                    .toList();
            if (forRule.isEmpty()) {
                continue;
            }
            List<Finding> findings = forRule.stream()
                    .flatMap(r -> r.findings().stream())
                    .sorted(Finding.ORDER)
                    .toList();
            Duration duration = forRule.stream()
                    .map(EvaluationResult::executionTime)
                    .reduce(Duration.ZERO, Duration::plus);
            int nodes = forRule.stream().mapToInt(EvaluationResult::nodesAnalyzed).sum();

            EvaluationResult.EvaluationStatus status = worstStatus(forRule);
            if (status == EvaluationResult.EvaluationStatus.SUCCESS) {
                merged.add(EvaluationResult.success(rule.id(), findings, duration, nodes));
            } else {
                String messages = forRule.stream()
                        .map(EvaluationResult::errorMessage)
                        .filter(Objects::nonNull)
                        .distinct()
                        .collect(Collectors.joining("; "));
                merged.add(new EvaluationResult(rule.id(), findings, duration, nodes, status, messages));
            }
        }
        return merged;
    }

    private static EvaluationResult.EvaluationStatus worstStatus(List<EvaluationResult> results) {
        EvaluationResult.EvaluationStatus worst = EvaluationResult.EvaluationStatus.SUCCESS;
        for (EvaluationResult result : results) {
            if (result.status() == EvaluationResult.EvaluationStatus.ERROR) {
                return EvaluationResult.EvaluationStatus.ERROR;
            }
            if (result.status() == EvaluationResult.EvaluationStatus.SKIPPED) {
                worst = EvaluationResult.EvaluationStatus.SKIPPED;
            }
        }
        return worst;
    }

    private record UnitOutcome(UnitResult unit, List<EvaluationResult> evaluations) {}
}
