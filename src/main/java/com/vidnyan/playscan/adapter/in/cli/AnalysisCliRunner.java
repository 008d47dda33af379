package com.vidnyan.playscan.adapter.in.cli;

import com.vidnyan.playscan.application.port.in.AnalyzePlaybookUseCase;
import com.vidnyan.playscan.application.port.in.AnalyzePlaybookUseCase.AnalysisRequest;
import com.vidnyan.playscan.application.port.in.AnalyzePlaybookUseCase.AnalysisResult;
import com.vidnyan.playscan.application.port.in.AnalyzePlaybookUseCase.UnitResult;
import com.vidnyan.playscan.domain.error.Diagnostic;
import com.vidnyan.playscan.domain.error.DiagnosticType;
import com.vidnyan.playscan.domain.rule.Finding;
import com.vidnyan.playscan.domain.rule.RuleDefinition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * CLI Runner for standalone project analysis.
 * Runs analysis when playscan.analyze.path property is set.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AnalysisCliRunner implements CommandLineRunner {

    private static final int MAX_LISTED_FINDINGS = 100;

    private final AnalyzePlaybookUseCase analyzePlaybookUseCase;
    private final ConfigurableApplicationContext context;

    @Value("${playscan.analyze.path:}")
    private String projectPath;

    @Override
    public void run(String... args) throws Exception {
        if (projectPath == null || projectPath.isBlank()) {
            log.info("No project path specified. Set playscan.analyze.path property.");
            return;
        }

        int exitCode = 0;
        try {
            log.info("╔══════════════════════════════════════════════════════════════╗");
            log.info("║           PLAYSCAN - Playbook Security Smell Scanner          ║");
            log.info("╠══════════════════════════════════════════════════════════════╣");
            log.info("║ Analyzing: {}", truncatePath(projectPath, 50));
            log.info("╚══════════════════════════════════════════════════════════════╝");

            AnalysisResult result = analyzePlaybookUseCase.analyze(AnalysisRequest.forPath(Path.of(projectPath)));
            printResults(result);
            if (!result.failedUnits().isEmpty()) {
                exitCode = 2;
            } else if (!result.findings().isEmpty()) {
                exitCode = 1;
            }

            log.info("");
            log.info("Analysis complete!");
        } finally {
            int code = exitCode;
            SpringApplication.exit(context, () -> code);
        }
    }

    private void printResults(AnalysisResult result) {
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" ANALYSIS RESULTS");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" Units analyzed:   {}", result.stats().unitsAnalyzed());
        log.info(" Units failed:     {}", result.stats().unitsFailed());
        log.info(" Graph nodes:      {}", result.stats().nodesAnalyzed());
        log.info(" Rules evaluated:  {}", result.stats().rulesEvaluated());
        log.info(" Duration:         {}ms", result.stats().totalDurationMs());
        log.info("───────────────────────────────────────────────────────────────");

        log.info(" FINDINGS:");
        log.info("   🔴 Blockers: {}", result.findingCount(RuleDefinition.Severity.BLOCKER));
        log.info("   🟠 Errors:   {}", result.findingCount(RuleDefinition.Severity.ERROR));
        log.info("   🟡 Warnings: {}", result.findingCount(RuleDefinition.Severity.WARN));
        log.info("   🔵 Info:     {}", result.findingCount(RuleDefinition.Severity.INFO));
        log.info("═══════════════════════════════════════════════════════════════");

        printUnits(result);

        if (result.findings().isEmpty()) {
            log.info("");
            log.info("✅ No security smells found.");
            return;
        }

        log.info("");
        log.info(" FINDING DETAILS:");
        log.info("───────────────────────────────────────────────────────────────");

        int count = 0;
        for (Finding f : result.findings()) {
            count++;
            if (count > MAX_LISTED_FINDINGS) {
                log.info(" ... and {} more findings", result.findings().size() - MAX_LISTED_FINDINGS);
                break;
            }

            String severity = switch (f.severity()) {
                case BLOCKER -> "🔴 BLOCKER";
                case ERROR -> "🟠 ERROR";
                case WARN -> "🟡 WARN";
                case INFO -> "🔵 INFO";
            };

            log.info("");
            log.info(" {} [{}]", severity, f.ruleId());
            log.info(" Location: {}", f.location().format());
            log.info(" Message:  {}", f.message());
        }
    }

    private void printUnits(AnalysisResult result) {
        for (UnitResult unit : result.unitResults()) {
            long unresolved = unit.diagnostics().stream()
                    .filter(d -> d.type() == DiagnosticType.UNRESOLVED_VARIABLE)
                    .count();
            if (unit.status() == AnalyzePlaybookUseCase.UnitStatus.FAILED) {
                log.info(" ❌ {}: {}", unit.unitName(), unit.errorMessage());
            } else {
                log.info(" ✔ {}: {} findings, {} nodes, {} unresolved variables",
                        unit.unitName(), unit.findingCount(), unit.nodeCount(), unresolved);
            }
            unit.diagnostics().stream()
                    .filter(d -> d.type() != DiagnosticType.UNRESOLVED_VARIABLE)
                    .map(Diagnostic::format)
                    .forEach(d -> log.info("     {}", d));
        }
    }

    private String truncatePath(String path, int maxLen) {
        if (path.length() <= maxLen)
            return path;
        return "..." + path.substring(path.length() - maxLen + 3);
    }
}
