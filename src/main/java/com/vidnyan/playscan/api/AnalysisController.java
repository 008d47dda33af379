package com.vidnyan.playscan.api;

import com.vidnyan.playscan.application.port.in.AnalyzePlaybookUseCase;
import com.vidnyan.playscan.application.port.in.ExportGraphUseCase;
import com.vidnyan.playscan.domain.error.AnalysisException;
import com.vidnyan.playscan.domain.graph.AnalysisUnit;
import com.vidnyan.playscan.domain.graph.EdgeListExporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * REST API for running project analysis and exporting graphs.
 */
@RestController
@RequestMapping("/api/analyze")
public class AnalysisController {

    private static final Logger log = LoggerFactory.getLogger(AnalysisController.class);

    private final AnalyzePlaybookUseCase analyzePlaybookUseCase;
    private final ExportGraphUseCase exportGraphUseCase;

    public AnalysisController(AnalyzePlaybookUseCase analyzePlaybookUseCase, ExportGraphUseCase exportGraphUseCase) {
        this.analyzePlaybookUseCase = analyzePlaybookUseCase;
        this.exportGraphUseCase = exportGraphUseCase;
    }

    @PostMapping
    public AnalyzePlaybookUseCase.AnalysisResult analyze(@RequestBody AnalysisRequest request) {
        log.info("Received analysis request");
        log.info("  Project path: {}", request.projectPath());
        log.info("  Rules: {}", request.ruleIds());

        return analyzePlaybookUseCase.analyze(new AnalyzePlaybookUseCase.AnalysisRequest(
                Path.of(request.projectPath()), request.ruleIds(), request.extraVars()));
    }

    @GetMapping("/graph")
    public EdgeListExporter.EdgeList graph(@RequestParam String path,
                                           @RequestParam(defaultValue = "PLAYBOOK") AnalysisUnit.UnitType type) {
        return exportGraphUseCase.exportEdgeList(Path.of(path), type, Map.of());
    }

    @GetMapping(value = "/graph/cypher", produces = MediaType.TEXT_PLAIN_VALUE)
    public String cypher(@RequestParam String path,
                         @RequestParam(defaultValue = "PLAYBOOK") AnalysisUnit.UnitType type) {
        return exportGraphUseCase.exportQueryScript(Path.of(path), type, Map.of());
    }

    @GetMapping("/health")
    public String health() {
        return "OK - playbook security smell scanner";
    }

    @ExceptionHandler(AnalysisException.class)
    @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
    public ErrorResponse analysisFailed(AnalysisException e) {
        log.warn("Analysis request failed: {}", e.getMessage());
        return new ErrorResponse(e.getMessage(), e.getDiagnostics().stream().map(d -> d.format()).toList());
    }

    public record AnalysisRequest(
        String projectPath,         // File, role directory or project directory
        List<String> ruleIds,
        Map<String, Object> extraVars
    ) {}

    public record ErrorResponse(
        String error,
        List<String> diagnostics
    ) {}
}
