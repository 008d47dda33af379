package com.vidnyan.playscan.application.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.playscan.AnalysisProperties;
import com.vidnyan.playscan.adapter.out.detector.AdminByDefaultDetector;
import com.vidnyan.playscan.adapter.out.detector.EmptyPasswordDetector;
import com.vidnyan.playscan.adapter.out.detector.HardcodedSecretDetector;
import com.vidnyan.playscan.adapter.out.detector.HttpWithoutTlsDetector;
import com.vidnyan.playscan.adapter.out.detector.MissingIntegrityCheckDetector;
import com.vidnyan.playscan.adapter.out.detector.UnreachableSecurityTaskDetector;
import com.vidnyan.playscan.adapter.out.detector.UnrestrictedIpAddressDetector;
import com.vidnyan.playscan.adapter.out.detector.WeakCryptoAlgorithmDetector;
import com.vidnyan.playscan.adapter.out.role.FileSystemRoleResolver;
import com.vidnyan.playscan.adapter.out.rule.FileSystemRuleRepository;
import com.vidnyan.playscan.adapter.out.yaml.SnakeYamlRawTreeLoader;
import com.vidnyan.playscan.application.port.in.AnalyzePlaybookUseCase.AnalysisRequest;
import com.vidnyan.playscan.application.port.in.AnalyzePlaybookUseCase.AnalysisResult;
import com.vidnyan.playscan.application.port.in.AnalyzePlaybookUseCase.UnitResult;
import com.vidnyan.playscan.domain.error.AnalysisException;
import com.vidnyan.playscan.domain.error.DiagnosticType;
import com.vidnyan.playscan.domain.graph.PdgBuilder;
import com.vidnyan.playscan.domain.graph.PdgNodeKind;
import com.vidnyan.playscan.domain.rule.EvaluationContext;
import com.vidnyan.playscan.domain.rule.EvaluationResult;
import com.vidnyan.playscan.domain.rule.Finding;
import com.vidnyan.playscan.domain.rule.SmellDetector;
import com.vidnyan.playscan.scanner.ProjectScanner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisApplicationServiceTest {

    @TempDir
    Path tempDir;

    private AnalysisApplicationService service;
    private AnalysisProperties properties;
    private FileSystemRuleRepository rules;

    @BeforeEach
    void setUp() throws IOException {
        write("roles/web/tasks/main.yml", """
                - name: status
                  uri: url=http://example.com/status
                """);
        write("site.yml", """
                - hosts: all
                  roles:
                    - web
                  tasks:
                    - name: account
                      user: name=bob password=hunter2
                """);
        write("broken.yml", """
                - hosts: all
                  roles:
                    - missing
                """);

        properties = new AnalysisProperties();
        properties.setThreads(2);
        rules = new FileSystemRuleRepository(new ObjectMapper());
        rules.loadRules("classpath*:rules/*.json");
        GaselRuleEngine engine = new GaselRuleEngine(List.of(
                new HardcodedSecretDetector(), new EmptyPasswordDetector(), new AdminByDefaultDetector(),
                new MissingIntegrityCheckDetector(), new HttpWithoutTlsDetector(),
                new UnrestrictedIpAddressDetector(), new WeakCryptoAlgorithmDetector(),
                new UnreachableSecurityTaskDetector()));
        service = serviceWith(engine);
    }

    @Test
    void analyzesEveryUnitAndKeepsGoingPastFailures() {
        // Act
        AnalysisResult result = service.analyze(new AnalysisRequest(tempDir,
                List.of(HardcodedSecretDetector.RULE_ID, HttpWithoutTlsDetector.RULE_ID), Map.of()));

        // Assert
        assertEquals(3, result.stats().unitsAnalyzed());
        assertEquals(1, result.stats().unitsFailed());
        assertEquals(2, result.stats().rulesEvaluated());

        UnitResult failed = result.failedUnits().get(0);
        assertTrue(failed.unitName().endsWith("broken.yml"));
        assertTrue(failed.diagnostics().stream().anyMatch(d -> d.type() == DiagnosticType.ROLE_NOT_FOUND));

        // The role is analyzed on its own and again inside site.yml.
        assertEquals(3, result.findings().size());
        assertEquals(2, result.findings().stream()
                .filter(f -> f.ruleId().equals(HttpWithoutTlsDetector.RULE_ID))
                .count());
        assertTrue(result.ruleResults().stream()
                .allMatch(r -> r.status() == EvaluationResult.EvaluationStatus.SUCCESS));
    }

    @Test
    void findingsAreInReportOrder() {
        AnalysisResult result = service.analyze(AnalysisRequest.forPath(tempDir));

        List<Finding> sorted = result.findings().stream().sorted(Finding.ORDER).toList();
        assertEquals(sorted, result.findings());
        assertEquals(8, result.stats().rulesEvaluated());
    }

    @Test
    void singlePlaybookCanBeAnalyzed() {
        AnalysisResult result = service.analyze(new AnalysisRequest(tempDir.resolve("site.yml"),
                List.of(HardcodedSecretDetector.RULE_ID), Map.of()));

        assertEquals(1, result.stats().unitsAnalyzed());
        assertEquals(1, result.findings().size());
        assertTrue(result.findings().get(0).location().filePath().endsWith("site.yml"));
    }

    @Test
    void missingProjectIsAnError() {
        assertThrows(AnalysisException.class,
                () -> service.analyze(AnalysisRequest.forPath(tempDir.resolve("absent"))));
    }

    @Test
    void ruleFailingOnOneUnitKeepsFindingsOfTheOthers() {
        // Arrange
        HttpWithoutTlsDetector http = new HttpWithoutTlsDetector();
        SmellDetector failsOnPlaybook = new SmellDetector() {
            @Override
            public String ruleId() {
                return http.ruleId();
            }

            @Override
            public EvaluationResult evaluate(EvaluationContext context) {
                if (context.graph().unitName().endsWith("site.yml")) {
                    throw new IllegalStateException("cannot read site.yml");
                }
                return http.evaluate(context);
            }

            @Override
            public Set<PdgNodeKind> requiredNodeKinds() {
                return http.requiredNodeKinds();
            }
        };
        AnalysisApplicationService flaky = serviceWith(new GaselRuleEngine(List.of(failsOnPlaybook)));

        // Act
        AnalysisResult result = flaky.analyze(new AnalysisRequest(tempDir,
                List.of(HttpWithoutTlsDetector.RULE_ID), Map.of()));

        // Assert
        assertEquals(1, result.ruleResults().size());
        EvaluationResult merged = result.ruleResults().get(0);
        assertEquals(EvaluationResult.EvaluationStatus.ERROR, merged.status());
        assertEquals("cannot read site.yml", merged.errorMessage());
        assertEquals(1, merged.findingCount());
        assertTrue(merged.findings().get(0).location().filePath().contains("roles"));
        assertEquals(merged.findings(), result.findings());
    }

    private AnalysisApplicationService serviceWith(GaselRuleEngine engine) {
        return new AnalysisApplicationService(new ProjectScanner(), new SnakeYamlRawTreeLoader(),
                new FileSystemRoleResolver(properties), rules, engine, new PdgBuilder(), properties);
    }

    private void write(String relative, String content) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }
}
