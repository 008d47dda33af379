package com.vidnyan.playscan.application.service;

import com.vidnyan.playscan.adapter.out.detector.HardcodedSecretDetector;
import com.vidnyan.playscan.adapter.out.detector.HttpWithoutTlsDetector;
import com.vidnyan.playscan.domain.graph.PdgNodeKind;
import com.vidnyan.playscan.domain.graph.ProgramDependenceGraph;
import com.vidnyan.playscan.domain.rule.EvaluationContext;
import com.vidnyan.playscan.domain.rule.EvaluationResult;
import com.vidnyan.playscan.domain.rule.Finding;
import com.vidnyan.playscan.domain.rule.RuleDefinition;
import com.vidnyan.playscan.domain.rule.SmellDetector;
import com.vidnyan.playscan.support.InMemoryScriptSource;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class GaselRuleEngineTest {

    private static final String PLAYBOOK = """
            - hosts: all
              tasks:
                - name: fetch
                  uri: url=http://example.com/status
                - name: account
                  user: name=bob password=hunter2
            """;

    private final ProgramDependenceGraph graph = InMemoryScriptSource.buildPlaybook(PLAYBOOK).graph();

    @Test
    void runsEveryRuleWithItsDetector() {
        // Arrange
        GaselRuleEngine engine = new GaselRuleEngine(List.of(new HardcodedSecretDetector(), new HttpWithoutTlsDetector()));
        List<RuleDefinition> rules = List.of(rule(HardcodedSecretDetector.RULE_ID), rule(HttpWithoutTlsDetector.RULE_ID));

        // Act
        List<EvaluationResult> results = engine.run(graph, rules);

        // Assert
        assertEquals(2, results.size());
        assertTrue(results.stream().allMatch(r -> r.status() == EvaluationResult.EvaluationStatus.SUCCESS));
        List<Finding> findings = GaselRuleEngine.findings(results);
        assertEquals(List.of(HttpWithoutTlsDetector.RULE_ID, HardcodedSecretDetector.RULE_ID),
                findings.stream().map(Finding::ruleId).toList());
    }

    @Test
    void ruleWithoutDetectorIsSkipped() {
        GaselRuleEngine engine = new GaselRuleEngine(List.of(new HardcodedSecretDetector()));

        List<EvaluationResult> results = engine.run(graph, List.of(rule("CUSTOM_RULE")));

        assertEquals(EvaluationResult.EvaluationStatus.SKIPPED, results.get(0).status());
        assertEquals("No detector available", results.get(0).errorMessage());
    }

    @Test
    void failingDetectorDoesNotStopTheRun() {
        SmellDetector broken = new SmellDetector() {
            @Override
            public String ruleId() {
                return "BROKEN";
            }

            @Override
            public EvaluationResult evaluate(EvaluationContext context) {
                throw new IllegalStateException("boom");
            }

            @Override
            public Set<PdgNodeKind> requiredNodeKinds() {
                return Set.of(PdgNodeKind.TASK);
            }
        };
        GaselRuleEngine engine = new GaselRuleEngine(List.of(broken, new HardcodedSecretDetector()));

        List<EvaluationResult> results = engine.run(graph, List.of(rule("BROKEN"), rule(HardcodedSecretDetector.RULE_ID)));

        assertEquals(EvaluationResult.EvaluationStatus.ERROR, results.get(0).status());
        assertEquals("boom", results.get(0).errorMessage());
        assertEquals(1, results.get(1).findingCount());
    }

    private static RuleDefinition rule(String id) {
        return RuleDefinition.builder().id(id).name(id).build();
    }
}
