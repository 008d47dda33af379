package com.vidnyan.playscan.adapter.out.detector;

import com.vidnyan.playscan.domain.graph.ProgramDependenceGraph;
import com.vidnyan.playscan.domain.rule.EvaluationContext;
import com.vidnyan.playscan.domain.rule.Finding;
import com.vidnyan.playscan.domain.rule.RuleDefinition;
import com.vidnyan.playscan.domain.rule.SmellDetector;
import com.vidnyan.playscan.support.InMemoryScriptSource;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TextPatternDetectorTest {

    @Test
    void plainHttpUrlIsFlagged() {
        List<Finding> findings = evaluate(new HttpWithoutTlsDetector(), """
                - hosts: all
                  tasks:
                    - uri: url=http://example.com/api/status
                """);

        assertEquals(1, findings.size());
        assertEquals("http://example.com/api/status", findings.get(0).context().get("match"));
    }

    @Test
    void localHttpAndHttpsAreNotFlagged() {
        assertTrue(evaluate(new HttpWithoutTlsDetector(), """
                - hosts: all
                  tasks:
                    - uri: url=http://localhost:8080/health
                    - uri: url=https://example.com/api
                """).isEmpty());
    }

    @Test
    void httpInsideTemplateIsFlaggedOnItsStaticPart() {
        List<Finding> findings = evaluate(new HttpWithoutTlsDetector(), """
                - hosts: all
                  tasks:
                    - get_url:
                        url: "http://mirror.example.com/{{ release }}/index"
                        dest: /tmp/index
                """);

        assertEquals(1, findings.size());
    }

    @Test
    void bindToAllInterfacesIsFlaggedOnTheDefinition() {
        // Arrange
        ProgramDependenceGraph graph = InMemoryScriptSource.buildPlaybook("""
                - hosts: all
                  vars:
                    bind_address: 0.0.0.0
                """).graph();

        // Act
        List<Finding> findings = evaluate(new UnrestrictedIpAddressDetector(), graph);

        // Assert
        assertEquals(1, findings.size());
        assertTrue(findings.get(0).message().contains("bind_address"));
        assertEquals("value", findings.get(0).context().get("keyword"));
    }

    @Test
    void specificAddressIsNotFlagged() {
        assertTrue(evaluate(new UnrestrictedIpAddressDetector(), """
                - hosts: all
                  vars:
                    bind_address: 10.0.0.5
                """).isEmpty());
    }

    @Test
    void weakHashIsFlaggedOncePerArgument() {
        List<Finding> findings = evaluate(new WeakCryptoAlgorithmDetector(), """
                - hosts: all
                  tasks:
                    - name: hash
                      command: openssl dgst -md5 -sha1 /etc/passwd
                """);

        assertEquals(1, findings.size());
        assertEquals("md5", findings.get(0).context().get("match"));
    }

    @Test
    void configuredAlgorithmsReplaceDefaults() {
        WeakCryptoAlgorithmDetector detector = new WeakCryptoAlgorithmDetector();
        RuleDefinition rule = RuleDefinition.builder()
                .id(WeakCryptoAlgorithmDetector.RULE_ID)
                .config(Map.of("algorithms", List.of("DES")))
                .build();
        ProgramDependenceGraph graph = InMemoryScriptSource.buildPlaybook("""
                - hosts: all
                  vars:
                    cipher: des-cbc
                    digest: md5
                """).graph();

        List<Finding> findings = detector.evaluate(EvaluationContext.of(rule, graph)).findings();

        assertEquals(1, findings.size());
        assertEquals("des", findings.get(0).context().get("match"));
    }

    private static List<Finding> evaluate(SmellDetector detector, String playbook) {
        return evaluate(detector, InMemoryScriptSource.buildPlaybook(playbook).graph());
    }

    private static List<Finding> evaluate(SmellDetector detector, ProgramDependenceGraph graph) {
        RuleDefinition rule = RuleDefinition.builder().id(detector.ruleId()).name(detector.ruleId()).build();
        return detector.evaluate(EvaluationContext.of(rule, graph)).findings();
    }
}
