package com.vidnyan.playscan.adapter.out.detector;

import com.vidnyan.playscan.domain.graph.ProgramDependenceGraph;
import com.vidnyan.playscan.domain.rule.EvaluationContext;
import com.vidnyan.playscan.domain.rule.Finding;
import com.vidnyan.playscan.domain.rule.RuleDefinition;
import com.vidnyan.playscan.support.InMemoryScriptSource;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UnreachableSecurityTaskDetectorTest {

    private final UnreachableSecurityTaskDetector detector = new UnreachableSecurityTaskDetector();
    private final RuleDefinition rule = RuleDefinition.builder()
            .id(UnreachableSecurityTaskDetector.RULE_ID)
            .name("Unreachable security task")
            .category(RuleDefinition.Category.REACHABILITY)
            .build();

    @Test
    void firewallTaskBehindFalseConditionIsFlagged() {
        // Arrange
        ProgramDependenceGraph graph = InMemoryScriptSource.buildPlaybook("""
                - hosts: all
                  tasks:
                    - name: enable firewall
                      ufw: state=enabled
                      when: false
                    - name: install
                      apt: name=nginx
                """).graph();

        // Act
        List<Finding> findings = detector.evaluate(EvaluationContext.of(rule, graph)).findings();

        // Assert
        assertEquals(1, findings.size());
        Finding finding = findings.get(0);
        assertEquals("ufw", finding.context().get("module"));
        assertEquals(List.of(finding.pdgNodeId()), finding.evidence());
    }

    @Test
    void wholeBlockBehindFalseConditionIsFlagged() {
        List<Finding> findings = evaluate("""
                - hosts: all
                  tasks:
                    - when: false
                      block:
                        - sysctl: name=net.ipv4.ip_forward value=0
                        - user: name=deploy shell=/bin/false
                """);

        assertEquals(2, findings.size());
    }

    @Test
    void ordinaryConditionsDoNotMakeTasksUnreachable() {
        assertTrue(evaluate("""
                - hosts: all
                  tasks:
                    - name: enable firewall
                      ufw: state=enabled
                      when: manage_firewall | bool
                """).isEmpty());
    }

    @Test
    void otherModulesAreIgnored() {
        assertTrue(evaluate("""
                - hosts: all
                  tasks:
                    - debug: msg=never
                      when: false
                """).isEmpty());
    }

    private List<Finding> evaluate(String playbook) {
        ProgramDependenceGraph graph = InMemoryScriptSource.buildPlaybook(playbook).graph();
        return detector.evaluate(EvaluationContext.of(rule, graph)).findings();
    }
}
