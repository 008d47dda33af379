package com.vidnyan.playscan.adapter.out.detector;

import com.vidnyan.playscan.domain.graph.ProgramDependenceGraph;
import com.vidnyan.playscan.domain.rule.EvaluationContext;
import com.vidnyan.playscan.domain.rule.Finding;
import com.vidnyan.playscan.domain.rule.RuleDefinition;
import com.vidnyan.playscan.support.InMemoryScriptSource;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AdminByDefaultDetectorTest {

    private final AdminByDefaultDetector detector = new AdminByDefaultDetector();
    private final RuleDefinition rule = RuleDefinition.builder()
            .id(AdminByDefaultDetector.RULE_ID)
            .name("Admin by default")
            .build();

    @Test
    void rootLoginIsFlagged() {
        List<Finding> findings = evaluate("""
                - hosts: db
                  tasks:
                    - postgresql_db: name=app login_user=root
                """);

        assertEquals(1, findings.size());
        assertEquals("root", findings.get(0).context().get("account"));
    }

    @Test
    void adminAccountInVariableIsFlagged() {
        List<Finding> findings = evaluate("""
                - hosts: all
                  vars:
                    app_user: Admin
                  tasks:
                    - name: owner
                      file:
                        path: /srv/app
                        owner: "{{ app_user }}"
                """);

        assertEquals(1, findings.size());
        assertTrue(findings.get(0).message().contains("app_user"));
    }

    @Test
    void ordinaryAccountIsNotFlagged() {
        assertTrue(evaluate("""
                - hosts: db
                  tasks:
                    - postgresql_db: name=app login_user=deploy
                """).isEmpty());
    }

    private List<Finding> evaluate(String playbook) {
        ProgramDependenceGraph graph = InMemoryScriptSource.buildPlaybook(playbook).graph();
        return detector.evaluate(EvaluationContext.of(rule, graph)).findings();
    }
}
