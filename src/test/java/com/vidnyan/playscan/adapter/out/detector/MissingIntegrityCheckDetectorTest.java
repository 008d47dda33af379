package com.vidnyan.playscan.adapter.out.detector;

import com.vidnyan.playscan.domain.graph.ProgramDependenceGraph;
import com.vidnyan.playscan.domain.rule.EvaluationContext;
import com.vidnyan.playscan.domain.rule.Finding;
import com.vidnyan.playscan.domain.rule.RuleDefinition;
import com.vidnyan.playscan.support.InMemoryScriptSource;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MissingIntegrityCheckDetectorTest {

    private final MissingIntegrityCheckDetector detector = new MissingIntegrityCheckDetector();
    private final RuleDefinition rule = RuleDefinition.builder()
            .id(MissingIntegrityCheckDetector.RULE_ID)
            .name("Missing integrity check")
            .build();

    @Test
    void archiveDownloadWithoutChecksumIsFlagged() {
        List<Finding> findings = evaluate("""
                - hosts: all
                  tasks:
                    - name: fetch
                      get_url:
                        url: https://example.com/app-1.0.tar.gz
                        dest: /tmp/app.tar.gz
                """);

        assertEquals(1, findings.size());
        assertEquals("https://example.com/app-1.0.tar.gz", findings.get(0).context().get("source"));
    }

    @Test
    void checksumMakesDownloadSafe() {
        assertTrue(evaluate("""
                - hosts: all
                  tasks:
                    - get_url:
                        url: https://example.com/app-1.0.tar.gz
                        dest: /tmp/app.tar.gz
                        checksum: sha256:9f86d081884c7d659a2feaa0c55ad015
                """).isEmpty());
    }

    @Test
    void downloadModuleIsCheckedEvenWithoutArchiveUrl() {
        List<Finding> findings = evaluate("""
                - hosts: all
                  tasks:
                    - get_url:
                        url: "{{ artifact_url }}"
                        dest: /opt/app
                """);

        assertEquals(1, findings.size());
    }

    @Test
    void disabledCertificateValidationDoesNotVerify() {
        assertEquals(1, evaluate("""
                - hosts: all
                  tasks:
                    - get_url:
                        url: https://example.com/tool.zip
                        dest: /tmp/tool.zip
                        validate_certs: false
                """).size());
    }

    @Test
    void disabledGpgCheckIsFlagged() {
        List<Finding> findings = evaluate("""
                - hosts: all
                  tasks:
                    - yum: name=nginx disable_gpg_check=yes
                """);

        assertEquals(1, findings.size());
        assertTrue(findings.get(0).message().contains("disable_gpg_check"));
    }

    @Test
    void gpgCheckTurnedOffIsFlagged() {
        assertEquals(1, evaluate("""
                - hosts: all
                  tasks:
                    - yum_repository:
                        name: epel
                        baseurl: https://example.com/epel
                        gpgcheck: no
                """).size());
    }

    @Test
    void plainPackageInstallIsFine() {
        assertTrue(evaluate("""
                - hosts: all
                  tasks:
                    - apt: name=nginx state=present
                """).isEmpty());
    }

    private List<Finding> evaluate(String playbook) {
        ProgramDependenceGraph graph = InMemoryScriptSource.buildPlaybook(playbook).graph();
        return detector.evaluate(EvaluationContext.of(rule, graph)).findings();
    }
}
