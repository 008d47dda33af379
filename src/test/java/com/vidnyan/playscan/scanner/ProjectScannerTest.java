package com.vidnyan.playscan.scanner;

import com.vidnyan.playscan.application.port.out.UnitDiscovery;
import com.vidnyan.playscan.domain.graph.AnalysisUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProjectScannerTest {

    @TempDir
    Path tempDir;

    private final ProjectScanner scanner = new ProjectScanner();

    @BeforeEach
    void createProject() throws IOException {
        write("site.yml", "- hosts: all\n  roles:\n    - web\n");
        write("nested/deploy.yaml", "- name: deploy\n  hosts: app\n  tasks: []\n");
        write("main.yml", "- import_playbook: site.yml\n");
        write("common.yml", "- debug: msg=not a play\n");
        write("group_vars/all.yml", "- hosts: not really\n");
        write("roles/web/tasks/main.yml", "- hosts: inside a role\n");
        write("roles/db/defaults/main.yml", "db_port: 5432\n");
        Files.createDirectories(tempDir.resolve("roles/empty"));
        write("README.md", "- hosts: all\n");
    }

    @Test
    void scanPlaybooks_ShouldFindPlaysOutsideSupportDirectories() throws IOException {
        // Act
        List<Path> results = scanner.scanPlaybooks(tempDir);

        // Assert
        assertEquals(3, results.size());
        assertTrue(results.stream().anyMatch(p -> p.endsWith("site.yml")));
        assertTrue(results.stream().anyMatch(p -> p.endsWith("main.yml") && p.getParent().equals(tempDir)));
        assertTrue(results.stream().anyMatch(p -> p.endsWith("deploy.yaml")));
        assertFalse(results.stream().anyMatch(p -> p.endsWith("common.yml")));
        assertFalse(results.stream().anyMatch(p -> p.toString().contains("group_vars")));
    }

    @Test
    void scanRoles_ShouldRequireARoleSection() throws IOException {
        List<Path> roles = scanner.scanRoles(tempDir);

        assertEquals(List.of(tempDir.resolve("roles/db"), tempDir.resolve("roles/web")), roles);
    }

    @Test
    void discover_ShouldListRolesThenPlaybooks() throws IOException {
        List<UnitDiscovery.DiscoveredUnit> units = scanner.discover(tempDir);

        assertEquals(5, units.size());
        assertEquals(AnalysisUnit.UnitType.ROLE, units.get(0).type());
        assertEquals(AnalysisUnit.UnitType.ROLE, units.get(1).type());
        assertTrue(units.subList(2, 5).stream().allMatch(u -> u.type() == AnalysisUnit.UnitType.PLAYBOOK));
    }

    @Test
    void discover_ShouldTreatSingleFileOrRoleAsOneUnit() throws IOException {
        List<UnitDiscovery.DiscoveredUnit> file = scanner.discover(tempDir.resolve("common.yml"));
        List<UnitDiscovery.DiscoveredUnit> role = scanner.discover(tempDir.resolve("roles/web"));

        assertEquals(AnalysisUnit.UnitType.PLAYBOOK, file.get(0).type());
        assertEquals(AnalysisUnit.UnitType.ROLE, role.get(0).type());
        assertEquals(1, role.size());
    }

    @Test
    void discover_ShouldFailOnMissingPath() {
        assertThrows(IOException.class, () -> scanner.discover(tempDir.resolve("absent")));
    }

    private void write(String relative, String content) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }
}
