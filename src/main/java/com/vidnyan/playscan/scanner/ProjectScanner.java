package com.vidnyan.playscan.scanner;

import com.vidnyan.playscan.application.port.out.UnitDiscovery;
import com.vidnyan.playscan.domain.graph.AnalysisUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Scans a project for top-level playbooks and roles.
 *
 * <p>A role is a directory with at least one of the standard role subdirectories. A playbook is
 * a YAML file outside any role whose top-level list entries carry {@code hosts} or
 * {@code import_playbook}. A path pointing at a single file or role is analyzed as that unit.</p>
 */
@Slf4j
@Component
public class ProjectScanner implements UnitDiscovery {

    static final Set<String> ROLE_SECTIONS = Set.of("tasks", "handlers", "defaults", "vars", "meta");

    /**
     * Directories holding variables or support files, never playbooks.
     */
    static final Set<String> NON_PLAYBOOK_DIRECTORIES = Set.of(
            "group_vars", "host_vars", "vars", "defaults", "tasks", "handlers", "meta",
            "templates", "files", "molecule", ".git", ".github");

    private static final Pattern PLAY_KEY = Pattern.compile("(?m)^(- +| {2})(hosts|import_playbook) *:");

    @Override
    public List<DiscoveredUnit> discover(Path projectPath) throws IOException {
        if (Files.isRegularFile(projectPath)) {
            return List.of(new DiscoveredUnit(projectPath, AnalysisUnit.UnitType.PLAYBOOK));
        }
        if (!Files.isDirectory(projectPath)) {
            throw new IOException("No such file or directory: " + projectPath);
        }
        if (isRole(projectPath)) {
            return List.of(new DiscoveredUnit(projectPath, AnalysisUnit.UnitType.ROLE));
        }

        List<DiscoveredUnit> units = new ArrayList<>();
        units.addAll(scanRoles(projectPath).stream()
                .map(p -> new DiscoveredUnit(p, AnalysisUnit.UnitType.ROLE))
                .toList());
        units.addAll(scanPlaybooks(projectPath).stream()
                .map(p -> new DiscoveredUnit(p, AnalysisUnit.UnitType.PLAYBOOK))
                .toList());
        log.info("Discovered {} units under {}", units.size(), projectPath);
        return units;
    }

    /**
     * Role directories directly under any {@code roles/} directory.
     */
    public List<Path> scanRoles(Path root) throws IOException {
        try (Stream<Path> paths = Files.walk(root)) {
            return paths.filter(Files::isDirectory)
                    .filter(p -> p.getParent() != null && p.getParent().getFileName() != null
                            && p.getParent().getFileName().toString().equals("roles"))
                    .filter(ProjectScanner::isRole)
                    .sorted(Comparator.naturalOrder())
                    .toList();
        }
    }

    /**
     * YAML files that look like playbooks, outside role and variable directories.
     */
    public List<Path> scanPlaybooks(Path root) throws IOException {
        List<Path> playbooks = new ArrayList<>();
        try (Stream<Path> paths = Files.walk(root)) {
            List<Path> candidates = paths.filter(Files::isRegularFile)
                    .filter(ProjectScanner::isYaml)
                    .filter(p -> !isInsideSupportDirectory(root, p))
                    .sorted(Comparator.naturalOrder())
                    .toList();
            for (Path candidate : candidates) {
                if (looksLikePlaybook(candidate)) {
                    playbooks.add(candidate);
                }
            }
        }
        return playbooks;
    }

    static boolean isRole(Path dir) {
        return ROLE_SECTIONS.stream().anyMatch(section -> Files.isDirectory(dir.resolve(section)));
    }

    private static boolean isYaml(Path file) {
        String name = file.getFileName().toString();
        return name.endsWith(".yml") || name.endsWith(".yaml");
    }

    private static boolean isInsideSupportDirectory(Path root, Path file) {
        Path relative = root.relativize(file).getParent();
        if (relative == null) {
            return false;
        }
        for (Path part : relative) {
            String name = part.toString();
            if (name.equals("roles") || NON_PLAYBOOK_DIRECTORIES.contains(name)) {
                return true;
            }
        }
        return false;
    }

    private static boolean looksLikePlaybook(Path file) {
        try {
            return PLAY_KEY.matcher(Files.readString(file)).find();
        } catch (IOException e) {
            log.warn("Cannot read {}: {}", file, e.getMessage());
            return false;
        }
    }
}
