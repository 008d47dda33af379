package com.vidnyan.playscan.adapter.out.role;

import com.vidnyan.playscan.AnalysisProperties;
import com.vidnyan.playscan.application.port.out.RoleResolver;
import com.vidnyan.playscan.domain.error.RoleNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds roles on disk the way the orchestration tool does: {@code roles/<name>} next to the
 * referencing file, the directory itself, then the configured search paths.
 * A role name may also be a path to the role directory.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FileSystemRoleResolver implements RoleResolver {

    static final List<String> SECTIONS = List.of(
            RoleFiles.TASKS, RoleFiles.HANDLERS, RoleFiles.DEFAULTS, RoleFiles.VARS, RoleFiles.META);
    static final List<String> MAIN_FILE_NAMES = List.of("main.yml", "main.yaml", "main.json", "main");

    private final AnalysisProperties properties;

    @Override
    public RoleFiles resolve(String roleName, Path baseDir) {
        List<Path> searchPaths = searchPaths(baseDir);
        for (Path candidate : candidates(roleName, searchPaths)) {
            if (isRole(candidate)) {
                Path root = candidate.normalize();
                log.debug("Resolved role {} to {}", roleName, root);
                return new RoleFiles(roleName(roleName), root, mainFiles(root));
            }
        }
        throw new RoleNotFoundException(roleName, searchPaths);
    }

    private List<Path> searchPaths(Path baseDir) {
        List<Path> paths = new ArrayList<>();
        paths.add(baseDir.resolve("roles"));
        paths.add(baseDir);
        Path parent = baseDir.getParent();
        if (parent != null && parent.getFileName() != null && parent.getFileName().toString().equals("roles")) {
            paths.add(parent);
        }
        properties.getRoleSearchPaths().stream().map(Path::of).forEach(paths::add);
        return paths;
    }

    private static List<Path> candidates(String roleName, List<Path> searchPaths) {
        List<Path> candidates = new ArrayList<>();
        Path asPath = Path.of(roleName);
        if (asPath.isAbsolute()) {
            candidates.add(asPath);
            return candidates;
        }
        searchPaths.forEach(dir -> candidates.add(dir.resolve(roleName)));
        return candidates;
    }

    private static boolean isRole(Path dir) {
        return Files.isDirectory(dir)
                && SECTIONS.stream().anyMatch(section -> Files.isDirectory(dir.resolve(section)));
    }

    private static Map<String, Path> mainFiles(Path root) {
        Map<String, Path> files = new LinkedHashMap<>();
        for (String section : SECTIONS) {
            MAIN_FILE_NAMES.stream()
                    .map(name -> root.resolve(section).resolve(name))
                    .filter(Files::isRegularFile)
                    .findFirst()
                    .ifPresent(file -> files.put(section, file));
        }
        return files;
    }

    /**
     * Role name without any path prefix.
     */
    private static String roleName(String reference) {
        Path fileName = Path.of(reference).getFileName();
        return fileName != null ? fileName.toString() : reference;
    }
}
