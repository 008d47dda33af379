package com.vidnyan.playscan.application.port.out;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Port for locating roles by name.
 */
public interface RoleResolver {

    /**
     * Find the main files of a role.
     *
     * @param baseDir directory of the playbook or role that references it
     * @throws com.vidnyan.playscan.domain.error.RoleNotFoundException when no such role exists
     */
    RoleFiles resolve(String roleName, Path baseDir);

    /**
     * Main files of a role, keyed by section ({@code tasks}, {@code handlers}, {@code defaults},
     * {@code vars}, {@code meta}). Sections without a main file are absent.
     */
    record RoleFiles(
        String roleName,
        Path rootPath,
        Map<String, Path> mainFiles
    ) {

        public static final String TASKS = "tasks";
        public static final String HANDLERS = "handlers";
        public static final String DEFAULTS = "defaults";
        public static final String VARS = "vars";
        public static final String META = "meta";

        public RoleFiles {
            mainFiles = Map.copyOf(mainFiles);
        }

        public Optional<Path> mainFile(String section) {
            return Optional.ofNullable(mainFiles.get(section));
        }
    }
}
