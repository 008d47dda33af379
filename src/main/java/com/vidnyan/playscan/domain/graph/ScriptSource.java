package com.vidnyan.playscan.domain.graph;

import com.vidnyan.playscan.domain.ast.RoleSources;
import com.vidnyan.playscan.domain.error.RawTreeLoadException;
import com.vidnyan.playscan.domain.error.RoleNotFoundException;
import com.vidnyan.playscan.domain.raw.RawNode;

import java.nio.file.Path;

/**
 * Where a build loads included files and roles from.
 * Calls may block on file-system access and are never retried.
 */
public interface ScriptSource {

    boolean exists(Path file);

    /**
     * @throws RawTreeLoadException when the file cannot be read or parsed
     */
    RawNode load(Path file);

    /**
     * Load the main files of a role.
     *
     * @param baseDir directory of the file that references the role
     * @throws RoleNotFoundException when no role of that name is on the search path
     */
    RoleSources loadRole(String roleName, Path baseDir);
}
