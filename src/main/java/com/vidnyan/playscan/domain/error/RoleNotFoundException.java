package com.vidnyan.playscan.domain.error;

import java.nio.file.Path;
import java.util.List;

/**
 * No role with the requested name exists on the role search path.
 */
public class RoleNotFoundException extends AnalysisException {

    private final String roleName;

    public RoleNotFoundException(String roleName, List<Path> searchPaths) {
        super("Role '" + roleName + "' not found in search path " + searchPaths);
        this.roleName = roleName;
    }

    public String getRoleName() {
        return roleName;
    }
}
