package com.vidnyan.playscan.domain.graph;

import java.nio.file.Path;
import java.util.Map;

/**
 * A top-level playbook or role analyzed on its own.
 *
 * @param path      playbook file, or role directory
 * @param extraVars variables supplied from outside, highest precedence
 */
public record AnalysisUnit(
    String name,
    UnitType type,
    Path path,
    Map<String, Object> extraVars,
    ScriptSource source
) {

    public enum UnitType {
        PLAYBOOK,
        ROLE
    }

    public AnalysisUnit {
        extraVars = extraVars == null ? Map.of() : Map.copyOf(extraVars);
    }

    public static AnalysisUnit playbook(Path file, ScriptSource source) {
        return new AnalysisUnit(file.toString(), UnitType.PLAYBOOK, file, Map.of(), source);
    }

    public static AnalysisUnit role(Path roleDir, ScriptSource source) {
        return new AnalysisUnit(roleDir.getFileName().toString(), UnitType.ROLE, roleDir, Map.of(), source);
    }

    public AnalysisUnit withExtraVars(Map<String, Object> vars) {
        return new AnalysisUnit(name, type, path, vars, source);
    }
}
