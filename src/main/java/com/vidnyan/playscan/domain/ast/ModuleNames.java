package com.vidnyan.playscan.domain.ast;

import java.util.Set;

/**
 * Module name classification.
 */
public final class ModuleNames {

    public static final Set<String> INCLUDE_TASKS = Set.of("include_tasks", "include");
    public static final Set<String> IMPORT_TASKS = Set.of("import_tasks");
    public static final Set<String> INCLUDE_VARS = Set.of("include_vars");
    public static final Set<String> ROLE_INCLUDES = Set.of("include_role", "import_role");
    public static final Set<String> SET_FACT = Set.of("set_fact");

    private ModuleNames() {
    }

    /**
     * Strip the collection prefix: {@code ansible.builtin.get_url} becomes {@code get_url}.
     */
    public static String shortName(String module) {
        int dot = module.lastIndexOf('.');
        return dot >= 0 ? module.substring(dot + 1) : module;
    }

    public static boolean isDirective(String module) {
        String s = shortName(module);
        return INCLUDE_TASKS.contains(s) || IMPORT_TASKS.contains(s)
                || INCLUDE_VARS.contains(s) || ROLE_INCLUDES.contains(s);
    }
}
