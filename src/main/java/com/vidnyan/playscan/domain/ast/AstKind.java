package com.vidnyan.playscan.domain.ast;

/**
 * Kinds of structural model nodes.
 */
public enum AstKind {
    PLAYBOOK,
    PLAY,
    ROLE,
    ROLE_INCLUDE,
    BLOCK,
    TASK,
    HANDLER,
    VARIABLE_DEFINITION,
    VARIABLE_FILE,
    IMPORT_DIRECTIVE,
    INCLUDE_DIRECTIVE,
    LOOP,
    CONDITIONAL,
    LITERAL;

    /**
     * Kinds that run as a single step of the script.
     */
    public boolean isExecutable() {
        return this == TASK || this == HANDLER || isDirective();
    }

    /**
     * Kinds whose content is loaded from another file or role during expansion.
     */
    public boolean isDirective() {
        return this == ROLE_INCLUDE || this == IMPORT_DIRECTIVE || this == INCLUDE_DIRECTIVE;
    }

    /**
     * Kinds that open a variable scope.
     */
    public boolean opensScope() {
        return this == PLAYBOOK || this == PLAY || this == ROLE || this == BLOCK
                || this == VARIABLE_FILE || isExecutable();
    }
}
