package com.vidnyan.playscan.domain.graph;

/**
 * Kinds of program dependence graph nodes.
 */
public enum PdgNodeKind {
    ENTRY,
    EXIT,
    PLAY,
    ROLE,
    BLOCK_ENTRY,
    BLOCK_EXIT,
    TASK,
    HANDLER,
    INCLUDE,
    ROLE_INCLUDE,
    DEFINITION,
    USE;

    /**
     * Nodes standing for one executed step with module arguments.
     */
    public boolean isExecutable() {
        return this == TASK || this == HANDLER || this == INCLUDE || this == ROLE_INCLUDE;
    }

    /**
     * Nodes taking part in control flow.
     */
    public boolean isControlFlow() {
        return this != DEFINITION && this != USE;
    }
}
