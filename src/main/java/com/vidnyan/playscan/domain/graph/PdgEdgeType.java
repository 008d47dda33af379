package com.vidnyan.playscan.domain.graph;

/**
 * Kinds of program dependence graph edges.
 */
public enum PdgEdgeType {
    SEQUENCE,
    BRANCH,
    BLOCK_FAILURE,
    BLOCK_SUCCESS,
    LOOP_ITERATE,
    REACHES,
    TRIGGERS;

    /**
     * Edges followed when walking execution order. Handler triggers are excluded,
     * handlers already follow the play body in sequence.
     */
    public boolean isControlFlow() {
        return this != REACHES && this != TRIGGERS;
    }
}
