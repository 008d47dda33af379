package com.vidnyan.playscan.domain.ast;

/**
 * Role of a child within its parent. Children with the same role keep source order.
 */
public enum ChildRole {
    ROOT,
    PLAYS,
    VARS,
    PRE_TASKS,
    ROLES,
    TASKS,
    POST_TASKS,
    HANDLERS,
    BODY,
    RESCUE,
    ALWAYS,
    GUARD,
    LOOP,
    FACTS,
    VALUE,
    INCLUDED;

    /**
     * Roles of children that take part in sequential control flow.
     */
    public boolean isControlFlow() {
        return switch (this) {
            case PLAYS, PRE_TASKS, ROLES, TASKS, POST_TASKS, BODY, RESCUE, ALWAYS, INCLUDED -> true;
            default -> false;
        };
    }
}
