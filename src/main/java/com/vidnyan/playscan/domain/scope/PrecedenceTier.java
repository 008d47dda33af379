package com.vidnyan.playscan.domain.scope;

/**
 * Variable precedence tiers, in increasing order of precedence.
 * The declaration order is the total order: a later constant wins over an earlier one.
 */
public enum PrecedenceTier {
    ROLE_DEFAULTS,
    INVENTORY_GROUP_VARS,
    INVENTORY_HOST_VARS,
    PLAY_VARS,
    PLAY_VARS_PROMPT,
    PLAY_VARS_FILES,
    ROLE_VARS,
    BLOCK_VARS,
    TASK_VARS,
    INCLUDE_VARS,
    SET_FACT,           // set_fact, register and loop variables
    ROLE_PARAMS,
    INCLUDE_PARAMS,
    EXTRA_VARS;

    /**
     * Tiers whose definitions only exist once the defining task ran.
     * Their visibility is checked against control flow, not only lexically.
     */
    public boolean isRuntime() {
        return this == SET_FACT || this == INCLUDE_VARS;
    }

    public boolean outranks(PrecedenceTier other) {
        return compareTo(other) > 0;
    }
}
