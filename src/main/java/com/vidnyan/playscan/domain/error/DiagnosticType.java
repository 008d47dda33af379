package com.vidnyan.playscan.domain.error;

/**
 * Kinds of recorded analysis diagnostics.
 */
public enum DiagnosticType {
    PARSE_WARNING,          // Malformed template expression, no reference extracted
    UNRESOLVED_VARIABLE,    // Variable use without any visible definition
    UNANALYZABLE_NODE,      // Module arguments could not be interpreted
    DEAD_NOTIFICATION,      // notify without a matching handler
    MISSING_INCLUDE,        // Included task or variable file could not be loaded
    ROLE_NOT_FOUND,
    CYCLIC_INCLUDE;

    /**
     * Whether this diagnostic makes the whole unit unreliable.
     */
    public boolean isFatal() {
        return this == ROLE_NOT_FOUND || this == CYCLIC_INCLUDE;
    }
}
