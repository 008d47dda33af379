package com.vidnyan.playscan.domain.error;

import com.vidnyan.playscan.domain.model.Location;

/**
 * A recorded analysis diagnostic, attached to the nearest containing AST node.
 */
public record Diagnostic(
    DiagnosticType type,
    String message,
    Location location,
    String astNodeId
) {

    public static Diagnostic of(DiagnosticType type, String message, Location location, String astNodeId) {
        return new Diagnostic(type, message, location != null ? location : Location.unknown(), astNodeId);
    }

    public String format() {
        return String.format("[%s] %s: %s", type, location.format(), message);
    }
}
