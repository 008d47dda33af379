package com.vidnyan.playscan.domain.error;

import java.util.ArrayList;
import java.util.List;

/**
 * Fatal failure of a single analysis unit.
 * Carries the diagnostics collected before the failure so they can still be reported.
 */
public class AnalysisException extends RuntimeException {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public AnalysisException(String message) {
        super(message);
    }

    public AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }

    public List<Diagnostic> getDiagnostics() {
        return List.copyOf(diagnostics);
    }

    public AnalysisException withDiagnostics(List<Diagnostic> collected) {
        diagnostics.addAll(collected);
        return this;
    }
}
