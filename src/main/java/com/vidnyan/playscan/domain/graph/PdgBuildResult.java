package com.vidnyan.playscan.domain.graph;

import com.vidnyan.playscan.domain.ast.AstNode;
import com.vidnyan.playscan.domain.error.Diagnostic;
import com.vidnyan.playscan.domain.error.DiagnosticType;

import java.util.List;

/**
 * Graph of one unit together with its expanded AST and the diagnostics recorded while building.
 */
public record PdgBuildResult(
    ProgramDependenceGraph graph,
    AstNode ast,
    List<Diagnostic> diagnostics
) {

    public PdgBuildResult {
        diagnostics = List.copyOf(diagnostics);
    }

    public List<Diagnostic> diagnostics(DiagnosticType type) {
        return diagnostics.stream().filter(d -> d.type() == type).toList();
    }
}
