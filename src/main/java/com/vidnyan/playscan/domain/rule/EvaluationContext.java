package com.vidnyan.playscan.domain.rule;

import com.vidnyan.playscan.domain.graph.ProgramDependenceGraph;

/**
 * Context provided to smell detectors.
 */
public record EvaluationContext(
    RuleDefinition rule,
    ProgramDependenceGraph graph
) {

    public static EvaluationContext of(RuleDefinition rule, ProgramDependenceGraph graph) {
        return new EvaluationContext(rule, graph);
    }
}
