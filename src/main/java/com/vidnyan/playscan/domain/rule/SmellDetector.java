package com.vidnyan.playscan.domain.rule;

import com.vidnyan.playscan.domain.graph.PdgEdgeType;
import com.vidnyan.playscan.domain.graph.PdgNodeKind;

import java.util.Set;

/**
 * A security smell detector: a read-only predicate over a finished graph.
 * Detectors never see each other's findings and must not keep state between calls.
 */
public interface SmellDetector {

    /**
     * Id of the rule this detector implements.
     */
    String ruleId();

    /**
     * Check if this detector can handle the given rule.
     */
    default boolean supports(RuleDefinition rule) {
        return ruleId().equals(rule.id());
    }

    /**
     * Evaluate the rule against one graph.
     */
    EvaluationResult evaluate(EvaluationContext context);

    /**
     * Node kinds the detector inspects.
     */
    Set<PdgNodeKind> requiredNodeKinds();

    /**
     * Edge types the detector follows, empty for detectors that only look at attributes.
     */
    default Set<PdgEdgeType> requiredEdgeTypes() {
        return Set.of();
    }

    /**
     * Get the detector name for logging.
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
