package com.vidnyan.playscan.domain.graph;

import com.vidnyan.playscan.domain.model.Location;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Module invocation of one executable node with its argument values.
 * Enough for dependency extraction without walking the rest of the graph.
 */
public record ModuleUsage(
    String nodeId,
    Location location,
    String module,
    boolean unanalyzable,
    Map<String, ArgumentValue> arguments
) {

    /**
     * @param raw        plain value as written
     * @param resolved   possible values after folding
     * @param references variables the raw value refers to
     */
    public record ArgumentValue(
        Object raw,
        List<ResolvedValue> resolved,
        Set<String> references
    ) {

        public boolean isResolved() {
            return !resolved.isEmpty() && resolved.stream().allMatch(ResolvedValue::isLiteral);
        }
    }
}
