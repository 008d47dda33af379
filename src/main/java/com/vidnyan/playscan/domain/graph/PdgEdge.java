package com.vidnyan.playscan.domain.graph;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Edge of the program dependence graph.
 * Typed attributes are set per edge type: guard data for BRANCH, variable and exactness for
 * REACHES, match confidence for TRIGGERS.
 *
 * @param via for a BRANCH that replaced a block edge, the type it replaced
 * @param targetGuard for a not-taken BRANCH that ends at another guarded unit, the static value
 *                    of that unit's guard
 */
public record PdgEdge(
    String sourceId,
    String targetId,
    PdgEdgeType type,
    String guard,
    Boolean taken,
    StaticGuard staticGuard,
    PdgEdgeType via,
    StaticGuard targetGuard,
    String variable,
    Boolean exact,
    MatchConfidence confidence
) {

    public static PdgEdge of(String source, String target, PdgEdgeType type) {
        return new PdgEdge(source, target, type, null, null, null, null, null, null, null, null);
    }

    public static PdgEdge branch(String source, String target, String guard, boolean taken,
                                 StaticGuard staticGuard, PdgEdgeType via) {
        return new PdgEdge(source, target, PdgEdgeType.BRANCH, guard, taken, staticGuard, via, null, null, null, null);
    }

    /**
     * A not-taken branch that keeps its own label and enters a unit behind another guard.
     */
    public static PdgEdge skipInto(String source, String target, String guard, StaticGuard staticGuard,
                                   PdgEdgeType via, StaticGuard targetGuard) {
        return new PdgEdge(source, target, PdgEdgeType.BRANCH, guard, false, staticGuard, via, targetGuard,
                null, null, null);
    }

    public static PdgEdge reaches(String definition, String use, String variable, boolean exact) {
        return new PdgEdge(definition, use, PdgEdgeType.REACHES, null, null, null, null, null, variable, exact, null);
    }

    public static PdgEdge triggers(String notifier, String handler, MatchConfidence confidence) {
        return new PdgEdge(notifier, handler, PdgEdgeType.TRIGGERS, null, null, null, null, null, null, null, confidence);
    }

    public boolean isExact() {
        return Boolean.TRUE.equals(exact);
    }

    public boolean isTaken() {
        return Boolean.TRUE.equals(taken);
    }

    /**
     * A branch into a unit whose guard is a false literal: the target never runs along this edge.
     */
    public boolean isInfeasible() {
        if (type != PdgEdgeType.BRANCH) {
            return false;
        }
        return isTaken() && staticGuard == StaticGuard.ALWAYS_FALSE || targetGuard == StaticGuard.ALWAYS_FALSE;
    }

    /**
     * Typed attributes as a flat map, only the ones set.
     */
    public Map<String, Object> attributes() {
        Map<String, Object> attrs = new LinkedHashMap<>();
        if (guard != null) attrs.put("guard", guard);
        if (taken != null) attrs.put("taken", taken);
        if (staticGuard != null) attrs.put("staticGuard", staticGuard.name());
        if (via != null) attrs.put("via", via.name());
        if (targetGuard != null) attrs.put("targetGuard", targetGuard.name());
        if (variable != null) attrs.put("variable", variable);
        if (exact != null) attrs.put("exact", exact);
        if (confidence != null) attrs.put("confidence", confidence.name());
        return attrs;
    }
}
