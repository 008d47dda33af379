package com.vidnyan.playscan.domain.rule;

import com.vidnyan.playscan.domain.model.Location;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * A detected security smell.
 * Immutable value object.
 *
 * @param pdgNodeId graph node the smell is reported on
 * @param evidence  graph nodes that contributed, e.g. the literal definitions a value was folded from
 */
public record Finding(
    String ruleId,
    String ruleName,
    RuleDefinition.Severity severity,
    String message,
    Location location,
    String pdgNodeId,
    String astNodeId,
    List<String> evidence,
    Map<String, Object> context
) {

    /**
     * Reproducible report order: file, line, column, then rule.
     */
    public static final Comparator<Finding> ORDER = Comparator
            .comparing(Finding::location)
            .thenComparing(Finding::ruleId)
            .thenComparing(Finding::message, Comparator.nullsFirst(Comparator.naturalOrder()));

    public Finding {
        location = location == null ? Location.unknown() : location;
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
        context = context == null ? Map.of() : Map.copyOf(context);
    }

    /**
     * Get context value.
     */
    @SuppressWarnings("unchecked")
    public <T> T getContext(String key, Class<T> type) {
        return (T) context.get(key);
    }

    /**
     * Builder for Finding.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String ruleId;
        private String ruleName;
        private RuleDefinition.Severity severity = RuleDefinition.Severity.ERROR;
        private String message;
        private Location location;
        private String pdgNodeId;
        private String astNodeId;
        private List<String> evidence = List.of();
        private Map<String, Object> context = Map.of();

        public Builder ruleId(String id) { this.ruleId = id; return this; }
        public Builder ruleName(String name) { this.ruleName = name; return this; }
        public Builder severity(RuleDefinition.Severity sev) { this.severity = sev; return this; }
        public Builder message(String msg) { this.message = msg; return this; }
        public Builder location(Location loc) { this.location = loc; return this; }
        public Builder pdgNodeId(String id) { this.pdgNodeId = id; return this; }
        public Builder astNodeId(String id) { this.astNodeId = id; return this; }
        public Builder evidence(List<String> ids) { this.evidence = ids; return this; }
        public Builder context(Map<String, Object> ctx) { this.context = ctx; return this; }

        public Finding build() {
            return new Finding(ruleId, ruleName, severity, message, location, pdgNodeId, astNodeId,
                    evidence, context);
        }
    }
}
