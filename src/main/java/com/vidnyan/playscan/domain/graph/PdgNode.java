package com.vidnyan.playscan.domain.graph;

import com.vidnyan.playscan.domain.model.Location;
import com.vidnyan.playscan.domain.raw.RawNode;
import com.vidnyan.playscan.domain.raw.RawScalar;
import com.vidnyan.playscan.domain.scope.PrecedenceTier;

import java.util.Map;
import java.util.Optional;

/**
 * Node of the program dependence graph.
 * Immutable value object; which fields are set depends on the kind.
 *
 * @param ownerId   for definitions and uses, the node they belong to
 * @param keyword   for uses, the path of the attribute holding the reference, e.g. {@code args.url}
 * @param value     for definitions, the raw value
 */
public record PdgNode(
    String id,
    String astNodeId,
    PdgNodeKind kind,
    Location location,
    String label,
    String ownerId,
    String variableName,
    String keyword,
    String action,
    Map<String, RawNode> arguments,
    PrecedenceTier tier,
    RawNode value,
    boolean unanalyzable,
    boolean synthetic
) {

    public PdgNode {
        arguments = arguments == null ? Map.of() : arguments;
    }

    /**
     * Module name without collection prefix, for executable nodes.
     */
    public Optional<String> module() {
        if (action == null) {
            return Optional.empty();
        }
        int dot = action.lastIndexOf('.');
        return Optional.of(dot >= 0 ? action.substring(dot + 1) : action);
    }

    public Optional<String> variable() {
        return Optional.ofNullable(variableName);
    }

    public Optional<String> owner() {
        return Optional.ofNullable(ownerId);
    }

    public boolean isVaultEncrypted() {
        return value instanceof RawScalar scalar && scalar.vaultEncrypted();
    }

    public static Builder builder(String id, PdgNodeKind kind) {
        return new Builder(id, kind);
    }

    public static class Builder {
        private final String id;
        private final PdgNodeKind kind;
        private String astNodeId;
        private Location location = Location.unknown();
        private String label;
        private String ownerId;
        private String variableName;
        private String keyword;
        private String action;
        private Map<String, RawNode> arguments = Map.of();
        private PrecedenceTier tier;
        private RawNode value;
        private boolean unanalyzable;
        private boolean synthetic;

        private Builder(String id, PdgNodeKind kind) {
            this.id = id;
            this.kind = kind;
            this.label = kind.name();
        }

        public Builder astNode(String astId) { this.astNodeId = astId; return this; }
        public Builder location(Location loc) { this.location = loc; return this; }
        public Builder label(String l) { this.label = l; return this; }
        public Builder owner(String owner) { this.ownerId = owner; return this; }
        public Builder variable(String name) { this.variableName = name; return this; }
        public Builder keyword(String k) { this.keyword = k; return this; }
        public Builder action(String a) { this.action = a; return this; }
        public Builder arguments(Map<String, RawNode> args) { this.arguments = args; return this; }
        public Builder tier(PrecedenceTier t) { this.tier = t; return this; }
        public Builder value(RawNode v) { this.value = v; return this; }
        public Builder unanalyzable(boolean u) { this.unanalyzable = u; return this; }
        public Builder synthetic(boolean s) { this.synthetic = s; return this; }

        public PdgNode build() {
            return new PdgNode(id, astNodeId, kind, location, label, ownerId, variableName, keyword,
                    action, arguments, tier, value, unanalyzable, synthetic);
        }
    }
}
