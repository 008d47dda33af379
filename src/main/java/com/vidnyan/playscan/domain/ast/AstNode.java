package com.vidnyan.playscan.domain.ast;

import com.vidnyan.playscan.domain.model.Location;
import com.vidnyan.playscan.domain.raw.RawNode;
import com.vidnyan.playscan.domain.raw.RawScalar;
import com.vidnyan.playscan.domain.raw.RawSequence;
import com.vidnyan.playscan.domain.scope.PrecedenceTier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Node of the structural model of a playbook or role.
 *
 * One class for every construct, discriminated by {@link AstKind}: the shared raw attribute
 * bag holds every key of the source mapping, the typed fields hold what the kind needs.
 * The model is a tree. Children are appended while building and grafted once during
 * include expansion; nothing else mutates a node.
 */
public final class AstNode {

    private final String id;
    private final AstKind kind;
    private final Location location;
    private final ChildRole role;
    private final String name;
    private final String action;
    private final String target;
    private final Map<String, RawNode> attributes;
    private final Map<String, RawNode> arguments;
    private final PrecedenceTier tier;
    private final RawNode value;
    private final boolean synthetic;
    private final boolean handlerContext;
    private final String unanalyzableReason;

    private AstNode parent;
    private final List<AstNode> children = new ArrayList<>();
    private boolean expanded;

    private AstNode(Builder builder) {
        this.id = builder.id;
        this.kind = builder.kind;
        this.location = builder.location != null ? builder.location : Location.unknown();
        this.role = builder.role;
        this.name = builder.name;
        this.action = builder.action;
        this.target = builder.target;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
        this.arguments = Collections.unmodifiableMap(new LinkedHashMap<>(builder.arguments));
        this.tier = builder.tier;
        this.value = builder.value;
        this.synthetic = builder.synthetic;
        this.handlerContext = builder.handlerContext;
        this.unanalyzableReason = builder.unanalyzableReason;
    }

    public String id() { return id; }
    public AstKind kind() { return kind; }
    public Location location() { return location; }
    public ChildRole role() { return role; }
    public Map<String, RawNode> attributes() { return attributes; }

    /**
     * Module arguments of executable nodes, empty for everything else.
     */
    public Map<String, RawNode> arguments() { return arguments; }

    public Optional<String> name() { return Optional.ofNullable(name); }

    /**
     * Module name as written in the source, e.g. {@code ansible.builtin.get_url}.
     */
    public Optional<String> action() { return Optional.ofNullable(action); }

    /**
     * Module name without collection prefix.
     */
    public Optional<String> module() {
        return action().map(ModuleNames::shortName);
    }

    /**
     * File path or role name a directive points to.
     */
    public Optional<String> target() { return Optional.ofNullable(target); }

    public Optional<PrecedenceTier> tier() { return Optional.ofNullable(tier); }
    public Optional<RawNode> value() { return Optional.ofNullable(value); }
    public Optional<AstNode> parent() { return Optional.ofNullable(parent); }
    public List<AstNode> children() { return Collections.unmodifiableList(children); }

    /**
     * True for nodes injected by the builder rather than written in the source
     * (registered results, loop variables).
     */
    public boolean isSynthetic() { return synthetic; }

    /**
     * True when the node lives in a handler list.
     */
    public boolean isHandlerContext() { return handlerContext; }

    public boolean isUnanalyzable() { return unanalyzableReason != null; }
    public Optional<String> unanalyzableReason() { return Optional.ofNullable(unanalyzableReason); }
    public boolean isExpanded() { return expanded; }

    public Optional<RawNode> attribute(String key) {
        return Optional.ofNullable(attributes.get(key));
    }

    public List<AstNode> children(ChildRole childRole) {
        return children.stream().filter(c -> c.role == childRole).toList();
    }

    public Optional<AstNode> guard() {
        return children.stream().filter(c -> c.kind == AstKind.CONDITIONAL).findFirst();
    }

    public Optional<AstNode> loop() {
        return children.stream().filter(c -> c.kind == AstKind.LOOP).findFirst();
    }

    /**
     * Variable definitions owned directly by this node, including those below its loop.
     */
    public List<AstNode> definitions() {
        List<AstNode> defs = new ArrayList<>();
        for (AstNode child : children) {
            if (child.kind == AstKind.VARIABLE_DEFINITION) {
                defs.add(child);
            } else if (child.kind == AstKind.LOOP) {
                defs.addAll(child.definitions());
            }
        }
        return defs;
    }

    /**
     * Handler names or topics this node notifies.
     */
    public List<String> notifyTargets() {
        return textList("notify");
    }

    /**
     * Topics a handler listens to.
     */
    public List<String> listenTopics() {
        return textList("listen");
    }

    public Optional<String> registerName() {
        return attribute("register")
                .filter(RawScalar.class::isInstance)
                .map(r -> ((RawScalar) r).asText())
                .filter(s -> !s.isBlank());
    }

    /**
     * Whether the node's value is a vault-encrypted scalar.
     */
    public boolean isVaultEncrypted() {
        return value instanceof RawScalar scalar && scalar.vaultEncrypted();
    }

    public boolean hasTruthyAttribute(String key) {
        return attribute(key)
                .filter(RawScalar.class::isInstance)
                .map(r -> ((RawScalar) r).value())
                .map(v -> Boolean.TRUE.equals(v) || "yes".equalsIgnoreCase(String.valueOf(v))
                        || "true".equalsIgnoreCase(String.valueOf(v)))
                .orElse(false);
    }

    /**
     * This node and all nodes below it, in pre-order.
     */
    public Stream<AstNode> descendants() {
        return Stream.concat(Stream.of(this), children.stream().flatMap(AstNode::descendants));
    }

    /**
     * Nearest ancestor (excluding this node) of one of the given kinds.
     */
    public Optional<AstNode> enclosing(AstKind... kinds) {
        AstNode current = parent;
        while (current != null) {
            for (AstKind k : kinds) {
                if (current.kind == k) {
                    return Optional.of(current);
                }
            }
            current = current.parent;
        }
        return Optional.empty();
    }

    /**
     * Display label used in logs and messages.
     */
    public String label() {
        String base = kind.name().toLowerCase();
        if (name != null) return base + " '" + name + "'";
        if (action != null) return base + " " + action;
        return base + " " + id;
    }

    void addChild(AstNode child) {
        if (child.parent != null) {
            throw new IllegalStateException(child.id + " already has parent " + child.parent.id);
        }
        for (AstNode ancestor = this; ancestor != null; ancestor = ancestor.parent) {
            if (ancestor == child) {
                throw new IllegalStateException(child.id + " is an ancestor of " + id);
            }
        }
        child.parent = this;
        children.add(child);
    }

    /**
     * Attach the loaded content of a directive. Allowed once per directive.
     */
    public void graft(List<AstNode> loaded) {
        if (!kind.isDirective()) {
            throw new IllegalStateException("Only directives can be expanded, got " + label());
        }
        if (expanded) {
            throw new IllegalStateException(label() + " is already expanded");
        }
        loaded.forEach(this::addChild);
        expanded = true;
    }

    private List<String> textList(String key) {
        RawNode node = attributes.get(key);
        if (node instanceof RawScalar scalar && !scalar.isNull()) {
            return List.of(scalar.asText());
        }
        if (node instanceof RawSequence sequence) {
            return sequence.items().stream()
                    .filter(RawScalar.class::isInstance)
                    .map(r -> ((RawScalar) r).asText())
                    .toList();
        }
        return List.of();
    }

    @Override
    public String toString() {
        return id + ":" + label();
    }

    public static Builder builder(String id, AstKind kind) {
        return new Builder(id, kind);
    }

    public static class Builder {
        private final String id;
        private final AstKind kind;
        private Location location;
        private ChildRole role = ChildRole.ROOT;
        private String name;
        private String action;
        private String target;
        private Map<String, RawNode> attributes = Map.of();
        private Map<String, RawNode> arguments = Map.of();
        private PrecedenceTier tier;
        private RawNode value;
        private boolean synthetic;
        private boolean handlerContext;
        private String unanalyzableReason;

        private Builder(String id, AstKind kind) {
            this.id = id;
            this.kind = kind;
        }

        public Builder location(Location loc) { this.location = loc; return this; }
        public Builder role(ChildRole r) { this.role = r; return this; }
        public Builder name(String n) { this.name = n; return this; }
        public Builder action(String a) { this.action = a; return this; }
        public Builder target(String t) { this.target = t; return this; }
        public Builder attributes(Map<String, RawNode> attrs) { this.attributes = attrs; return this; }
        public Builder arguments(Map<String, RawNode> args) { this.arguments = args; return this; }
        public Builder tier(PrecedenceTier t) { this.tier = t; return this; }
        public Builder value(RawNode v) { this.value = v; return this; }
        public Builder synthetic(boolean s) { this.synthetic = s; return this; }
        public Builder handlerContext(boolean h) { this.handlerContext = h; return this; }
        public Builder unanalyzable(String reason) { this.unanalyzableReason = reason; return this; }

        public AstNode build() {
            return new AstNode(this);
        }
    }
}
