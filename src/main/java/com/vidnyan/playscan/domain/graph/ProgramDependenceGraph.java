package com.vidnyan.playscan.domain.graph;

import com.vidnyan.playscan.domain.raw.RawNode;
import com.vidnyan.playscan.domain.raw.RawScalar;
import com.vidnyan.playscan.domain.raw.RawSequence;
import com.vidnyan.playscan.domain.template.TemplateReferenceExtractor;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Program dependence graph of one analysis unit.
 * Directed multigraph over control-flow, data-flow and handler-trigger edges with
 * precomputed indices. Immutable and thread-safe once built.
 */
public final class ProgramDependenceGraph {

    private static final Pattern PURE_REFERENCE =
            Pattern.compile("^\\s*\\{\\{-?\\s*([A-Za-z_][A-Za-z0-9_]*)\\s*-?}}\\s*$");

    private final String unitName;
    private final Map<String, PdgNode> nodes;
    private final List<PdgEdge> edges;
    private final Map<String, List<PdgEdge>> outgoing;
    private final Map<String, List<PdgEdge>> incoming;
    private final Map<String, List<PdgNode>> owned;
    private final Map<String, List<String>> byAstNode;
    private final String entryId;
    private final String exitId;

    private ProgramDependenceGraph(String unitName, Map<String, PdgNode> nodes, List<PdgEdge> edges,
                                   String entryId, String exitId) {
        this.unitName = unitName;
        this.nodes = Collections.unmodifiableMap(nodes);
        this.edges = List.copyOf(edges);
        this.entryId = entryId;
        this.exitId = exitId;

        Map<String, List<PdgEdge>> out = new HashMap<>();
        Map<String, List<PdgEdge>> in = new HashMap<>();
        for (PdgEdge edge : edges) {
            out.computeIfAbsent(edge.sourceId(), k -> new ArrayList<>()).add(edge);
            in.computeIfAbsent(edge.targetId(), k -> new ArrayList<>()).add(edge);
        }
        Map<String, List<PdgNode>> ownedIndex = new HashMap<>();
        Map<String, List<String>> astIndex = new HashMap<>();
        for (PdgNode node : nodes.values()) {
            if (node.ownerId() != null) {
                ownedIndex.computeIfAbsent(node.ownerId(), k -> new ArrayList<>()).add(node);
            }
            if (node.astNodeId() != null) {
                astIndex.computeIfAbsent(node.astNodeId(), k -> new ArrayList<>()).add(node.id());
            }
        }
        this.outgoing = Collections.unmodifiableMap(out);
        this.incoming = Collections.unmodifiableMap(in);
        this.owned = Collections.unmodifiableMap(ownedIndex);
        this.byAstNode = Collections.unmodifiableMap(astIndex);
    }

    /**
     * Assemble a graph. Every edge must connect existing nodes.
     */
    public static ProgramDependenceGraph of(String unitName, List<PdgNode> nodes, List<PdgEdge> edges,
                                            String entryId, String exitId) {
        Map<String, PdgNode> byId = new LinkedHashMap<>();
        for (PdgNode node : nodes) {
            if (byId.put(node.id(), node) != null) {
                throw new IllegalStateException("Duplicate PDG node id " + node.id());
            }
        }
        for (PdgEdge edge : edges) {
            if (!byId.containsKey(edge.sourceId()) || !byId.containsKey(edge.targetId())) {
                throw new IllegalStateException("Dangling edge " + edge.sourceId() + " -> " + edge.targetId());
            }
        }
        return new ProgramDependenceGraph(unitName, byId, edges, entryId, exitId);
    }

    public String unitName() {
        return unitName;
    }

    public Collection<PdgNode> nodes() {
        return nodes.values();
    }

    public List<PdgEdge> edges() {
        return edges;
    }

    public Optional<PdgNode> node(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public PdgNode entry() {
        return nodes.get(entryId);
    }

    public PdgNode exit() {
        return nodes.get(exitId);
    }

    public List<PdgNode> nodesOfKind(PdgNodeKind kind) {
        return nodes.values().stream().filter(n -> n.kind() == kind).toList();
    }

    /**
     * Tasks, handlers, includes and role includes, in construction order.
     */
    public List<PdgNode> executableNodes() {
        return nodes.values().stream().filter(n -> n.kind().isExecutable()).toList();
    }

    public List<PdgEdge> outgoing(String nodeId) {
        return outgoing.getOrDefault(nodeId, List.of());
    }

    public List<PdgEdge> incoming(String nodeId) {
        return incoming.getOrDefault(nodeId, List.of());
    }

    public List<PdgEdge> outgoing(String nodeId, PdgEdgeType type) {
        return outgoing(nodeId).stream().filter(e -> e.type() == type).toList();
    }

    public List<PdgEdge> incoming(String nodeId, PdgEdgeType type) {
        return incoming(nodeId).stream().filter(e -> e.type() == type).toList();
    }

    public List<PdgEdge> edgesOfType(PdgEdgeType type) {
        return edges.stream().filter(e -> e.type() == type).toList();
    }

    /**
     * PDG nodes created for an AST node.
     */
    public List<PdgNode> nodesForAst(String astNodeId) {
        return byAstNode.getOrDefault(astNodeId, List.of()).stream().map(nodes::get).toList();
    }

    /**
     * Uses and definitions belonging to a node.
     */
    public List<PdgNode> ownedBy(String ownerId) {
        return owned.getOrDefault(ownerId, List.of());
    }

    public List<PdgNode> usesOf(String ownerId) {
        return ownedBy(ownerId).stream().filter(n -> n.kind() == PdgNodeKind.USE).toList();
    }

    public List<PdgNode> definitionsOf(String ownerId) {
        return ownedBy(ownerId).stream().filter(n -> n.kind() == PdgNodeKind.DEFINITION).toList();
    }

    public Optional<PdgNode> use(String ownerId, String keyword, String variable) {
        return usesOf(ownerId).stream()
                .filter(u -> keyword.equals(u.keyword()) && variable.equals(u.variableName()))
                .findFirst();
    }

    /**
     * Definitions reaching a use, with the edge that carries them.
     */
    public List<PdgEdge> reachingDefinitions(String useId) {
        return incoming(useId, PdgEdgeType.REACHES);
    }

    /**
     * Nodes reachable from the start node along edges accepted by the filter, start included.
     */
    public Set<String> reachableFrom(String startId, Predicate<PdgEdge> follow) {
        Set<String> visited = new LinkedHashSet<>();
        Queue<String> queue = new ArrayDeque<>();
        queue.add(startId);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (!visited.add(current)) {
                continue;
            }
            for (PdgEdge edge : outgoing(current)) {
                if (follow.test(edge) && !visited.contains(edge.targetId())) {
                    queue.add(edge.targetId());
                }
            }
        }
        return visited;
    }

    /**
     * Possible values of an attribute of a node, folded across REACHES edges back to
     * literal definitions. Only whole-value references ({@code "{{ name }}"}) are followed.
     *
     * @param ownerId node holding the attribute
     * @param keyword attribute path used for the node's uses, e.g. {@code args.password}
     */
    public List<ResolvedValue> resolveValue(String ownerId, String keyword, RawNode raw) {
        return fold(ownerId, keyword, raw, new HashSet<>());
    }

    private List<ResolvedValue> fold(String ownerId, String keyword, RawNode raw, Set<String> visited) {
        if (raw == null) {
            return List.of(ResolvedValue.literal(null, null));
        }
        if (!(raw instanceof RawScalar scalar)) {
            return List.of(ResolvedValue.computed(null));
        }
        if (scalar.vaultEncrypted()) {
            return List.of(ResolvedValue.vault(null));
        }
        if (!scalar.isString() || !TemplateReferenceExtractor.isTemplated(scalar.asText())) {
            return List.of(ResolvedValue.literal(scalar.value(), null));
        }
        Matcher m = PURE_REFERENCE.matcher(scalar.asText());
        if (!m.matches()) {
            return List.of(ResolvedValue.computed(null));
        }
        String variable = m.group(1);
        Optional<PdgNode> use = use(ownerId, keyword, variable);
        List<PdgEdge> reaching = use.map(u -> reachingDefinitions(u.id())).orElse(List.of());
        if (reaching.isEmpty()) {
            return List.of(ResolvedValue.external(variable));
        }

        List<ResolvedValue> values = new ArrayList<>();
        for (PdgEdge edge : reaching) {
            PdgNode definition = nodes.get(edge.sourceId());
            if (!visited.add(definition.id())) {
                values.add(ResolvedValue.computed(definition.id()));
                continue;
            }
            values.addAll(foldDefinition(definition, visited));
            visited.remove(definition.id());
        }
        return values;
    }

    private List<ResolvedValue> foldDefinition(PdgNode definition, Set<String> visited) {
        if (definition.isVaultEncrypted()) {
            return List.of(ResolvedValue.vault(definition.id()));
        }
        String keyword = definition.keyword();
        if ("register".equals(keyword) || "index".equals(keyword)) {
            return List.of(ResolvedValue.computed(definition.id()));
        }
        List<ResolvedValue> folded = new ArrayList<>();
        if ("loop".equals(keyword) && definition.value() instanceof RawSequence items) {
            for (RawNode item : items.items()) {
                folded.addAll(fold(definition.id(), "value", item, visited));
            }
        } else {
            folded.addAll(fold(definition.id(), "value", definition.value(), visited));
        }
        return folded.stream()
                .map(v -> v.sourceNodeId() == null ? new ResolvedValue(v.kind(), v.value(), definition.id()) : v)
                .toList();
    }

    /**
     * Module name and argument values of every executable node.
     */
    public List<ModuleUsage> moduleUsages() {
        List<ModuleUsage> usages = new ArrayList<>();
        for (PdgNode node : executableNodes()) {
            if (node.module().isEmpty()) {
                continue;
            }
            Map<String, ModuleUsage.ArgumentValue> args = new LinkedHashMap<>();
            node.arguments().forEach((key, raw) -> {
                String keyword = "args." + key;
                Set<String> references = new LinkedHashSet<>();
                usesOf(node.id()).stream()
                        .filter(u -> u.keyword().equals(keyword) || u.keyword().startsWith(keyword + "."))
                        .forEach(u -> references.add(u.variableName()));
                args.put(key, new ModuleUsage.ArgumentValue(
                        raw.toPlainValue(), resolveValue(node.id(), keyword, raw), references));
            });
            usages.add(new ModuleUsage(node.id(), node.location(), node.module().get(), node.unanalyzable(), args));
        }
        return usages;
    }

    public Stats stats() {
        return new Stats(
                nodes.size(),
                edges.size(),
                (int) nodes.values().stream().filter(n -> n.kind().isExecutable()).count(),
                (int) edges.stream().filter(e -> e.type() == PdgEdgeType.REACHES).count()
        );
    }

    public record Stats(int nodeCount, int edgeCount, int executableCount, int dataFlowEdgeCount) {}
}
