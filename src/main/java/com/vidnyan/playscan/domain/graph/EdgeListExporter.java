package com.vidnyan.playscan.domain.graph;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flattens a graph into typed node and edge lists, enough to regenerate it elsewhere
 * (a graph query script, a JSON document) without losing structure.
 */
public class EdgeListExporter {

    public record ExportedNode(String id, String label, Map<String, Object> attributes) {}

    public record ExportedEdge(String source, String target, String type, Map<String, Object> attributes) {}

    public record EdgeList(String unitName, List<ExportedNode> nodes, List<ExportedEdge> edges) {}

    public EdgeList export(ProgramDependenceGraph graph) {
        List<ExportedNode> nodes = graph.nodes().stream()
                .map(this::exportNode)
                .toList();
        List<ExportedEdge> edges = graph.edges().stream()
                .map(e -> new ExportedEdge(e.sourceId(), e.targetId(), e.type().name(), e.attributes()))
                .toList();
        return new EdgeList(graph.unitName(), nodes, edges);
    }

    private ExportedNode exportNode(PdgNode node) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("name", node.label());
        if (node.astNodeId() != null) attrs.put("astNode", node.astNodeId());
        attrs.put("location", node.location().format());
        node.module().ifPresent(m -> attrs.put("module", m));
        if (node.action() != null) attrs.put("action", node.action());
        if (!node.arguments().isEmpty()) {
            Map<String, Object> args = new LinkedHashMap<>();
            node.arguments().forEach((k, v) -> args.put(k, v.toPlainValue()));
            attrs.put("arguments", args);
        }
        if (node.ownerId() != null) attrs.put("owner", node.ownerId());
        if (node.variableName() != null) attrs.put("variable", node.variableName());
        if (node.keyword() != null) attrs.put("keyword", node.keyword());
        if (node.tier() != null) attrs.put("tier", node.tier().name());
        if (node.value() != null) attrs.put("value", node.value().toPlainValue());
        if (node.unanalyzable()) attrs.put("unanalyzable", true);
        if (node.synthetic()) attrs.put("synthetic", true);
        return new ExportedNode(node.id(), toLabel(node.kind()), attrs);
    }

    /**
     * Node kind as a graph label, e.g. {@code BLOCK_ENTRY} becomes {@code BlockEntry}.
     */
    static String toLabel(PdgNodeKind kind) {
        StringBuilder label = new StringBuilder();
        for (String part : kind.name().split("_")) {
            label.append(part.charAt(0)).append(part.substring(1).toLowerCase());
        }
        return label.toString();
    }
}
