package com.vidnyan.playscan.adapter.out.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.playscan.application.port.out.GraphScriptWriter;
import com.vidnyan.playscan.domain.graph.EdgeListExporter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Renders an exported graph as one Cypher {@code CREATE} statement.
 *
 * <p>Node variables are the node ids with dashes removed. Property values are written as JSON
 * literals; nested maps and lists, which Cypher properties cannot hold, are written as JSON
 * strings.</p>
 */
@Component
@RequiredArgsConstructor
public class CypherScriptWriter implements GraphScriptWriter {

    private static final Pattern PLAIN_KEY = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final ObjectMapper objectMapper;

    @Override
    public String write(EdgeListExporter.EdgeList graph) {
        Map<String, String> variables = new HashMap<>();
        List<String> clauses = new ArrayList<>();
        for (EdgeListExporter.ExportedNode node : graph.nodes()) {
            String variable = "n" + node.id().replaceAll("[^A-Za-z0-9_]", "");
            variables.put(node.id(), variable);
            clauses.add("(" + variable + ":" + node.label() + " " + properties(node.attributes(), node.id()) + ")");
        }
        for (EdgeListExporter.ExportedEdge edge : graph.edges()) {
            clauses.add("(" + variables.get(edge.source()) + ")-[:" + edge.type() + " "
                    + properties(edge.attributes(), null) + "]->(" + variables.get(edge.target()) + ")");
        }
        if (clauses.isEmpty()) {
            return "";
        }
        return "// " + graph.unitName() + "\nCREATE " + String.join(",\n       ", clauses) + ";\n";
    }

    private String properties(Map<String, Object> attributes, String id) {
        List<String> entries = new ArrayList<>();
        if (id != null) {
            entries.add("node_id: " + json(id));
        }
        attributes.forEach((key, value) -> entries.add(key(key) + ": " + json(flatten(value))));
        return "{ " + String.join(", ", entries) + " }";
    }

    private Object flatten(Object value) {
        if (value instanceof Map<?, ?> || value instanceof List<?>) {
            return json(value);
        }
        return value;
    }

    private static String key(String key) {
        return PLAIN_KEY.matcher(key).matches() ? key : "`" + key.replace("`", "``") + "`";
    }

    private String json(Object value) {
        try {
            return objectMapper.writer().without(SerializationFeature.INDENT_OUTPUT)
                    .writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize graph attribute " + value, e);
        }
    }
}
