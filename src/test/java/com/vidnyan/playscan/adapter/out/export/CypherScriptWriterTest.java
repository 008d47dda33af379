package com.vidnyan.playscan.adapter.out.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.playscan.domain.graph.EdgeListExporter;
import com.vidnyan.playscan.support.InMemoryScriptSource;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CypherScriptWriterTest {

    private final CypherScriptWriter writer = new CypherScriptWriter(new ObjectMapper());

    @Test
    void writesSingleCreateStatement() {
        Map<String, Object> taskAttrs = new LinkedHashMap<>();
        taskAttrs.put("name", "task 'copy'");
        taskAttrs.put("arguments", Map.of("mode", "0644"));
        taskAttrs.put("odd key", 1);
        EdgeListExporter.EdgeList graph = new EdgeListExporter.EdgeList("site",
                List.of(new EdgeListExporter.ExportedNode("pdg-1", "Entry", Map.of("name", "entry site")),
                        new EdgeListExporter.ExportedNode("pdg-2", "Task", taskAttrs)),
                List.of(new EdgeListExporter.ExportedEdge("pdg-1", "pdg-2", "SEQUENCE", Map.of())));

        String script = writer.write(graph);

        assertEquals("// site\n"
                + "CREATE (npdg1:Entry { node_id: \"pdg-1\", name: \"entry site\" }),\n"
                + "       (npdg2:Task { node_id: \"pdg-2\", name: \"task 'copy'\", "
                + "arguments: \"{\\\"mode\\\":\\\"0644\\\"}\", `odd key`: 1 }),\n"
                + "       (npdg1)-[:SEQUENCE {  }]->(npdg2);\n", script);
    }

    @Test
    void emptyGraphWritesNothing() {
        assertEquals("", writer.write(new EdgeListExporter.EdgeList("empty", List.of(), List.of())));
    }

    @Test
    void exportedPlaybookReferencesEveryNode() {
        EdgeListExporter.EdgeList graph = new EdgeListExporter().export(InMemoryScriptSource.buildPlaybook("""
                - hosts: all
                  tasks:
                    - name: copy
                      copy: src=a dest=/b
                      when: enabled
                """).graph());

        String script = writer.write(graph);

        assertTrue(script.startsWith("// "));
        assertTrue(script.endsWith(";\n"));
        graph.nodes().forEach(n -> assertTrue(script.contains("node_id: \"" + n.id() + "\"")));
        assertTrue(script.contains(":BRANCH {"));
        assertTrue(script.contains("(npdg1:Entry"));
    }
}
