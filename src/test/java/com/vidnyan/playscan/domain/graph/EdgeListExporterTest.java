package com.vidnyan.playscan.domain.graph;

import com.vidnyan.playscan.support.InMemoryScriptSource;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EdgeListExporterTest {

    @Test
    void labelsAreCamelCased() {
        assertEquals("BlockEntry", EdgeListExporter.toLabel(PdgNodeKind.BLOCK_ENTRY));
        assertEquals("Task", EdgeListExporter.toLabel(PdgNodeKind.TASK));
    }

    @Test
    void exportKeepsEveryNodeAndEdge() {
        ProgramDependenceGraph graph = InMemoryScriptSource.buildPlaybook("""
                - hosts: all
                  vars:
                    port: 80
                  tasks:
                    - name: open
                      ufw: rule=allow port={{ port }}
                """).graph();

        EdgeListExporter.EdgeList exported = new EdgeListExporter().export(graph);

        assertEquals(graph.nodes().size(), exported.nodes().size());
        assertEquals(graph.edges().size(), exported.edges().size());
        EdgeListExporter.ExportedNode task = exported.nodes().stream()
                .filter(n -> n.label().equals("Task"))
                .findFirst()
                .orElseThrow();
        assertEquals("ufw", task.attributes().get("module"));
        assertTrue(task.attributes().get("arguments") instanceof Map<?, ?>);
        assertTrue(exported.edges().stream().anyMatch(e -> e.type().equals("REACHES")));
    }
}
