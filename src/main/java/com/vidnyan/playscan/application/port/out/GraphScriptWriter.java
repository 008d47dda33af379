package com.vidnyan.playscan.application.port.out;

import com.vidnyan.playscan.domain.graph.EdgeListExporter;

/**
 * Port for rendering an exported graph as a script an external graph database can ingest.
 */
public interface GraphScriptWriter {

    String write(EdgeListExporter.EdgeList graph);
}
