package com.vidnyan.playscan.application.port.in;

import com.vidnyan.playscan.domain.graph.AnalysisUnit;
import com.vidnyan.playscan.domain.graph.EdgeListExporter;

import java.nio.file.Path;
import java.util.Map;

/**
 * Secondary use case: build the graph of one unit and hand it out for external querying.
 */
public interface ExportGraphUseCase {

    /**
     * Flat node and edge lists of the unit's graph.
     */
    EdgeListExporter.EdgeList exportEdgeList(Path unitPath, AnalysisUnit.UnitType type,
                                             Map<String, Object> extraVars);

    /**
     * Graph database creation script of the unit's graph.
     */
    String exportQueryScript(Path unitPath, AnalysisUnit.UnitType type, Map<String, Object> extraVars);
}
