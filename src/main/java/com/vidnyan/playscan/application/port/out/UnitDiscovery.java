package com.vidnyan.playscan.application.port.out;

import com.vidnyan.playscan.domain.graph.AnalysisUnit;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Port for finding the top-level playbooks and roles of a project.
 */
public interface UnitDiscovery {

    List<DiscoveredUnit> discover(Path projectPath) throws IOException;

    record DiscoveredUnit(Path path, AnalysisUnit.UnitType type) {}
}
