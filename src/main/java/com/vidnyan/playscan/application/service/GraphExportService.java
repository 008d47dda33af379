package com.vidnyan.playscan.application.service;

import com.vidnyan.playscan.application.port.in.ExportGraphUseCase;
import com.vidnyan.playscan.application.port.out.GraphScriptWriter;
import com.vidnyan.playscan.application.port.out.RawTreeLoader;
import com.vidnyan.playscan.application.port.out.RoleResolver;
import com.vidnyan.playscan.domain.graph.AnalysisUnit;
import com.vidnyan.playscan.domain.graph.EdgeListExporter;
import com.vidnyan.playscan.domain.graph.PdgBuildResult;
import com.vidnyan.playscan.domain.graph.PdgBuilder;
import com.vidnyan.playscan.domain.graph.ScriptSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Map;

/**
 * Builds a single unit and exports its graph.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GraphExportService implements ExportGraphUseCase {

    private final RawTreeLoader rawTreeLoader;
    private final RoleResolver roleResolver;
    private final PdgBuilder pdgBuilder;
    private final EdgeListExporter edgeListExporter;
    private final GraphScriptWriter graphScriptWriter;

    @Override
    public EdgeListExporter.EdgeList exportEdgeList(Path unitPath, AnalysisUnit.UnitType type,
                                                    Map<String, Object> extraVars) {
        ScriptSource source = new PortScriptSource(rawTreeLoader, roleResolver);
        AnalysisUnit unit = type == AnalysisUnit.UnitType.ROLE
                ? AnalysisUnit.role(unitPath, source)
                : AnalysisUnit.playbook(unitPath, source);
        PdgBuildResult built = pdgBuilder.build(unit.withExtraVars(extraVars));
        EdgeListExporter.EdgeList edgeList = edgeListExporter.export(built.graph());
        log.info("Exported {}: {} nodes, {} edges", unit.name(), edgeList.nodes().size(), edgeList.edges().size());
        return edgeList;
    }

    @Override
    public String exportQueryScript(Path unitPath, AnalysisUnit.UnitType type, Map<String, Object> extraVars) {
        return graphScriptWriter.write(exportEdgeList(unitPath, type, extraVars));
    }
}
