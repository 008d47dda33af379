package com.vidnyan.playscan;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the analysis engine.
 * Can be configured via application.properties or application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "playscan.analysis")
public class AnalysisProperties {

    /**
     * Path to the project to analyze.
     * Default: current directory
     */
    private String projectPath = ".";

    /**
     * Extra directories searched for roles, after the {@code roles/} directories next to the
     * referencing playbook.
     */
    private List<String> roleSearchPaths = new ArrayList<>();

    /**
     * Variables supplied from outside, as with {@code --extra-vars}.
     */
    private Map<String, String> extraVars = new LinkedHashMap<>();

    /**
     * Worker threads for analyzing units in parallel.
     */
    private int threads = Runtime.getRuntime().availableProcessors();

    /**
     * Rule ids to run. Empty = every enabled rule.
     */
    private List<String> enabledRules = new ArrayList<>();
}
