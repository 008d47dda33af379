package com.vidnyan.playscan.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.playscan.domain.graph.EdgeListExporter;
import com.vidnyan.playscan.domain.graph.PdgBuilder;
import com.vidnyan.playscan.domain.rule.SmellDetector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Spring configuration for playscan components.
 * Exposes the framework-free domain services as beans.
 */
@Slf4j
@Configuration
public class PlayscanConfiguration {

    /**
     * ObjectMapper for JSON parsing.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    @Bean
    public PdgBuilder pdgBuilder() {
        return new PdgBuilder();
    }

    @Bean
    public EdgeListExporter edgeListExporter() {
        return new EdgeListExporter();
    }

    /**
     * Log available detectors on startup.
     */
    @Bean
    public String logDetectors(List<SmellDetector> detectors) {
        log.info("Registered {} smell detectors:", detectors.size());
        detectors.forEach(d -> log.info("  - {} ({})", d.getName(), d.ruleId()));
        return "detectors-logged";
    }
}
