package com.vidnyan.playscan.adapter.out.rule;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.playscan.application.port.out.RuleRepository;
import com.vidnyan.playscan.domain.rule.RuleDefinition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.InputStream;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * File system based rule repository.
 * Loads rule metadata and detector settings from JSON files in the classpath.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FileSystemRuleRepository implements RuleRepository {

    private final ObjectMapper objectMapper;

    @Value("${playscan.rules.path:classpath*:rules/*.json}")
    private String rulesPath;

    private final Map<String, RuleDefinition> rules = new ConcurrentHashMap<>();

    @PostConstruct
    public void loadRules() {
        loadRules(rulesPath);
    }

    /**
     * Load every rule file matching the location pattern.
     */
    public void loadRules(String locationPattern) {
        try {
            PathMatchingResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
            Resource[] resources = resolver.getResources(locationPattern);

            for (Resource resource : resources) {
                try (InputStream in = resource.getInputStream()) {
                    RuleDto dto = objectMapper.readValue(in, RuleDto.class);
                    RuleDefinition rule = mapToRule(dto);
                    rules.put(rule.id(), rule);
                    log.info("Loaded rule: {} - {}", rule.id(), rule.name());
                } catch (IOException | IllegalArgumentException e) {
                    log.warn("Failed to load rule from {}: {}", resource.getFilename(), e.getMessage());
                }
            }

            log.info("Loaded {} rules from {}", rules.size(), locationPattern);
        } catch (IOException e) {
            log.error("Failed to load rules", e);
        }
    }

    @Override
    public List<RuleDefinition> findAll() {
        return rules.values().stream()
                .sorted(Comparator.comparing(RuleDefinition::id))
                .toList();
    }

    @Override
    public Optional<RuleDefinition> findById(String ruleId) {
        return Optional.ofNullable(rules.get(ruleId));
    }

    @Override
    public List<RuleDefinition> findByCategory(RuleDefinition.Category category) {
        return findAll().stream()
                .filter(r -> r.category() == category)
                .toList();
    }

    @Override
    public List<RuleDefinition> findEnabled() {
        return findAll().stream()
                .filter(RuleDefinition::isEnabled)
                .toList();
    }

    private RuleDefinition mapToRule(RuleDto dto) {
        if (dto.id == null || dto.id.isBlank()) {
            throw new IllegalArgumentException("rule without id");
        }
        return RuleDefinition.builder()
                .id(dto.id)
                .name(dto.name != null ? dto.name : dto.id)
                .description(dto.description)
                .severity(parseEnum(RuleDefinition.Severity.class, dto.severity, RuleDefinition.Severity.ERROR, dto.id))
                .category(parseEnum(RuleDefinition.Category.class, dto.category, RuleDefinition.Category.CUSTOM, dto.id))
                .remediation(mapRemediation(dto.remediation))
                .config(dto.config != null ? dto.config : Map.of())
                .isEnabled(dto.isEnabled != null ? dto.isEnabled : true)
                .build();
    }

    /**
     * Enum constant by case-insensitive name; dashes and spaces count as underscores.
     * Unknown values fall back with a warning so one typo does not drop the rule.
     */
    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, E fallback, String ruleId) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        if (type == RuleDefinition.Severity.class && normalized.equals("WARNING")) {
            normalized = "WARN";
        }
        try {
            return Enum.valueOf(type, normalized);
        } catch (IllegalArgumentException e) {
            log.warn("Rule {}: unknown {} '{}', using {}", ruleId, type.getSimpleName().toLowerCase(Locale.ROOT),
                    value, fallback);
            return fallback;
        }
    }

    private RuleDefinition.Remediation mapRemediation(RemediationDto dto) {
        if (dto == null) return null;
        return new RuleDefinition.Remediation(
                dto.quickFix,
                dto.explanation,
                dto.references != null ? dto.references : List.of()
        );
    }

    // JSON shape of a rule file
    static class RuleDto {
        public String id;
        public String name;
        public String description;
        public String severity;
        public String category;
        public RemediationDto remediation;
        public Map<String, Object> config;
        public Boolean isEnabled;
    }

    static class RemediationDto {
        public String quickFix;
        public String explanation;
        public List<String> references;
    }
}
