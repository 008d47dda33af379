package com.vidnyan.playscan.domain.rule;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Rule definition - describes which smell to look for and how to report it.
 * Immutable value object loaded from JSON.
 */
public record RuleDefinition(
    String id,
    String name,
    String description,
    Severity severity,
    Category category,
    Remediation remediation,
    Map<String, Object> config,
    boolean isEnabled
) {

    public enum Severity {
        BLOCKER,    // Must fix before deployment
        ERROR,      // Should fix before deployment
        WARN,       // Should fix but not blocking
        INFO        // Informational
    }

    public enum Category {
        SECRETS,
        AUTHENTICATION,
        INTEGRITY,
        TRANSPORT,
        NETWORK,
        CRYPTOGRAPHY,
        REACHABILITY,
        CUSTOM
    }

    /**
     * Remediation guidance.
     */
    public record Remediation(
        String quickFix,
        String explanation,
        List<String> references
    ) {}

    public RuleDefinition {
        config = config == null ? Map.of() : Map.copyOf(config);
    }

    /**
     * Get config value.
     */
    @SuppressWarnings("unchecked")
    public <T> Optional<T> getConfig(String key, Class<T> type) {
        Object value = config.get(key);
        return type.isInstance(value) ? Optional.of((T) value) : Optional.empty();
    }

    /**
     * String list from config, lower-cased; the fallback when the key is absent.
     */
    public List<String> getTokens(String key, List<String> fallback) {
        Object value = config.get(key);
        if (!(value instanceof List<?> list)) {
            return fallback;
        }
        return list.stream()
                .map(String::valueOf)
                .map(s -> s.toLowerCase(Locale.ROOT))
                .toList();
    }

    public boolean getFlag(String key, boolean fallback) {
        return getConfig(key, Boolean.class).orElse(fallback);
    }

    /**
     * Builder for RuleDefinition.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String name;
        private String description;
        private Severity severity = Severity.ERROR;
        private Category category = Category.CUSTOM;
        private Remediation remediation;
        private Map<String, Object> config = Map.of();
        private boolean isEnabled = true;

        public Builder id(String id) { this.id = id; return this; }
        public Builder name(String name) { this.name = name; return this; }
        public Builder description(String desc) { this.description = desc; return this; }
        public Builder severity(Severity sev) { this.severity = sev; return this; }
        public Builder category(Category cat) { this.category = cat; return this; }
        public Builder remediation(Remediation rem) { this.remediation = rem; return this; }
        public Builder config(Map<String, Object> cfg) { this.config = cfg; return this; }
        public Builder isEnabled(boolean enabled) { this.isEnabled = enabled; return this; }

        public RuleDefinition build() {
            return new RuleDefinition(id, name, description, severity, category,
                    remediation, config, isEnabled);
        }
    }
}
