package com.vidnyan.playscan.domain.template;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Root variable names referenced by a template string.
 *
 * @param variables referenced root names, in order of first appearance
 * @param dynamic   whether the template builds variable names at runtime
 * @param error     parse error of a malformed template, null when well-formed
 */
public record TemplateReferences(
    Set<String> variables,
    boolean dynamic,
    String error
) {

    public TemplateReferences {
        variables = Collections.unmodifiableSet(new LinkedHashSet<>(variables));
    }

    public static TemplateReferences none() {
        return new TemplateReferences(Set.of(), false, null);
    }

    public static TemplateReferences malformed(String error) {
        return new TemplateReferences(Set.of(), false, error);
    }

    public boolean isMalformed() {
        return error != null;
    }

    public Optional<String> parseError() {
        return Optional.ofNullable(error);
    }

    public boolean isEmpty() {
        return variables.isEmpty();
    }
}
