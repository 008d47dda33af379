package com.vidnyan.playscan.adapter.out.detector;

import com.vidnyan.playscan.domain.graph.PdgNode;
import com.vidnyan.playscan.domain.rule.Finding;
import com.vidnyan.playscan.domain.rule.RuleDefinition;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Shared helpers for building findings and matching names against token lists.
 */
final class Findings {

    private Findings() {
    }

    static Finding at(RuleDefinition rule, PdgNode node, String message, List<String> evidence,
                      Map<String, Object> context) {
        return Finding.builder()
                .ruleId(rule.id())
                .ruleName(rule.name())
                .severity(rule.severity())
                .message(message)
                .location(node.location())
                .pdgNodeId(node.id())
                .astNodeId(node.astNodeId())
                .evidence(evidence)
                .context(context)
                .build();
    }

    /**
     * Regex alternation of tokens; tokens are themselves regex fragments.
     */
    static Pattern anyOf(List<String> tokens) {
        String alternation = tokens.stream().collect(Collectors.joining("|", "(", ")"));
        return Pattern.compile(".*" + alternation + ".*", Pattern.CASE_INSENSITIVE);
    }

    static boolean containsAny(String text, List<String> tokens) {
        return tokens.stream().anyMatch(text::contains);
    }
}
