package com.vidnyan.playscan.adapter.out.detector;

import com.vidnyan.playscan.domain.graph.PdgNode;
import com.vidnyan.playscan.domain.graph.PdgNodeKind;
import com.vidnyan.playscan.domain.graph.ProgramDependenceGraph;
import com.vidnyan.playscan.domain.graph.ResolvedValue;
import com.vidnyan.playscan.domain.raw.RawMapping;
import com.vidnyan.playscan.domain.raw.RawNode;
import com.vidnyan.playscan.domain.raw.RawScalar;
import com.vidnyan.playscan.domain.raw.RawSequence;
import com.vidnyan.playscan.domain.template.TemplateReferenceExtractor;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Named scalar values of a graph: module arguments of analyzable steps and values of
 * variable definitions, each with its possible values after constant folding.
 */
final class ScriptValues {

    /**
     * Definitions made by the runtime; their values are not written by the script author.
     */
    private static final Set<String> COMPUTED_DEFINITIONS = Set.of("register", "loop", "index");

    private ScriptValues() {
    }

    /**
     * @param site    step or definition node holding the value
     * @param name    innermost key, lower-cased
     * @param keyword attribute path, as used by the site's USE nodes
     */
    record NamedValue(PdgNode site, String name, String keyword, RawNode raw, List<ResolvedValue> values) {

        boolean isDefinition() {
            return site.kind() == PdgNodeKind.DEFINITION;
        }

        /**
         * Literal strings this value may take.
         */
        List<String> literalTexts() {
            return values.stream()
                    .filter(ResolvedValue::isLiteral)
                    .filter(v -> v.value() instanceof String)
                    .map(ResolvedValue::text)
                    .toList();
        }

        /**
         * Literal strings plus the source text of a template, whose static parts can carry a smell too.
         */
        List<String> candidateTexts() {
            List<String> texts = new ArrayList<>(literalTexts());
            if (raw instanceof RawScalar scalar && scalar.isString() && !scalar.vaultEncrypted()
                    && TemplateReferenceExtractor.isTemplated(scalar.asText())) {
                texts.add(scalar.asText());
            }
            return texts;
        }

        /**
         * Definition nodes the folded values came from.
         */
        List<String> evidence() {
            return values.stream()
                    .map(ResolvedValue::sourceNodeId)
                    .filter(Objects::nonNull)
                    .distinct()
                    .toList();
        }

        String describe() {
            if (isDefinition()) {
                return "variable '" + site.variableName() + "'";
            }
            return "argument '" + keyword.substring(keyword.indexOf('.') + 1) + "'";
        }
    }

    static List<NamedValue> collect(ProgramDependenceGraph graph) {
        List<NamedValue> values = new ArrayList<>();
        for (PdgNode node : graph.executableNodes()) {
            if (node.unanalyzable()) {
                continue;
            }
            node.arguments().forEach((key, raw) -> flatten(graph, node, key, "args." + key, raw, values));
        }
        for (PdgNode definition : graph.nodesOfKind(PdgNodeKind.DEFINITION)) {
            if (definition.synthetic() || COMPUTED_DEFINITIONS.contains(definition.keyword())
                    || definition.variableName() == null) {
                continue;
            }
            flatten(graph, definition, definition.variableName(), "value", definition.value(), values);
        }
        return values;
    }

    /**
     * Step arguments, without folding, keyed by lower-cased name. Nested mappings are flattened.
     */
    static List<NamedValue> arguments(ProgramDependenceGraph graph, PdgNode node) {
        List<NamedValue> values = new ArrayList<>();
        node.arguments().forEach((key, raw) -> flatten(graph, node, key, "args." + key, raw, values));
        return values;
    }

    private static void flatten(ProgramDependenceGraph graph, PdgNode site, String name, String keyword,
                                RawNode raw, List<NamedValue> out) {
        if (raw instanceof RawMapping mapping) {
            mapping.entries().forEach((key, value) -> flatten(graph, site, key, keyword + "." + key, value, out));
        } else if (raw instanceof RawSequence sequence) {
            sequence.items().forEach(item -> flatten(graph, site, name, keyword, item, out));
        } else {
            out.add(new NamedValue(site, name.toLowerCase(Locale.ROOT), keyword, raw,
                    graph.resolveValue(site.id(), keyword, raw)));
        }
    }
}
