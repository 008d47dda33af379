package com.vidnyan.playscan.adapter.out.detector;

import com.vidnyan.playscan.domain.graph.PdgEdgeType;
import com.vidnyan.playscan.domain.graph.PdgNodeKind;
import com.vidnyan.playscan.domain.graph.ProgramDependenceGraph;
import com.vidnyan.playscan.domain.rule.EvaluationContext;
import com.vidnyan.playscan.domain.rule.EvaluationResult;
import com.vidnyan.playscan.domain.rule.Finding;
import com.vidnyan.playscan.domain.rule.RuleDefinition;
import com.vidnyan.playscan.domain.rule.SmellDetector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Sensitive argument or variable holding a plain-text string.
 *
 * Values are folded back through REACHES edges, so {@code password: "{{ db_pass }}"} is
 * flagged when {@code db_pass} is a literal somewhere in the analyzed files. Vault-encrypted
 * values and variables supplied from outside are safe.
 *
 * <p>{@code no_log} is ignored: it only hides the value from task output, the literal is still
 * in the file.</p>
 */
@Slf4j
@Component
public class HardcodedSecretDetector implements SmellDetector {

    public static final String RULE_ID = "HARDCODED_SECRET";

    static final List<String> PASSWORD_TOKENS = List.of("pass", "pwd", "auth.*token", "secret", "ssh.*key");
    static final List<String> PRIV_KEY_PREFIXES = List.of("pvt", "priv");
    static final List<String> PRIV_KEY_SUFFIXES = List.of("cert", "key", "rsa", "secret", "ssl");

    @Override
    public String ruleId() {
        return RULE_ID;
    }

    @Override
    public Set<PdgNodeKind> requiredNodeKinds() {
        return Set.of(PdgNodeKind.TASK, PdgNodeKind.HANDLER, PdgNodeKind.DEFINITION, PdgNodeKind.USE);
    }

    @Override
    public Set<PdgEdgeType> requiredEdgeTypes() {
        return Set.of(PdgEdgeType.REACHES);
    }

    @Override
    public EvaluationResult evaluate(EvaluationContext context) {
        Instant start = Instant.now();
        RuleDefinition rule = context.rule();
        ProgramDependenceGraph graph = context.graph();
        Pattern sensitive = sensitiveNamePattern(rule);

        List<Finding> findings = new ArrayList<>();
        List<ScriptValues.NamedValue> values = ScriptValues.collect(graph);
        for (ScriptValues.NamedValue value : values) {
            if (!sensitive.matcher(value.name()).matches()) {
                continue;
            }
            List<String> secrets = value.literalTexts().stream().filter(s -> !s.isEmpty()).toList();
            if (secrets.isEmpty()) {
                continue;
            }
            boolean folded = !value.evidence().isEmpty();
            String message = "Hardcoded secret in " + value.describe()
                    + (folded ? " (value defined at " + definitionLocations(graph, value.evidence()) + ")" : "");
            findings.add(Findings.at(rule, value.site(), message, value.evidence(),
                    Map.of("keyword", value.keyword(), "folded", folded)));
        }

        Duration duration = Duration.between(start, Instant.now());
        log.debug("Rule {} found {} findings in {}ms", rule.id(), findings.size(), duration.toMillis());
        return EvaluationResult.success(rule.id(), findings, duration, values.size());
    }

    private static Pattern sensitiveNamePattern(RuleDefinition rule) {
        List<String> prefixes = rule.getTokens("privateKeyPrefixes", PRIV_KEY_PREFIXES);
        List<String> suffixes = rule.getTokens("privateKeySuffixes", PRIV_KEY_SUFFIXES);
        String privateKey = "((" + String.join("|", prefixes) + ").+(" + String.join("|", suffixes) + "))";
        List<String> tokens = new ArrayList<>(rule.getTokens("passwordTokens", PASSWORD_TOKENS));
        tokens.add(privateKey);
        return Findings.anyOf(tokens);
    }

    private static String definitionLocations(ProgramDependenceGraph graph, List<String> definitionIds) {
        return String.join(", ", definitionIds.stream()
                .map(graph::node)
                .flatMap(Optional::stream)
                .map(n -> n.location().format())
                .toList());
    }
}
