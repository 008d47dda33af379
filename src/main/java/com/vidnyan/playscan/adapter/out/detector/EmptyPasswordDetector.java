package com.vidnyan.playscan.adapter.out.detector;

import com.vidnyan.playscan.domain.graph.PdgEdgeType;
import com.vidnyan.playscan.domain.graph.PdgNodeKind;
import com.vidnyan.playscan.domain.graph.ResolvedValue;
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
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Password-like argument or variable that may be empty, null or {@code omit}.
 */
@Slf4j
@Component
public class EmptyPasswordDetector implements SmellDetector {

    public static final String RULE_ID = "EMPTY_PASSWORD";

    static final List<String> PASSWORD_TOKENS = List.of("pass", "pwd");

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
        Pattern passwordName = Findings.anyOf(rule.getTokens("passwordTokens", PASSWORD_TOKENS));

        List<Finding> findings = new ArrayList<>();
        List<ScriptValues.NamedValue> values = ScriptValues.collect(context.graph());
        for (ScriptValues.NamedValue value : values) {
            if (passwordName.matcher(value.name()).matches()
                    && value.values().stream().anyMatch(EmptyPasswordDetector::isEmpty)) {
                findings.add(Findings.at(rule, value.site(), "Empty password in " + value.describe(),
                        value.evidence(), Map.of("keyword", value.keyword())));
            }
        }

        Duration duration = Duration.between(start, Instant.now());
        log.debug("Rule {} found {} findings in {}ms", rule.id(), findings.size(), duration.toMillis());
        return EvaluationResult.success(rule.id(), findings, duration, values.size());
    }

    private static boolean isEmpty(ResolvedValue value) {
        if (value.kind() == ResolvedValue.Kind.EXTERNAL) {
            return "omit".equals(value.value());
        }
        if (!value.isLiteral()) {
            return false;
        }
        return value.value() == null || "".equals(value.value()) || "omit".equals(value.value());
    }
}
