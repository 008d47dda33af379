package com.vidnyan.playscan.adapter.out.detector;

import com.vidnyan.playscan.domain.graph.PdgEdgeType;
import com.vidnyan.playscan.domain.graph.PdgNodeKind;
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
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * User or role argument that defaults to an administrative account.
 */
@Slf4j
@Component
public class AdminByDefaultDetector implements SmellDetector {

    public static final String RULE_ID = "ADMIN_BY_DEFAULT";

    static final List<String> USER_ROLE_TOKENS = List.of("user", "role", "uname", "login", "root", "admin");
    static final List<String> ADMIN_NAMES = List.of("admin", "root");

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
        List<String> nameTokens = rule.getTokens("userRoleTokens", USER_ROLE_TOKENS);
        List<String> adminNames = rule.getTokens("adminNames", ADMIN_NAMES);

        List<Finding> findings = new ArrayList<>();
        List<ScriptValues.NamedValue> values = ScriptValues.collect(context.graph());
        for (ScriptValues.NamedValue value : values) {
            if (!Findings.containsAny(value.name(), nameTokens)) {
                continue;
            }
            value.literalTexts().stream()
                    .map(s -> s.trim().toLowerCase(Locale.ROOT))
                    .filter(adminNames::contains)
                    .findFirst()
                    .ifPresent(admin -> findings.add(Findings.at(rule, value.site(),
                            "Administrative account '" + admin + "' used by default in " + value.describe(),
                            value.evidence(), Map.of("keyword", value.keyword(), "account", admin))));
        }

        Duration duration = Duration.between(start, Instant.now());
        log.debug("Rule {} found {} findings in {}ms", rule.id(), findings.size(), duration.toMillis());
        return EvaluationResult.success(rule.id(), findings, duration, values.size());
    }
}
