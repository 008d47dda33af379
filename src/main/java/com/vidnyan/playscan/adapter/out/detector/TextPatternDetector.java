package com.vidnyan.playscan.adapter.out.detector;

import com.vidnyan.playscan.domain.graph.PdgEdgeType;
import com.vidnyan.playscan.domain.graph.PdgNodeKind;
import com.vidnyan.playscan.domain.rule.EvaluationContext;
import com.vidnyan.playscan.domain.rule.EvaluationResult;
import com.vidnyan.playscan.domain.rule.Finding;
import com.vidnyan.playscan.domain.rule.RuleDefinition;
import com.vidnyan.playscan.domain.rule.SmellDetector;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Detectors matching the text of argument and variable values, whatever their name.
 * One finding per node and attribute path.
 */
@Slf4j
abstract class TextPatternDetector implements SmellDetector {

    @Override
    public Set<PdgNodeKind> requiredNodeKinds() {
        return Set.of(PdgNodeKind.TASK, PdgNodeKind.HANDLER, PdgNodeKind.DEFINITION, PdgNodeKind.USE);
    }

    @Override
    public Set<PdgEdgeType> requiredEdgeTypes() {
        return Set.of(PdgEdgeType.REACHES);
    }

    /**
     * The offending part of the text, if any.
     */
    protected abstract Optional<String> match(String text, RuleDefinition rule);

    protected abstract String message(ScriptValues.NamedValue value, String match);

    @Override
    public EvaluationResult evaluate(EvaluationContext context) {
        Instant start = Instant.now();
        RuleDefinition rule = context.rule();

        List<Finding> findings = new ArrayList<>();
        Set<String> reported = new HashSet<>();
        List<ScriptValues.NamedValue> values = ScriptValues.collect(context.graph());
        for (ScriptValues.NamedValue value : values) {
            for (String text : value.candidateTexts()) {
                Optional<String> match = match(text, rule);
                if (match.isPresent() && reported.add(value.site().id() + "|" + value.keyword())) {
                    findings.add(Findings.at(rule, value.site(), message(value, match.get()), value.evidence(),
                            Map.of("keyword", value.keyword(), "match", match.get())));
                    break;
                }
            }
        }

        Duration duration = Duration.between(start, Instant.now());
        log.debug("Rule {} found {} findings in {}ms", rule.id(), findings.size(), duration.toMillis());
        return EvaluationResult.success(rule.id(), findings, duration, values.size());
    }
}
