package com.vidnyan.playscan.adapter.out.detector;

import com.vidnyan.playscan.domain.graph.PdgEdge;
import com.vidnyan.playscan.domain.graph.PdgEdgeType;
import com.vidnyan.playscan.domain.graph.PdgNode;
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
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Security-relevant step that can only be reached through a branch whose guard is a false literal.
 *
 * <p>Two forward walks from the entry: one over all control-flow edges, one skipping infeasible
 * branches. Steps seen only by the first walk never run.</p>
 */
@Slf4j
@Component
public class UnreachableSecurityTaskDetector implements SmellDetector {

    public static final String RULE_ID = "UNREACHABLE_SECURITY_TASK";

    static final List<String> SECURITY_MODULES = List.of(
            "firewalld", "ufw", "iptables", "selinux", "seboolean", "sefcontext", "authorized_key",
            "user", "group", "openssl_certificate", "openssl_privatekey", "x509_certificate",
            "openssh_keypair", "acl", "file", "lineinfile", "pam_limits", "sysctl", "apt_key", "rpm_key");

    @Override
    public String ruleId() {
        return RULE_ID;
    }

    @Override
    public Set<PdgNodeKind> requiredNodeKinds() {
        return Set.of(PdgNodeKind.ENTRY, PdgNodeKind.TASK, PdgNodeKind.HANDLER, PdgNodeKind.BLOCK_ENTRY);
    }

    @Override
    public Set<PdgEdgeType> requiredEdgeTypes() {
        return Set.of(PdgEdgeType.SEQUENCE, PdgEdgeType.BRANCH, PdgEdgeType.BLOCK_FAILURE,
                PdgEdgeType.BLOCK_SUCCESS, PdgEdgeType.LOOP_ITERATE);
    }

    @Override
    public EvaluationResult evaluate(EvaluationContext context) {
        Instant start = Instant.now();
        RuleDefinition rule = context.rule();
        ProgramDependenceGraph graph = context.graph();
        List<String> securityModules = rule.getTokens("securityModules", SECURITY_MODULES);

        String entry = graph.entry().id();
        Set<String> structurallyReachable = graph.reachableFrom(entry, e -> e.type().isControlFlow());
        Set<String> feasible = graph.reachableFrom(entry, e -> e.type().isControlFlow() && !e.isInfeasible());

        List<Finding> findings = new ArrayList<>();
        int nodesAnalyzed = 0;
        for (PdgNode node : graph.executableNodes()) {
            String module = node.module().map(m -> m.toLowerCase(Locale.ROOT)).orElse(null);
            if (module == null || !securityModules.contains(module)) {
                continue;
            }
            nodesAnalyzed++;
            if (structurallyReachable.contains(node.id()) && !feasible.contains(node.id())) {
                findings.add(Findings.at(rule, node,
                        "Security task '" + node.label() + "' (" + module + ") never runs, "
                                + "it is guarded by a condition that is always false",
                        blockingBranches(graph, node, feasible), Map.of("module", module)));
            }
        }

        Duration duration = Duration.between(start, Instant.now());
        log.debug("Rule {} found {} findings in {}ms", rule.id(), findings.size(), duration.toMillis());
        return EvaluationResult.success(rule.id(), findings, duration, nodesAnalyzed);
    }

    /**
     * Guarded nodes whose false condition cuts the step off: targets of infeasible branches
     * leaving the feasible region from which the step is reachable.
     */
    private static List<String> blockingBranches(ProgramDependenceGraph graph, PdgNode node, Set<String> feasible) {
        return graph.edgesOfType(PdgEdgeType.BRANCH).stream()
                .filter(PdgEdge::isInfeasible)
                .filter(e -> feasible.contains(e.sourceId()))
                .map(PdgEdge::targetId)
                .distinct()
                .filter(target -> graph.reachableFrom(target, e -> e.type().isControlFlow()).contains(node.id()))
                .toList();
    }
}
