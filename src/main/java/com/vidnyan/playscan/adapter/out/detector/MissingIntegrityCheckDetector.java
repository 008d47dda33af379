package com.vidnyan.playscan.adapter.out.detector;

import com.vidnyan.playscan.domain.graph.PdgEdgeType;
import com.vidnyan.playscan.domain.graph.PdgNode;
import com.vidnyan.playscan.domain.graph.PdgNodeKind;
import com.vidnyan.playscan.domain.graph.ProgramDependenceGraph;
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
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Downloads without integrity verification, and integrity checks switched off.
 *
 * <p>An absence check on the argument bag: a step downloading a package or archive must carry a
 * checksum argument or certificate validation. Flags such as {@code disable_gpg_check: yes}
 * are reported on any step.</p>
 */
@Slf4j
@Component
public class MissingIntegrityCheckDetector implements SmellDetector {

    public static final String RULE_ID = "MISSING_INTEGRITY_CHECK";

    static final List<String> SOURCE_EXTENSIONS = List.of(
            "dmg", "rpm", "tgz", "zip", "tar", "tbz", "iso", "rar", "gzip", "deb",
            "sh", "run", "bin", "gz", "bzip2", "bz", "xz");
    static final List<String> DOWNLOAD_PREFIXES = List.of("http:", "https:", "ftp:", "www.");
    static final List<String> DOWNLOAD_MODULES = List.of("get_url", "win_get_url", "download_file");
    static final List<String> CHECKSUM_TOKENS = List.of("checksum", "cksum");
    static final List<String> CHECK_FLAGS = List.of("gpg_check", "gpgcheck", "check_sha", "checksha");
    static final List<String> DISABLE_CHECK_FLAGS = List.of("disable_gpg_check", "disablegpgcheck", "disable_gpgcheck");

    @Override
    public String ruleId() {
        return RULE_ID;
    }

    @Override
    public Set<PdgNodeKind> requiredNodeKinds() {
        return Set.of(PdgNodeKind.TASK, PdgNodeKind.HANDLER);
    }

    @Override
    public EvaluationResult evaluate(EvaluationContext context) {
        Instant start = Instant.now();
        RuleDefinition rule = context.rule();
        ProgramDependenceGraph graph = context.graph();
        Settings settings = Settings.from(rule);

        List<Finding> findings = new ArrayList<>();
        int nodesAnalyzed = 0;
        for (PdgNode node : graph.executableNodes()) {
            if (node.unanalyzable() || node.module().isEmpty()) {
                continue;
            }
            nodesAnalyzed++;
            List<ScriptValues.NamedValue> arguments = ScriptValues.arguments(graph, node);

            Optional<String> download = downloadSource(node, arguments, settings);
            if (download.isPresent() && !isVerified(arguments, settings)) {
                findings.add(Findings.at(rule, node,
                        "Download of '" + download.get() + "' without checksum or certificate validation",
                        List.of(), Map.of("module", node.module().get(), "source", download.get())));
            }
            disabledCheck(arguments, settings).ifPresent(flag -> findings.add(Findings.at(rule, node,
                    "Integrity check disabled by argument '" + flag.name() + "'",
                    flag.evidence(), Map.of("module", node.module().get(), "keyword", flag.keyword()))));
        }

        Duration duration = Duration.between(start, Instant.now());
        log.debug("Rule {} found {} findings in {}ms", rule.id(), findings.size(), duration.toMillis());
        return EvaluationResult.success(rule.id(), findings, duration, nodesAnalyzed);
    }

    private static Optional<String> downloadSource(PdgNode node, List<ScriptValues.NamedValue> arguments,
                                                   Settings settings) {
        for (ScriptValues.NamedValue argument : arguments) {
            for (String text : argument.candidateTexts()) {
                if (isPackageUrl(text, settings)) {
                    return Optional.of(text);
                }
            }
        }
        if (settings.downloadModules().contains(node.module().get().toLowerCase(Locale.ROOT))) {
            return Optional.of(arguments.stream()
                    .filter(a -> a.name().equals("url") || a.name().equals("src"))
                    .flatMap(a -> a.candidateTexts().stream())
                    .findFirst()
                    .orElse(node.module().get()));
        }
        return Optional.empty();
    }

    private static boolean isPackageUrl(String text, Settings settings) {
        String url = text.trim().toLowerCase(Locale.ROOT);
        if (settings.downloadPrefixes().stream().noneMatch(url::startsWith)) {
            return false;
        }
        int query = url.indexOf('?');
        if (query >= 0) {
            url = url.substring(0, query);
        }
        String path = url;
        return settings.sourceExtensions().stream().anyMatch(ext -> path.endsWith("." + ext));
    }

    private static boolean isVerified(List<ScriptValues.NamedValue> arguments, Settings settings) {
        for (ScriptValues.NamedValue argument : arguments) {
            if (Findings.containsAny(argument.name(), settings.checksumTokens())) {
                return true;
            }
            if (argument.name().equals("validate_certs") && !isLiteralFlag(argument, false)) {
                return true;
            }
        }
        return false;
    }

    private static Optional<ScriptValues.NamedValue> disabledCheck(List<ScriptValues.NamedValue> arguments,
                                                                   Settings settings) {
        for (ScriptValues.NamedValue argument : arguments) {
            if (Findings.containsAny(argument.name(), settings.disableFlags())) {
                if (isLiteralFlag(argument, true)) {
                    return Optional.of(argument);
                }
            } else if (Findings.containsAny(argument.name(), settings.checkFlags()) && isLiteralFlag(argument, false)) {
                return Optional.of(argument);
            }
        }
        return Optional.empty();
    }

    /**
     * True when some possible value of the argument is a boolean literal equal to the expected one.
     */
    private static boolean isLiteralFlag(ScriptValues.NamedValue argument, boolean expected) {
        for (ResolvedValue value : argument.values()) {
            if (!value.isLiteral() || value.value() == null) {
                continue;
            }
            Boolean flag = value.value() instanceof Boolean b ? b : parseBoolean(value.text());
            if (flag != null && flag == expected) {
                return true;
            }
        }
        return false;
    }

    private static Boolean parseBoolean(String text) {
        return switch (text.trim().toLowerCase(Locale.ROOT)) {
            case "yes", "true", "on", "1" -> Boolean.TRUE;
            case "no", "false", "off", "0" -> Boolean.FALSE;
            default -> null;
        };
    }

    private record Settings(
        List<String> sourceExtensions,
        List<String> downloadPrefixes,
        List<String> downloadModules,
        List<String> checksumTokens,
        List<String> checkFlags,
        List<String> disableFlags
    ) {

        static Settings from(RuleDefinition rule) {
            return new Settings(
                    rule.getTokens("sourceExtensions", SOURCE_EXTENSIONS),
                    rule.getTokens("downloadPrefixes", DOWNLOAD_PREFIXES),
                    rule.getTokens("downloadModules", DOWNLOAD_MODULES),
                    rule.getTokens("checksumTokens", CHECKSUM_TOKENS),
                    rule.getTokens("checkIntegrityFlags", CHECK_FLAGS),
                    rule.getTokens("disableCheckIntegrityFlags", DISABLE_CHECK_FLAGS));
        }
    }
}
