package com.vidnyan.playscan.adapter.out.detector;

import com.vidnyan.playscan.domain.rule.RuleDefinition;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Plain {@code http://} URLs to anything but the local host.
 */
@Component
public class HttpWithoutTlsDetector extends TextPatternDetector {

    public static final String RULE_ID = "HTTP_WITHOUT_TLS";

    static final List<String> LOCAL_HOSTS = List.of("localhost", "127.0.0.1");

    @Override
    public String ruleId() {
        return RULE_ID;
    }

    @Override
    protected Optional<String> match(String text, RuleDefinition rule) {
        String url = text.trim();
        if (!url.toLowerCase(Locale.ROOT).startsWith("http://")) {
            return Optional.empty();
        }
        String host = url.substring("http://".length()).toLowerCase(Locale.ROOT);
        boolean local = rule.getTokens("localHosts", LOCAL_HOSTS).stream()
                .anyMatch(h -> host.equals(h) || host.startsWith(h + ":") || host.startsWith(h + "/"));
        return local ? Optional.empty() : Optional.of(url);
    }

    @Override
    protected String message(ScriptValues.NamedValue value, String match) {
        return "HTTP without TLS in " + value.describe() + ": " + match;
    }
}
