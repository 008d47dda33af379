package com.vidnyan.playscan.adapter.out.detector;

import com.vidnyan.playscan.domain.rule.RuleDefinition;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Services bound to every interface.
 */
@Component
public class UnrestrictedIpAddressDetector extends TextPatternDetector {

    public static final String RULE_ID = "UNRESTRICTED_IP_ADDRESS";

    static final List<String> UNRESTRICTED_ADDRESSES = List.of("0.0.0.0");

    @Override
    public String ruleId() {
        return RULE_ID;
    }

    @Override
    protected Optional<String> match(String text, RuleDefinition rule) {
        return rule.getTokens("addresses", UNRESTRICTED_ADDRESSES).stream()
                .filter(text::contains)
                .findFirst();
    }

    @Override
    protected String message(ScriptValues.NamedValue value, String match) {
        return "Unrestricted IP address " + match + " in " + value.describe();
    }
}
