package com.vidnyan.playscan.adapter.out.detector;

import com.vidnyan.playscan.domain.rule.RuleDefinition;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Broken hash functions and ciphers mentioned in values.
 */
@Component
public class WeakCryptoAlgorithmDetector extends TextPatternDetector {

    public static final String RULE_ID = "WEAK_CRYPTO_ALGORITHM";

    static final List<String> WEAK_ALGORITHMS = List.of("md5", "sha1", "crc32", "crc16", "arcfour");

    @Override
    public String ruleId() {
        return RULE_ID;
    }

    @Override
    protected Optional<String> match(String text, RuleDefinition rule) {
        String lower = text.toLowerCase(Locale.ROOT);
        return rule.getTokens("algorithms", WEAK_ALGORITHMS).stream()
                .filter(lower::contains)
                .findFirst();
    }

    @Override
    protected String message(ScriptValues.NamedValue value, String match) {
        return "Weak cryptographic algorithm " + match + " in " + value.describe();
    }
}
