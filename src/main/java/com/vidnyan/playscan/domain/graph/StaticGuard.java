package com.vidnyan.playscan.domain.graph;

import com.vidnyan.playscan.domain.raw.RawNode;
import com.vidnyan.playscan.domain.raw.RawScalar;
import com.vidnyan.playscan.domain.raw.RawSequence;

import java.util.Set;

/**
 * Value of a guard condition when it is a literal, UNKNOWN otherwise.
 */
public enum StaticGuard {
    ALWAYS_TRUE,
    ALWAYS_FALSE,
    UNKNOWN;

    private static final Set<String> FALSE_LITERALS = Set.of("false", "False", "FALSE", "no", "0", "none", "None");
    private static final Set<String> TRUE_LITERALS = Set.of("true", "True", "TRUE", "yes", "1");

    /**
     * Evaluate a {@code when} value. A list of conditions is a conjunction.
     */
    public static StaticGuard evaluate(RawNode condition) {
        if (condition instanceof RawSequence sequence) {
            boolean allTrue = true;
            for (RawNode item : sequence.items()) {
                StaticGuard value = evaluate(item);
                if (value == ALWAYS_FALSE) {
                    return ALWAYS_FALSE;
                }
                allTrue &= value == ALWAYS_TRUE;
            }
            return allTrue ? ALWAYS_TRUE : UNKNOWN;
        }
        if (!(condition instanceof RawScalar scalar) || scalar.vaultEncrypted()) {
            return UNKNOWN;
        }
        Object value = scalar.value();
        if (value instanceof Boolean b) {
            return b ? ALWAYS_TRUE : ALWAYS_FALSE;
        }
        if (value instanceof Number n) {
            return n.doubleValue() == 0 ? ALWAYS_FALSE : ALWAYS_TRUE;
        }
        if (value == null) {
            return UNKNOWN;
        }
        String text = unwrap(scalar.asText().trim());
        if (FALSE_LITERALS.contains(text)) {
            return ALWAYS_FALSE;
        }
        if (TRUE_LITERALS.contains(text)) {
            return ALWAYS_TRUE;
        }
        return UNKNOWN;
    }

    private static String unwrap(String text) {
        if (text.startsWith("{{") && text.endsWith("}}")) {
            return text.substring(2, text.length() - 2).trim();
        }
        return text;
    }
}
