package com.vidnyan.playscan.domain.ast;

import com.vidnyan.playscan.domain.model.Location;
import com.vidnyan.playscan.domain.raw.RawNode;
import com.vidnyan.playscan.domain.raw.RawScalar;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for the free-form {@code module: key=value other words} argument syntax.
 * {@code key=value} pairs become named arguments, the remaining words become {@code _raw_params}.
 */
public final class FreeFormArguments {

    public static final String RAW_PARAMS = "_raw_params";

    private static final Pattern KEY_VALUE = Pattern.compile("^([A-Za-z_][A-Za-z0-9_]*)=(.*)$", Pattern.DOTALL);

    private FreeFormArguments() {
    }

    /**
     * Parse a free-form argument string.
     *
     * @throws IllegalArgumentException on unterminated quotes or template delimiters
     */
    public static Map<String, RawNode> parse(String text, Location location) {
        Map<String, RawNode> args = new LinkedHashMap<>();
        List<String> rawWords = new ArrayList<>();

        for (String token : tokenize(text)) {
            Matcher m = KEY_VALUE.matcher(token);
            if (m.matches()) {
                args.put(m.group(1), RawScalar.of(unquote(m.group(2)), location));
            } else {
                rawWords.add(token);
            }
        }
        if (!rawWords.isEmpty()) {
            args.put(RAW_PARAMS, RawScalar.of(String.join(" ", rawWords), location));
        }
        return args;
    }

    static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        char quote = 0;
        int templateDepth = 0;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            char next = i + 1 < text.length() ? text.charAt(i + 1) : 0;

            if (quote != 0) {
                if (c == '\\' && next != 0) {
                    current.append(c).append(next);
                    i++;
                    continue;
                }
                if (c == quote) {
                    quote = 0;
                }
                current.append(c);
                continue;
            }
            if (c == '{' && (next == '{' || next == '%')) {
                templateDepth++;
                current.append(c).append(next);
                i++;
                continue;
            }
            if ((c == '}' || c == '%') && next == '}' && templateDepth > 0) {
                templateDepth--;
                current.append(c).append(next);
                i++;
                continue;
            }
            if (templateDepth == 0 && (c == '"' || c == '\'')) {
                quote = c;
                current.append(c);
                continue;
            }
            if (templateDepth == 0 && Character.isWhitespace(c)) {
                if (current.length() > 0) {
                    tokens.add(current.toString());
                    current.setLength(0);
                }
                continue;
            }
            current.append(c);
        }

        if (quote != 0) {
            throw new IllegalArgumentException("unterminated quote in arguments: " + text);
        }
        if (templateDepth != 0) {
            throw new IllegalArgumentException("unterminated template in arguments: " + text);
        }
        if (current.length() > 0) {
            tokens.add(current.toString());
        }
        return tokens;
    }

    private static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            if ((first == '"' || first == '\'') && value.charAt(value.length() - 1) == first) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }
}
