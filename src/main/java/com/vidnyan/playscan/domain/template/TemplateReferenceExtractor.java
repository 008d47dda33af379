package com.vidnyan.playscan.domain.template;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Extracts the root variable names referenced by template strings.
 *
 * A tokenizer restricted to the template delimiter syntax: nothing is evaluated.
 * For {@code {{ foo.bar | default(baz) }}} the references are {@code foo} and {@code baz};
 * attribute names, filter and test names, keyword argument names and quoted text are not
 * references. Malformed templates yield no references and carry a parse error.
 * Stateless and thread-safe.
 */
@Slf4j
public class TemplateReferenceExtractor {

    /**
     * Names provided by the templating environment rather than by variables.
     */
    public static final Set<String> GLOBALS = Set.of(
            "lookup", "query", "q", "now", "omit", "range", "dict", "lipsum",
            "cycler", "joiner", "namespace", "undef", "finalize");

    private static final Set<String> KEYWORDS = Set.of(
            "and", "or", "not", "in", "is", "if", "else", "elif",
            "true", "false", "none", "True", "False", "None",
            "recursive", "as", "with", "without", "context", "ignore", "missing");

    private static final String OPERATOR_CHARS = "+-*/%~|.,:=!<>()[]{}";

    /**
     * Whether the text contains template delimiters at all.
     */
    public static boolean isTemplated(String text) {
        return text != null && (text.contains("{{") || text.contains("{%") || text.contains("{#"));
    }

    /**
     * References of a templated string such as a module argument.
     */
    public TemplateReferences extract(String text) {
        if (!isTemplated(text)) {
            return TemplateReferences.none();
        }
        try {
            Collector collector = new Collector();
            scanTemplate(text, collector);
            return collector.result();
        } catch (MalformedTemplateException e) {
            log.debug("Malformed template {}: {}", text, e.getMessage());
            return TemplateReferences.malformed(e.getMessage());
        }
    }

    /**
     * References of a bare expression such as a {@code when} condition.
     * Expressions wrapped in template delimiters are handled as templates.
     */
    public TemplateReferences extractExpression(String expression) {
        if (expression == null || expression.isBlank()) {
            return TemplateReferences.none();
        }
        if (isTemplated(expression)) {
            return extract(expression);
        }
        try {
            Collector collector = new Collector();
            collectExpression(tokenize(expression), collector);
            return collector.result();
        } catch (MalformedTemplateException e) {
            log.debug("Malformed expression {}: {}", expression, e.getMessage());
            return TemplateReferences.malformed(e.getMessage());
        }
    }

    private void scanTemplate(String text, Collector collector) {
        int i = 0;
        boolean inRaw = false;
        while (i < text.length()) {
            int open = text.indexOf('{', i);
            if (open < 0 || open + 1 >= text.length()) {
                break;
            }
            char kind = text.charAt(open + 1);
            if (kind == '{' && !inRaw) {
                int end = findExpressionEnd(text, open + 2);
                collectExpression(tokenize(trimWhitespaceControl(text.substring(open + 2, end))), collector);
                i = end + 2;
            } else if (kind == '%') {
                int end = findDelimiter(text, open + 2, "%}");
                String statement = trimWhitespaceControl(text.substring(open + 2, end)).trim();
                if (statement.startsWith("endraw")) {
                    inRaw = false;
                } else if (!inRaw) {
                    inRaw = statement.equals("raw");
                    if (!inRaw) {
                        collectStatement(statement, collector);
                    }
                }
                i = end + 2;
            } else if (kind == '#' && !inRaw) {
                i = findDelimiter(text, open + 2, "#}") + 2;
            } else {
                i = open + 1;
            }
        }
        if (inRaw) {
            throw new MalformedTemplateException("unterminated raw block");
        }
    }

    private int findExpressionEnd(String text, int from) {
        int depth = 0;
        char quote = 0;
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                if (depth > 0) {
                    depth--;
                } else if (i + 1 < text.length() && text.charAt(i + 1) == '}') {
                    return i;
                } else {
                    throw new MalformedTemplateException("unexpected '}' at offset " + i);
                }
            }
        }
        throw new MalformedTemplateException("unterminated expression, missing '}}'");
    }

    private int findDelimiter(String text, int from, String delimiter) {
        char quote = 0;
        for (int i = from; i < text.length() - 1; i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '"' || c == '\'') {
                quote = c;
            } else if (text.startsWith(delimiter, i)) {
                return i;
            }
        }
        throw new MalformedTemplateException("unterminated block, missing '" + delimiter + "'");
    }

    private static String trimWhitespaceControl(String inner) {
        String s = inner;
        if (!s.isEmpty() && (s.charAt(0) == '-' || s.charAt(0) == '+')) {
            s = s.substring(1);
        }
        if (!s.isEmpty() && (s.charAt(s.length() - 1) == '-' || s.charAt(s.length() - 1) == '+')) {
            s = s.substring(0, s.length() - 1);
        }
        return s;
    }

    private void collectStatement(String statement, Collector collector) {
        List<Token> tokens = tokenize(statement);
        if (tokens.isEmpty()) {
            return;
        }
        Token head = tokens.get(0);
        if (head.type != TokenType.NAME) {
            throw new MalformedTemplateException("unexpected statement '" + statement + "'");
        }
        List<Token> rest = tokens.subList(1, tokens.size());
        switch (head.text) {
            case "for" -> {
                int in = indexOfName(rest, "in");
                if (in < 0) {
                    throw new MalformedTemplateException("for statement without 'in'");
                }
                rest.subList(0, in).stream()
                        .filter(t -> t.type == TokenType.NAME)
                        .forEach(t -> collector.bound.add(t.text));
                collector.bound.add("loop");
                collectExpression(rest.subList(in + 1, rest.size()), collector);
            }
            case "set" -> {
                if (rest.isEmpty() || rest.get(0).type != TokenType.NAME) {
                    throw new MalformedTemplateException("set statement without target");
                }
                int eq = indexOfOperator(rest, "=");
                for (Token t : eq < 0 ? rest : rest.subList(0, eq)) {
                    if (t.type == TokenType.NAME) {
                        collector.bound.add(t.text);
                    }
                }
                if (eq >= 0) {
                    collectExpression(rest.subList(eq + 1, rest.size()), collector);
                }
            }
            case "macro" -> {
                // Macro parameters are local names.
                rest.stream().filter(t -> t.type == TokenType.NAME).forEach(t -> collector.bound.add(t.text));
            }
            case "if", "elif", "include", "import", "from", "do", "with" -> collectExpression(rest, collector);
            case "filter", "call" -> {
                // Filter sections and macro calls name functions, not variables.
            }
            default -> {
                if (!head.text.startsWith("end") && !head.text.equals("else")
                        && !head.text.equals("block") && !head.text.equals("extends")) {
                    collectExpression(rest, collector);
                }
            }
        }
    }

    private void collectExpression(List<Token> tokens, Collector collector) {
        checkBalanced(tokens);
        int parenDepth = 0;
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.type == TokenType.OPERATOR) {
                if (token.text.equals("(")) parenDepth++;
                if (token.text.equals(")")) parenDepth--;
                continue;
            }
            if (token.type != TokenType.NAME) {
                continue;
            }
            Token prev = i > 0 ? tokens.get(i - 1) : null;
            Token next = i + 1 < tokens.size() ? tokens.get(i + 1) : null;

            if (prev != null && prev.isOperator(".")) continue;                  // attribute access
            if (prev != null && prev.isOperator("|")) continue;                  // filter name
            if (isTestName(tokens, i)) continue;                                  // `is defined`
            if (parenDepth > 0 && next != null && next.isOperator("=")) continue; // keyword argument
            if (KEYWORDS.contains(token.text)) continue;

            if (isDynamicLookup(tokens, i)) {
                collector.dynamic = true;
            }
            if (GLOBALS.contains(token.text) || collector.bound.contains(token.text)) {
                continue;
            }
            collector.variables.add(token.text);
        }
    }

    private static boolean isTestName(List<Token> tokens, int index) {
        if (index >= 1 && tokens.get(index - 1).isName("is")) {
            return true;
        }
        return index >= 2 && tokens.get(index - 1).isName("not") && tokens.get(index - 2).isName("is");
    }

    private static boolean isDynamicLookup(List<Token> tokens, int index) {
        Token token = tokens.get(index);
        Token next = index + 1 < tokens.size() ? tokens.get(index + 1) : null;
        if (token.text.equals("vars") && next != null && next.isOperator("[")) {
            return true;
        }
        if ((token.text.equals("lookup") || token.text.equals("query") || token.text.equals("q"))
                && next != null && next.isOperator("(") && index + 2 < tokens.size()) {
            Token arg = tokens.get(index + 2);
            return arg.type == TokenType.STRING && (arg.text.equals("vars") || arg.text.equals("ansible.builtin.vars"));
        }
        return false;
    }

    private static void checkBalanced(List<Token> tokens) {
        Deque<Character> open = new ArrayDeque<>();
        for (Token t : tokens) {
            if (t.type != TokenType.OPERATOR || t.text.length() != 1) {
                continue;
            }
            char c = t.text.charAt(0);
            switch (c) {
                case '(', '[', '{' -> open.push(c);
                case ')', ']', '}' -> {
                    char expected = c == ')' ? '(' : c == ']' ? '[' : '{';
                    if (open.isEmpty() || open.pop() != expected) {
                        throw new MalformedTemplateException("unbalanced '" + c + "'");
                    }
                }
                default -> {
                }
            }
        }
        if (!open.isEmpty()) {
            throw new MalformedTemplateException("unclosed '" + open.peek() + "'");
        }
    }

    private static int indexOfName(List<Token> tokens, String name) {
        for (int i = 0; i < tokens.size(); i++) {
            if (tokens.get(i).isName(name)) return i;
        }
        return -1;
    }

    private static int indexOfOperator(List<Token> tokens, String op) {
        for (int i = 0; i < tokens.size(); i++) {
            if (tokens.get(i).isOperator(op)) return i;
        }
        return -1;
    }

    static List<Token> tokenize(String expression) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        int n = expression.length();
        while (i < n) {
            char c = expression.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < n && (Character.isLetterOrDigit(expression.charAt(i)) || expression.charAt(i) == '_')) i++;
                tokens.add(new Token(TokenType.NAME, expression.substring(start, i)));
            } else if (Character.isDigit(c)) {
                int start = i;
                while (i < n && (Character.isLetterOrDigit(expression.charAt(i)) || expression.charAt(i) == '_'
                        || (expression.charAt(i) == '.' && i + 1 < n && Character.isDigit(expression.charAt(i + 1))))) {
                    i++;
                }
                tokens.add(new Token(TokenType.NUMBER, expression.substring(start, i)));
            } else if (c == '"' || c == '\'') {
                StringBuilder literal = new StringBuilder();
                i++;
                boolean closed = false;
                while (i < n) {
                    char s = expression.charAt(i);
                    if (s == '\\' && i + 1 < n) {
                        literal.append(expression.charAt(i + 1));
                        i += 2;
                        continue;
                    }
                    if (s == c) {
                        closed = true;
                        i++;
                        break;
                    }
                    literal.append(s);
                    i++;
                }
                if (!closed) {
                    throw new MalformedTemplateException("unterminated string literal");
                }
                tokens.add(new Token(TokenType.STRING, literal.toString()));
            } else if (OPERATOR_CHARS.indexOf(c) >= 0) {
                String two = i + 1 < n ? expression.substring(i, i + 2) : "";
                if (two.equals("==") || two.equals("!=") || two.equals("<=") || two.equals(">=")
                        || two.equals("//") || two.equals("**")) {
                    tokens.add(new Token(TokenType.OPERATOR, two));
                    i += 2;
                } else {
                    tokens.add(new Token(TokenType.OPERATOR, String.valueOf(c)));
                    i++;
                }
            } else {
                throw new MalformedTemplateException("unexpected character '" + c + "'");
            }
        }
        return tokens;
    }

    enum TokenType { NAME, STRING, NUMBER, OPERATOR }

    record Token(TokenType type, String text) {
        boolean isOperator(String op) {
            return type == TokenType.OPERATOR && text.equals(op);
        }

        boolean isName(String name) {
            return type == TokenType.NAME && text.equals(name);
        }
    }

    private static final class Collector {
        private final Set<String> variables = new LinkedHashSet<>();
        private final Set<String> bound = new HashSet<>();
        private boolean dynamic;

        TemplateReferences result() {
            return new TemplateReferences(variables, dynamic, null);
        }
    }

    private static final class MalformedTemplateException extends RuntimeException {
        MalformedTemplateException(String message) {
            super(message);
        }
    }
}
