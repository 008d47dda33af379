package com.vidnyan.playscan.domain.graph;

/**
 * One possible value of an argument after constant folding across REACHES edges.
 *
 * @param value        plain value for LITERAL, null otherwise (a LITERAL may itself be null)
 * @param sourceNodeId definition node the value came from, null for inline literals
 */
public record ResolvedValue(
    Kind kind,
    Object value,
    String sourceNodeId
) {

    public enum Kind {
        LITERAL,    // plain value written in the script
        VAULT,      // vault-encrypted scalar
        EXTERNAL,   // variable without a definition in the analyzed files
        COMPUTED    // template with filters, text around the reference or a non-scalar value
    }

    public static ResolvedValue literal(Object value, String source) {
        return new ResolvedValue(Kind.LITERAL, value, source);
    }

    public static ResolvedValue vault(String source) {
        return new ResolvedValue(Kind.VAULT, null, source);
    }

    public static ResolvedValue external(String variable) {
        return new ResolvedValue(Kind.EXTERNAL, variable, null);
    }

    public static ResolvedValue computed(String source) {
        return new ResolvedValue(Kind.COMPUTED, null, source);
    }

    public boolean isLiteral() {
        return kind == Kind.LITERAL;
    }

    /**
     * Literal text, empty string for a null literal.
     */
    public String text() {
        return value == null ? "" : String.valueOf(value);
    }
}
