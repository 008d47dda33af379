package com.vidnyan.playscan.domain.raw;

import com.vidnyan.playscan.domain.model.Location;

/**
 * Scalar leaf. The value is a String, Long, Double, Boolean or null.
 * Vault-encrypted scalars keep their ciphertext and are never interpreted.
 */
public record RawScalar(
    Object value,
    boolean vaultEncrypted,
    Location location
) implements RawNode {

    public static final String VAULT_MARKER = "<vault-encrypted>";

    public static RawScalar of(Object value, Location location) {
        return new RawScalar(value, false, location);
    }

    public static RawScalar vault(String ciphertext, Location location) {
        return new RawScalar(ciphertext, true, location);
    }

    public boolean isNull() {
        return value == null;
    }

    public boolean isString() {
        return value instanceof String;
    }

    public boolean isBoolean() {
        return value instanceof Boolean;
    }

    /**
     * Text form of the value, empty string for null.
     */
    public String asText() {
        return value == null ? "" : String.valueOf(value);
    }

    /**
     * Value type name as the orchestration language reports it.
     */
    public String typeName() {
        if (vaultEncrypted) return "vault";
        if (value == null) return "NoneType";
        if (value instanceof Boolean) return "bool";
        if (value instanceof Long || value instanceof Integer) return "int";
        if (value instanceof Double) return "float";
        return "str";
    }

    @Override
    public Object toPlainValue() {
        return vaultEncrypted ? VAULT_MARKER : value;
    }
}
