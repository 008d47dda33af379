package com.vidnyan.playscan.domain.raw;

import com.vidnyan.playscan.domain.model.Location;

/**
 * Position-tagged node of a loaded YAML document.
 * Either a {@link RawMapping}, a {@link RawSequence} or a {@link RawScalar}.
 */
public interface RawNode {

    Location location();

    default boolean isMapping() {
        return this instanceof RawMapping;
    }

    default boolean isSequence() {
        return this instanceof RawSequence;
    }

    default boolean isScalar() {
        return this instanceof RawScalar;
    }

    /**
     * Plain Java view of the node: maps, lists and scalar values.
     * Vault-encrypted scalars are rendered as an opaque marker.
     */
    Object toPlainValue();
}
