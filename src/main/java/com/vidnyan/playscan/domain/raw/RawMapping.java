package com.vidnyan.playscan.domain.raw;

import com.vidnyan.playscan.domain.model.Location;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Mapping node. Keys keep their source order.
 */
public record RawMapping(
    Map<String, RawNode> entries,
    Location location
) implements RawNode {

    public RawMapping {
        entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static RawMapping empty(Location location) {
        return new RawMapping(Map.of(), location);
    }

    public boolean containsKey(String key) {
        return entries.containsKey(key);
    }

    public Optional<RawNode> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    /**
     * Scalar text of a key, if the key holds a non-null scalar.
     */
    public Optional<String> getText(String key) {
        RawNode node = entries.get(key);
        if (node instanceof RawScalar scalar && scalar.value() != null) {
            return Optional.of(scalar.asText());
        }
        return Optional.empty();
    }

    public int size() {
        return entries.size();
    }

    @Override
    public Object toPlainValue() {
        Map<String, Object> plain = new LinkedHashMap<>();
        entries.forEach((key, value) -> plain.put(key, value.toPlainValue()));
        return plain;
    }
}
