package com.vidnyan.playscan.domain.raw;

import com.vidnyan.playscan.domain.model.Location;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conversion of plain Java values (from configuration or requests) into raw nodes.
 */
public final class RawNodes {

    private RawNodes() {
    }

    public static RawNode fromPlain(Object value, Location location) {
        if (value instanceof Map<?, ?> map) {
            Map<String, RawNode> entries = new LinkedHashMap<>();
            map.forEach((k, v) -> entries.put(String.valueOf(k), fromPlain(v, location)));
            return new RawMapping(entries, location);
        }
        if (value instanceof List<?> list) {
            List<RawNode> items = new ArrayList<>();
            list.forEach(item -> items.add(fromPlain(item, location)));
            return new RawSequence(items, location);
        }
        if (value instanceof Integer i) {
            return RawScalar.of(i.longValue(), location);
        }
        if (value instanceof Float f) {
            return RawScalar.of(f.doubleValue(), location);
        }
        if (value == null || value instanceof String || value instanceof Boolean
                || value instanceof Long || value instanceof Double) {
            return RawScalar.of(value, location);
        }
        return RawScalar.of(String.valueOf(value), location);
    }
}
