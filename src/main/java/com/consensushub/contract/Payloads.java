package com.consensushub.contract;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only deep copies of decision payloads. Nested maps and lists are
 * copied as well; insertion order is kept so checksums do not change.
 */
public final class Payloads {

    private Payloads() {
    }

    public static Map<String, Object> freeze(Map<String, ?> payload) {
        if (payload == null) {
            return null;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        payload.forEach((key, value) -> copy.put(key, freezeValue(value)));
        return Collections.unmodifiableMap(copy);
    }

    private static Object freezeValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((key, nested) -> copy.put(key, freezeValue(nested)));
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(nested -> copy.add(freezeValue(nested)));
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}
