package org.bacteria.service.transform;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deep-copies JSON-shaped values (maps, lists, scalars) into unmodifiable collections so a
 * normalized record cannot change after it is built. Keys keep their insertion order and
 * {@code null} values survive the copy.
 */
public final class RecordValueNormalizer {

    private RecordValueNormalizer() {
    }

    public static Map<String, Object> freezeMap(Map<?, ?> payload) {
        if (payload == null) {
            return Map.of();
        }
        Map<String, Object> normalized = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : payload.entrySet()) {
            normalized.put(String.valueOf(entry.getKey()), freeze(entry.getValue()));
        }
        return Collections.unmodifiableMap(normalized);
    }

    public static Object freeze(Object value) {
        if (value instanceof Map<?, ?> mapVal) {
            return freezeMap(mapVal);
        }
        if (value instanceof List<?> listVal) {
            return freezeList(listVal);
        }
        return value;
    }

    private static List<Object> freezeList(List<?> listVal) {
        List<Object> normalized = new ArrayList<>(listVal.size());
        for (Object item : listVal) {
            normalized.add(freeze(item));
        }
        return Collections.unmodifiableList(normalized);
    }
}
