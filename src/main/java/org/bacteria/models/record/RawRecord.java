package org.bacteria.models.record;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record RawRecord(Map<String, Object> payload) {

    public static final String GENERAL_GROUP = "General";
    public static final String IDENTIFIER_KEY = "BacDive-ID";

    public RawRecord {
        payload = payload == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static RawRecord of(Map<String, Object> payload) {
        return new RawRecord(payload);
    }

    /**
     * Returns a copy whose general group carries {@code identifier}, creating the group when the
     * upstream omitted it.
     */
    public RawRecord withIdentifier(String identifier) {
        Map<String, Object> general = new LinkedHashMap<>();
        if (payload.get(GENERAL_GROUP) instanceof Map<?, ?> existing) {
            existing.forEach((key, value) -> general.put(String.valueOf(key), value));
        }
        general.put(IDENTIFIER_KEY, identifier);

        Map<String, Object> copy = new LinkedHashMap<>(payload);
        copy.put(GENERAL_GROUP, general);
        return new RawRecord(copy);
    }
}
