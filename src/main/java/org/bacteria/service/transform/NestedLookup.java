package org.bacteria.service.transform;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class NestedLookup {

    private NestedLookup() {
    }

    /**
     * Walks {@code path} through nested maps. Empty when any step is missing, {@code null},
     * or not a map.
     */
    public static Optional<Object> find(Map<String, ?> root, List<String> path) {
        Object current = root;
        for (String key : path) {
            if (!(current instanceof Map<?, ?> map)) {
                return Optional.empty();
            }
            current = map.get(key);
        }
        return Optional.ofNullable(current);
    }
}
