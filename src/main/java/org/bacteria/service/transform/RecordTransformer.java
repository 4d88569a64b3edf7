package org.bacteria.service.transform;

import lombok.extern.slf4j.Slf4j;
import org.bacteria.models.enums.ValueKind;
import org.bacteria.models.record.FieldMapping;
import org.bacteria.models.record.NormalizedRecord;
import org.bacteria.models.record.Outcome;
import org.bacteria.models.record.RawRecord;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps a raw BacDive payload onto the normalized schema by interpreting a {@link FieldMapping}
 * table. Each field is resolved on its own, so sparse payloads produce {@code null} (or an
 * empty list) for whatever is missing. Holds no state between calls.
 */
@Slf4j
@Component
public class RecordTransformer {

    private final List<FieldMapping> mappings;

    public RecordTransformer() {
        this(RecordFieldMappings.BACDIVE);
    }

    public RecordTransformer(List<FieldMapping> mappings) {
        this.mappings = List.copyOf(mappings);
    }

    public Outcome<NormalizedRecord> transform(RawRecord raw) {
        if (raw == null) {
            return Outcome.error("No raw record to transform");
        }
        Optional<String> identifier = NestedLookup.find(raw.payload(), RecordFieldMappings.IDENTIFIER_PATH)
                .map(Object::toString)
                .filter(StringUtils::hasText);
        if (identifier.isEmpty()) {
            log.error("[transform] BacDive-ID not found in data");
            return Outcome.error("BacDive-ID not found in data");
        }

        log.debug("[transform] Transforming data for BacDive-ID {}", identifier.get());
        try {
            Map<String, Object> normalized = new LinkedHashMap<>();
            normalized.put(NormalizedRecord.IDENTIFIER, identifier.get());
            Map<List<String>, Map<String, Object>> groups = new HashMap<>();
            for (FieldMapping mapping : mappings) {
                place(normalized, groups, mapping.target(), resolve(raw.payload(), mapping));
            }
            return Outcome.success(NormalizedRecord.of(normalized));
        } catch (RuntimeException exception) {
            log.error("[transform] Error transforming BacDive-ID {}: {}", identifier.get(), exception.getMessage());
            return Outcome.error(exception.getMessage(), exception);
        }
    }

    private Object resolve(Map<String, Object> payload, FieldMapping mapping) {
        Optional<Object> found = NestedLookup.find(payload, mapping.source());
        if (mapping.kind() == ValueKind.LIST) {
            return found.<List<Object>>map(value -> value instanceof Collection<?> collection
                            ? new ArrayList<>(collection)
                            : List.of(value))
                    .orElseGet(List::of);
        }
        return found.orElse(null);
    }

    private void place(Map<String, Object> root,
                       Map<List<String>, Map<String, Object>> groups,
                       List<String> path,
                       Object value) {
        Map<String, Object> current = root;
        for (int depth = 1; depth < path.size(); depth++) {
            Map<String, Object> parent = current;
            String segment = path.get(depth - 1);
            current = groups.computeIfAbsent(List.copyOf(path.subList(0, depth)), prefix -> {
                Map<String, Object> child = new LinkedHashMap<>();
                parent.put(segment, child);
                return child;
            });
        }
        current.put(path.get(path.size() - 1), value);
    }
}
