package org.bacteria.models.record;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.bacteria.service.transform.NestedLookup;
import org.bacteria.service.transform.RecordValueNormalizer;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A strain in the stable output schema: {@code identifier} followed by the fixed groups
 * (general, taxonomy, LPSN, culture_conditions, physiology_and_metabolism, biosafety,
 * sequence_information, external_links). Serialized to JSON exactly as {@link #toJson()}.
 */
@ToString
@EqualsAndHashCode
public final class NormalizedRecord {

    public static final String IDENTIFIER = "identifier";
    public static final String TAXONOMY = "taxonomy";

    private final Map<String, Object> fields;

    private NormalizedRecord(Map<String, Object> fields) {
        this.fields = fields;
    }

    /**
     * Builds a record from its JSON form. The identifier is moved to the front and stored as a
     * string; all nested values are copied into unmodifiable collections.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static NormalizedRecord of(Map<String, Object> json) {
        Object identifier = json == null ? null : json.get(IDENTIFIER);
        if (identifier == null || identifier.toString().isBlank()) {
            throw new IllegalArgumentException("Normalized record requires a non-blank identifier");
        }
        Map<String, Object> ordered = new LinkedHashMap<>();
        ordered.put(IDENTIFIER, identifier.toString());
        json.forEach(ordered::putIfAbsent);
        return new NormalizedRecord(RecordValueNormalizer.freezeMap(ordered));
    }

    @JsonValue
    public Map<String, Object> toJson() {
        return fields;
    }

    public String identifier() {
        return (String) fields.get(IDENTIFIER);
    }

    public Optional<Object> value(String... path) {
        return NestedLookup.find(fields, Arrays.asList(path));
    }

    public String genus() {
        return value(TAXONOMY, "genus").map(Object::toString).orElse(null);
    }

    public String species() {
        return value(TAXONOMY, "species").map(Object::toString).orElse(null);
    }
}
