package org.bacteria.models.record;

import org.bacteria.models.enums.ValueKind;

import java.util.Arrays;
import java.util.List;

/**
 * One row of the normalization table: where a value lands in the normalized record
 * ({@code target}, e.g. {@code [taxonomy, genus]}) and where it is read from in the raw
 * record ({@code source}, e.g. {@code [Name and taxonomic classification, genus]}).
 */
public record FieldMapping(List<String> target, List<String> source, ValueKind kind) {

    public FieldMapping {
        if (target == null || target.isEmpty()) {
            throw new IllegalArgumentException("Field mapping requires a target path");
        }
        if (source == null || source.isEmpty()) {
            throw new IllegalArgumentException("Field mapping requires a source path for " + target);
        }
        target = List.copyOf(target);
        source = List.copyOf(source);
    }

    /**
     * @param target dot-separated destination path
     * @param source raw group and key names; these may contain dots, so they are passed one by one
     */
    public static FieldMapping value(String target, String... source) {
        return new FieldMapping(Arrays.asList(target.split("\\.")), Arrays.asList(source), ValueKind.VALUE);
    }

    public static FieldMapping list(String target, String... source) {
        return new FieldMapping(Arrays.asList(target.split("\\.")), Arrays.asList(source), ValueKind.LIST);
    }
}
