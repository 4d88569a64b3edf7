package org.bacteria.service.transform;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("NestedLookup")
class NestedLookupTest {

    private final Map<String, Object> root = Map.of(
            "General", Map.of("NCBI tax id", Map.of("NCBI tax id", 1423)),
            "Sequence information", List.of(Map.of("GC-content", "43.5")));

    @Test
    void findsNestedValue() {
        assertThat(NestedLookup.find(root, List.of("General", "NCBI tax id", "NCBI tax id"))).contains(1423);
    }

    @Test
    @DisplayName("missing keys, lists and scalars along the path give empty")
    void stopsOnNonMaps() {
        assertThat(NestedLookup.find(root, List.of("General", "keywords"))).isEmpty();
        assertThat(NestedLookup.find(root, List.of("Sequence information", "GC-content"))).isEmpty();
        assertThat(NestedLookup.find(root, List.of("General", "NCBI tax id", "NCBI tax id", "deeper"))).isEmpty();
    }

    @Test
    @DisplayName("an explicit null is empty and falsy values are kept")
    void distinguishesNullFromFalsy() {
        Map<String, Object> group = new HashMap<>();
        group.put("type strain", false);
        group.put("count", 0);
        group.put("absent", null);
        Map<String, Object> withNulls = Map.of("taxonomy", group);

        assertThat(NestedLookup.find(withNulls, List.of("taxonomy", "type strain"))).contains(false);
        assertThat(NestedLookup.find(withNulls, List.of("taxonomy", "count"))).contains(0);
        assertThat(NestedLookup.find(withNulls, List.of("taxonomy", "absent"))).isEmpty();
    }

    @Test
    void emptyPathReturnsRoot() {
        assertThat(NestedLookup.find(root, List.of())).contains(root);
    }
}
