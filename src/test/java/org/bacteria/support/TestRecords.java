package org.bacteria.support;

import org.bacteria.configuration.IngestionProperties;
import org.bacteria.configuration.UpstreamProperties;
import org.bacteria.models.enums.IngestionMode;
import org.bacteria.models.record.NormalizedRecord;
import org.bacteria.models.record.RawRecord;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builders shared by the unit tests.
 */
public final class TestRecords {

    public static final String TAXON_BASE = "https://api.example.test/taxon";
    public static final String FETCH_BASE = "https://api.example.test/fetch";

    private TestRecords() {
    }

    public static NormalizedRecord normalized(String identifier, String genus, String species) {
        Map<String, Object> taxonomy = new LinkedHashMap<>();
        taxonomy.put("genus", genus);
        taxonomy.put("species", species);
        Map<String, Object> json = new LinkedHashMap<>();
        json.put(NormalizedRecord.IDENTIFIER, identifier);
        json.put(NormalizedRecord.TAXONOMY, taxonomy);
        return NormalizedRecord.of(json);
    }

    public static RawRecord raw(String identifier, String genus) {
        Map<String, Object> taxonomy = new LinkedHashMap<>();
        taxonomy.put("genus", genus);
        taxonomy.put("species", "sp. " + identifier);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("Name and taxonomic classification", taxonomy);
        return RawRecord.of(payload).withIdentifier(identifier);
    }

    public static UpstreamProperties upstream(String sessionCookie, int maxAttempts) {
        return new UpstreamProperties(TAXON_BASE, FETCH_BASE, "bacdive_api_session", sessionCookie,
                Duration.ofSeconds(5), maxAttempts, Duration.ofMillis(1));
    }

    public static IngestionProperties ingestion(Path outputDir) {
        return ingestion(outputDir, IngestionMode.RANGE, List.of());
    }

    public static IngestionProperties ingestion(Path outputDir, IngestionMode mode, List<String> genera) {
        return new IngestionProperties(true, mode, 1, 5, genera, 2, Duration.ZERO, Duration.ZERO,
                outputDir.toString(), "details_transformed", "details_transformed_final.json");
    }
}
