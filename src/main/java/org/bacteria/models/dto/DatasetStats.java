package org.bacteria.models.dto;

public record DatasetStats(
        int totalRecords,
        int uniqueGenera,
        int uniqueSpecies
) {
}
