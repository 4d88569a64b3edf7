package org.bacteria.models.dto;

import org.bacteria.models.record.NormalizedRecord;

import java.util.List;

public record SearchResult(
        int total,
        List<NormalizedRecord> data
) {
}
