package org.bacteria.models.dto;

import org.bacteria.models.record.NormalizedRecord;

import java.util.List;

public record BacteriaPage(
        int total,
        int page,
        int limit,
        List<NormalizedRecord> data
) {
}
