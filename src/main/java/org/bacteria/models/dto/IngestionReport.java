package org.bacteria.models.dto;

import java.nio.file.Path;

public record IngestionReport(
        int requested,
        int produced,
        int notFound,
        int failed,
        int duplicates,
        int checkpointsWritten,
        Path finalFile,
        boolean interrupted
) {
}
