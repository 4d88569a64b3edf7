package org.bacteria.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.bacteria.models.enums.IngestionMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

@Validated
@ConfigurationProperties(prefix = "taxonomy.ingestion")
public record IngestionProperties(
        @DefaultValue("false") boolean enabled,
        @DefaultValue("RANGE") IngestionMode mode,
        @Min(1) @DefaultValue("1") long startId,
        @Min(1) @DefaultValue("27000") long endId,
        List<String> genera,
        @Min(1) @DefaultValue("1000") int checkpointInterval,
        @DefaultValue("5ms") Duration requestDelay,
        @DefaultValue("100ms") Duration pageDelay,
        @NotBlank @DefaultValue("data") String outputDir,
        @NotBlank @DefaultValue("details_transformed") String checkpointPrefix,
        @NotBlank @DefaultValue("details_transformed_final.json") String finalFile
) {

    public IngestionProperties {
        if (endId < startId) {
            throw new IllegalArgumentException(
                    "taxonomy.ingestion.end-id must not be lower than start-id, got: " + startId + ".." + endId);
        }
        genera = genera == null ? List.of() : List.copyOf(genera);
        requestDelay = requestDelay == null ? Duration.ZERO : requestDelay;
        pageDelay = pageDelay == null ? Duration.ZERO : pageDelay;
    }

    public Path checkpointPath(String identifier) {
        return Path.of(outputDir).resolve(checkpointPrefix + "_" + identifier + ".json");
    }

    public Path finalPath() {
        return Path.of(outputDir).resolve(finalFile);
    }
}
