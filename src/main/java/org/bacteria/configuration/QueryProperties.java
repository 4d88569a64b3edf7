package org.bacteria.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "taxonomy.query")
public record QueryProperties(
        @NotBlank @DefaultValue("data/details_transformed_final.json") String datasetFile,
        @Min(1) @DefaultValue("100") int defaultLimit,
        @Min(1) @DefaultValue("100") int searchLimit
) {
}
