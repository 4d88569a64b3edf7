package org.bacteria.configuration;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
        info = @Info(
                title = "Bacterial Taxonomy API",
                version = "1.0.0",
                description = "Read-only REST API over BacDive strain records: paginated listing, "
                        + "lookup by BacDive ID, genus/species search and dataset statistics."))
public class OpenApiConfig {
}
