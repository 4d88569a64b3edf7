package org.bacteria.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "taxonomy.upstream")
public record UpstreamProperties(
        @NotBlank @DefaultValue("https://api.bacdive.dsmz.de/taxon") String taxonBaseUrl,
        @NotBlank @DefaultValue("https://api.bacdive.dsmz.de/fetch") String fetchBaseUrl,
        @NotBlank @DefaultValue("bacdive_api_session") String cookieName,
        String sessionCookie,
        @DefaultValue("30s") Duration timeout,
        @Min(1) @DefaultValue("1") int maxAttempts,
        @DefaultValue("500ms") Duration retryWait
) {

    public UpstreamProperties {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("taxonomy.upstream.timeout must be positive, got: " + timeout);
        }
        if (retryWait == null || retryWait.isNegative()) {
            throw new IllegalArgumentException("taxonomy.upstream.retry-wait must not be negative");
        }
    }
}
