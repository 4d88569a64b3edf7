package org.bacteria.configuration;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.bacteria.service.ingestion.CredentialContext;
import org.bacteria.service.ingestion.UpstreamRequestException;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Slf4j
@Configuration
public class UpstreamClientConfig {

    static final String RETRY_NAME = "bacdive";

    @Bean
    public CredentialContext credentialContext(UpstreamProperties properties) {
        return new CredentialContext(properties.sessionCookie());
    }

    @Bean
    public RestClient bacDiveRestClient(RestClient.Builder builder, UpstreamProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        int timeoutMs = (int) properties.timeout().toMillis();
        requestFactory.setConnectTimeout(timeoutMs);
        requestFactory.setReadTimeout(timeoutMs);
        return builder
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    /**
     * Retries only failures flagged transient (5xx, 429, I/O). A 404 never reaches the retry,
     * the client reports it as an absent record.
     */
    @Bean
    public Retry upstreamRetry(UpstreamProperties properties) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(properties.maxAttempts())
                .waitDuration(properties.retryWait())
                .retryOnException(throwable -> throwable instanceof UpstreamRequestException upstream
                        && upstream.isTransientFailure())
                .build();
        Retry retry = Retry.of(RETRY_NAME, config);
        retry.getEventPublisher().onRetry(event -> log.warn("[retry] Attempt {} for upstream call failed: {}",
                event.getNumberOfRetryAttempts(), event.getLastThrowable().getMessage()));
        return retry;
    }
}
