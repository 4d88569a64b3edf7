package org.bacteria.service.ingestion;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bacteria.configuration.UpstreamProperties;
import org.bacteria.models.dto.TaxonPage;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * HTTP access to the BacDive taxon listing and detail endpoints. Every request carries
 * {@code Accept: application/json} and the session cookie; failures surface as
 * {@link UpstreamRequestException}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BacDiveClient {

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT =
            new ParameterizedTypeReference<>() {
            };

    private final RestClient bacDiveRestClient;
    private final UpstreamProperties properties;
    private final CredentialContext credentialContext;

    public TaxonPage fetchTaxonPage(String genus, int page) {
        URI uri = UriComponentsBuilder.fromUriString(properties.taxonBaseUrl())
                .pathSegment(genus)
                .queryParam("page", page)
                .encode()
                .build()
                .toUri();
        log.debug("Fetching page {} from: {}", page, uri);
        TaxonPage body = execute(uri, response -> response.body(TaxonPage.class));
        return body == null ? TaxonPage.empty() : body;
    }

    /**
     * @return the raw detail for {@code identifier}, or empty when the upstream answers 404 or
     * its {@code results} has no entry for that identifier
     */
    public Optional<Map<String, Object>> fetchDetail(String identifier) {
        URI uri = UriComponentsBuilder.fromUriString(properties.fetchBaseUrl())
                .pathSegment(identifier)
                .encode()
                .build()
                .toUri();
        log.debug("Fetching details for ID: {} from {}", identifier, uri);

        Map<String, Object> body;
        try {
            body = execute(uri, response -> response.body(JSON_OBJECT));
        } catch (UpstreamRequestException exception) {
            if (exception.isNotFound()) {
                return Optional.empty();
            }
            throw exception;
        }

        if (body == null || !(body.get("results") instanceof Map<?, ?> results)) {
            return Optional.empty();
        }
        if (!(results.get(identifier) instanceof Map<?, ?> detail)) {
            return Optional.empty();
        }
        return Optional.of(copyOf(detail));
    }

    private <T> T execute(URI uri, Function<RestClient.ResponseSpec, T> reader) {
        try {
            RestClient.ResponseSpec response = bacDiveRestClient.get()
                    .uri(uri)
                    .accept(MediaType.APPLICATION_JSON)
                    .header(HttpHeaders.COOKIE, properties.cookieName() + "=" + credentialContext.sessionCookie())
                    .retrieve();
            return reader.apply(response);
        } catch (RestClientResponseException exception) {
            int status = exception.getStatusCode().value();
            throw new UpstreamRequestException("Upstream responded " + status + " for " + uri,
                    status, status >= 500 || status == 429, exception);
        } catch (ResourceAccessException exception) {
            throw new UpstreamRequestException("Upstream unreachable for " + uri + ": " + exception.getMessage(),
                    null, true, exception);
        } catch (RestClientException exception) {
            throw new UpstreamRequestException("Malformed upstream response for " + uri + ": " + exception.getMessage(),
                    null, false, exception);
        }
    }

    private Map<String, Object> copyOf(Map<?, ?> detail) {
        Map<String, Object> copy = new LinkedHashMap<>();
        detail.forEach((key, value) -> copy.put(String.valueOf(key), value));
        return copy;
    }
}
