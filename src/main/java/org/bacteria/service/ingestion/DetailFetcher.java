package org.bacteria.service.ingestion;

import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bacteria.models.record.Outcome;
import org.bacteria.models.record.RawRecord;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Map;
import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
public class DetailFetcher {

    static final String INVALID_IDENTIFIER = "0";

    private final BacDiveClient bacDiveClient;
    private final Retry upstreamRetry;

    /**
     * Fetches the raw record for one identifier.
     *
     * @return SUCCESS with the record (its general group carrying the identifier), EMPTY for an
     * invalid identifier or a record the upstream does not have, ERROR when the request failed
     */
    public Outcome<RawRecord> fetch(String identifier) {
        if (!StringUtils.hasText(identifier) || INVALID_IDENTIFIER.equals(identifier.trim())) {
            log.warn("[fetch] Skipping invalid ID: {}", identifier);
            return Outcome.empty("Invalid identifier: " + identifier);
        }

        try {
            Optional<Map<String, Object>> detail = upstreamRetry.executeSupplier(() -> bacDiveClient.fetchDetail(identifier));
            if (detail.isEmpty()) {
                log.warn("[fetch] No details found for ID {}", identifier);
                return Outcome.empty("No details found for ID " + identifier);
            }
            log.debug("[fetch] Successfully fetched ID {}", identifier);
            return Outcome.success(RawRecord.of(detail.get()).withIdentifier(identifier));
        } catch (UpstreamRequestException exception) {
            log.error("[fetch] Error fetching details for ID {}: status={} message={}",
                    identifier, exception.getStatus(), exception.getMessage());
            return Outcome.error(exception.getMessage(), exception);
        }
    }
}
