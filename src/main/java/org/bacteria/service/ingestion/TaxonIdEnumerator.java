package org.bacteria.service.ingestion;

import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bacteria.configuration.IngestionProperties;
import org.bacteria.models.dto.TaxonPage;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Collects strain identifiers per genus by walking the paged taxon listing until a page comes
 * back without a {@code next} link. Best effort: a failed page ends that genus with the IDs
 * gathered so far.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TaxonIdEnumerator {

    private final BacDiveClient bacDiveClient;
    private final Retry upstreamRetry;
    private final RequestPacer requestPacer;
    private final IngestionProperties ingestionProperties;

    public List<String> collectIds(String genus) {
        Set<String> ids = new LinkedHashSet<>();
        int page = 0;
        log.info("[enumerate] Fetching IDs for genus: {}", genus);

        try {
            while (true) {
                page++;
                int current = page;
                TaxonPage taxonPage = upstreamRetry.executeSupplier(() -> bacDiveClient.fetchTaxonPage(genus, current));
                List<String> pageIds = taxonPage.identifiers();
                ids.addAll(pageIds);
                log.info("[enumerate] Retrieved {} IDs on page {}. Total expected: {}", pageIds.size(), page, taxonPage.count());

                if (!taxonPage.hasNext()) {
                    break;
                }
                if (!requestPacer.pause(ingestionProperties.pageDelay())) {
                    log.warn("[enumerate] Interrupted while paging genus {}", genus);
                    break;
                }
            }
        } catch (UpstreamRequestException exception) {
            log.error("[enumerate] Error fetching IDs for genus {} on page {}: {}", genus, page, exception.getMessage());
        }

        log.info("[enumerate] Total pages fetched: {}", page);
        log.info("[enumerate] Total IDs collected for {}: {}", genus, ids.size());
        return List.copyOf(ids);
    }

    /**
     * Builds the genus to identifiers index. One genus failing leaves the others untouched; an
     * interrupt ends the index at the genus being paged.
     */
    public Map<String, List<String>> collectIds(List<String> genera) {
        Map<String, List<String>> index = new LinkedHashMap<>();
        for (String genus : genera) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("[enumerate] Interrupted, skipping the remaining genera from {}", genus);
                break;
            }
            index.put(genus, collectIds(genus));
        }
        return index;
    }
}
