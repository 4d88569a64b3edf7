package org.bacteria.service.ingestion;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bacteria.configuration.IngestionProperties;
import org.bacteria.models.dto.IngestionReport;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs one ingestion at startup when {@code taxonomy.ingestion.enabled=true}. A missing
 * credential fails the startup before any request is sent.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "taxonomy.ingestion", name = "enabled", havingValue = "true")
public class IngestionRunner implements ApplicationRunner {

    private final CredentialContext credentialContext;
    private final IngestionDriver ingestionDriver;
    private final IngestionProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        credentialContext.verify();

        IngestionReport report = switch (properties.mode()) {
            case RANGE -> ingestionDriver.runRange(properties.startId(), properties.endId(), properties.checkpointInterval());
            case GENUS -> {
                if (properties.genera().isEmpty()) {
                    throw new IllegalStateException("taxonomy.ingestion.genera is required in GENUS mode");
                }
                yield ingestionDriver.runForGenera(properties.genera(), properties.checkpointInterval());
            }
        };

        log.info("[ingest] Run finished: requested={}, produced={}, notFound={}, failed={}, duplicates={}, checkpoints={}, interrupted={}",
                report.requested(), report.produced(), report.notFound(), report.failed(),
                report.duplicates(), report.checkpointsWritten(), report.interrupted());
    }
}
