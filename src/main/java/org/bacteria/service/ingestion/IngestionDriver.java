package org.bacteria.service.ingestion;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bacteria.configuration.IngestionProperties;
import org.bacteria.models.dto.IngestionReport;
import org.bacteria.models.record.NormalizedRecord;
import org.bacteria.models.record.Outcome;
import org.bacteria.models.record.RawRecord;
import org.bacteria.service.transform.RecordTransformer;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiPredicate;
import java.util.stream.LongStream;

/**
 * Runs fetch and transform for a sequence of identifiers, one at a time, collecting the
 * normalized records in order. Snapshots go to checkpoint files along the way and to the final
 * file at the end. A failing identifier is logged and skipped; it never stops the run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionDriver {

    static final Comparator<String> IDENTIFIER_ORDER = Comparator
            .comparing((String id) -> !isNumeric(id))
            .thenComparingInt(id -> isNumeric(id) ? id.length() : 0)
            .thenComparing(Comparator.naturalOrder());

    private final DetailFetcher detailFetcher;
    private final RecordTransformer recordTransformer;
    private final TaxonIdEnumerator taxonIdEnumerator;
    private final DatasetFileStore datasetFileStore;
    private final RequestPacer requestPacer;
    private final IngestionProperties properties;

    /**
     * Processes {@code startId..endId} ascending. A checkpoint is written after every identifier
     * divisible by {@code interval}.
     */
    public IngestionReport runRange(long startId, long endId, int interval) {
        if (startId < 1 || endId < startId) {
            throw new IllegalArgumentException("Invalid identifier range: " + startId + ".." + endId);
        }
        requirePositive(interval);
        log.info("[ingest] Starting fetch for IDs {} to {}", startId, endId);
        List<String> identifiers = LongStream.rangeClosed(startId, endId)
                .mapToObj(Long::toString)
                .toList();
        return process(identifiers, (identifier, position) -> Long.parseLong(identifier) % interval == 0);
    }

    /**
     * Processes {@code identifiers} in the given order. A checkpoint is written after every
     * {@code interval}-th identifier and named after it.
     */
    public IngestionReport runForIdentifiers(List<String> identifiers, int interval) {
        requirePositive(interval);
        log.info("[ingest] Starting fetch for {} identifiers", identifiers.size());
        return process(identifiers, (identifier, position) -> position % interval == 0);
    }

    /**
     * Enumerates the genera, merges their identifiers in ascending order and processes them.
     */
    public IngestionReport runForGenera(List<String> genera, int interval) {
        Map<String, List<String>> genusIndex = taxonIdEnumerator.collectIds(genera);
        genusIndex.forEach((genus, ids) -> log.info("[ingest] Genus {} contributed {} IDs", genus, ids.size()));
        List<String> identifiers = genusIndex.values().stream()
                .flatMap(List::stream)
                .distinct()
                .sorted(IDENTIFIER_ORDER)
                .toList();
        return runForIdentifiers(identifiers, interval);
    }

    private IngestionReport process(List<String> identifiers, BiPredicate<String, Long> checkpointDue) {
        List<NormalizedRecord> accumulator = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        RunCounters counters = new RunCounters();
        long position = 0;

        for (String identifier : identifiers) {
            position++;
            try {
                processIdentifier(identifier, accumulator, seen, counters);
            } catch (RuntimeException exception) {
                counters.failed++;
                log.error("[ingest] Failed processing ID {}: {}", identifier, exception.getMessage(), exception);
            }

            if (checkpointDue.test(identifier, position)) {
                writeCheckpoint(identifier, List.copyOf(accumulator), counters);
            }

            if (!requestPacer.pause(properties.requestDelay())) {
                log.warn("[ingest] Interrupted after ID {}; the last checkpoint is the recovery point", identifier);
                return counters.toReport(identifiers.size(), null, true);
            }
        }

        Path finalPath = properties.finalPath();
        datasetFileStore.write(finalPath, List.copyOf(accumulator));
        log.info("[ingest] Process completed. Total valid entries: {} (requested={}, notFound={}, failed={}) written to {}",
                accumulator.size(), identifiers.size(), counters.notFound, counters.failed, finalPath);
        return counters.toReport(identifiers.size(), finalPath, false);
    }

    private void processIdentifier(String identifier,
                                   List<NormalizedRecord> accumulator,
                                   Set<String> seen,
                                   RunCounters counters) {
        Outcome<RawRecord> fetched = detailFetcher.fetch(identifier);
        switch (fetched.status()) {
            case EMPTY -> {
                counters.notFound++;
                return;
            }
            case ERROR -> {
                counters.failed++;
                log.warn("[ingest] No record for ID {}: {}", identifier, fetched.message());
                return;
            }
            default -> {
            }
        }

        Outcome<NormalizedRecord> transformed = recordTransformer.transform(fetched.value());
        if (!transformed.isSuccess()) {
            counters.failed++;
            log.warn("[ingest] Dropping ID {}: {}", identifier, transformed.message());
            return;
        }

        NormalizedRecord record = transformed.value();
        if (!seen.add(record.identifier())) {
            counters.duplicates++;
            log.warn("[ingest] Skipping duplicate record {}", record.identifier());
            return;
        }
        accumulator.add(record);
        counters.produced++;
    }

    private void writeCheckpoint(String identifier, List<NormalizedRecord> snapshot, RunCounters counters) {
        Path checkpoint = properties.checkpointPath(identifier);
        try {
            datasetFileStore.write(checkpoint, snapshot);
            counters.checkpoints++;
            log.info("[ingest] Checkpoint save at ID {}. Found {} valid entries so far.", identifier, snapshot.size());
        } catch (IllegalStateException exception) {
            log.error("[ingest] Checkpoint at ID {} could not be written: {}", identifier, exception.getMessage());
        }
    }

    private static void requirePositive(int interval) {
        if (interval < 1) {
            throw new IllegalArgumentException("Checkpoint interval must be positive, got: " + interval);
        }
    }

    private static boolean isNumeric(String identifier) {
        return !identifier.isEmpty() && identifier.chars().allMatch(Character::isDigit);
    }

    private static final class RunCounters {
        private int produced;
        private int notFound;
        private int failed;
        private int duplicates;
        private int checkpoints;

        private IngestionReport toReport(int requested, Path finalFile, boolean interrupted) {
            return new IngestionReport(requested, produced, notFound, failed, duplicates, checkpoints, finalFile, interrupted);
        }
    }
}
