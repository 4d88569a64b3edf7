package org.bacteria.repository;

import lombok.extern.slf4j.Slf4j;
import org.bacteria.configuration.QueryProperties;
import org.bacteria.models.record.NormalizedRecord;
import org.bacteria.service.ingestion.DatasetFileStore;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The consolidated dataset, loaded once at startup and never modified afterwards.
 */
@Slf4j
@Repository
public class BacteriaRepository {

    private final List<NormalizedRecord> records;
    private final Map<String, NormalizedRecord> index;

    @Autowired
    public BacteriaRepository(DatasetFileStore datasetFileStore, QueryProperties properties) {
        this(load(datasetFileStore, Path.of(properties.datasetFile())));
    }

    public BacteriaRepository(List<NormalizedRecord> records) {
        this.records = List.copyOf(records);
        Map<String, NormalizedRecord> byId = new LinkedHashMap<>();
        for (NormalizedRecord record : this.records) {
            byId.putIfAbsent(record.identifier(), record);
        }
        this.index = Collections.unmodifiableMap(byId);
    }

    public List<NormalizedRecord> findAll() {
        return records;
    }

    public Optional<NormalizedRecord> findById(String identifier) {
        return Optional.ofNullable(index.get(identifier));
    }

    private static List<NormalizedRecord> load(DatasetFileStore datasetFileStore, Path datasetFile) {
        if (!Files.isRegularFile(datasetFile)) {
            log.warn("Dataset file {} not found, serving an empty dataset", datasetFile.toAbsolutePath());
            return List.of();
        }
        log.info("Loading data into memory from {}", datasetFile.toAbsolutePath());
        List<NormalizedRecord> loaded = datasetFileStore.read(datasetFile);
        log.info("Total records loaded: {}", loaded.size());
        return loaded;
    }
}
