package org.bacteria.service.ingestion;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bacteria.models.record.NormalizedRecord;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Reads and writes datasets as pretty-printed JSON arrays. A write goes to a sibling temp file
 * first and is moved into place, so an interrupted run never leaves a truncated snapshot.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DatasetFileStore {

    private static final TypeReference<List<NormalizedRecord>> DATASET = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public void write(Path path, List<NormalizedRecord> records) {
        Path target = path.toAbsolutePath();
        try {
            Files.createDirectories(target.getParent());
            Path temp = target.resolveSibling(target.getFileName() + ".tmp");
            try {
                try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                    objectMapper.writerWithDefaultPrettyPrinter().writeValue(writer, records);
                }
                moveIntoPlace(temp, target);
            } catch (IOException ioException) {
                Files.deleteIfExists(temp);
                throw ioException;
            }
            log.debug("Wrote {} records to {}", records.size(), target);
        } catch (IOException ioException) {
            throw new IllegalStateException("Failed to write dataset file " + target, ioException);
        }
    }

    public List<NormalizedRecord> read(Path path) {
        List<NormalizedRecord> records;
        try {
            records = objectMapper.readValue(path.toFile(), DATASET);
        } catch (IOException ioException) {
            throw new IllegalStateException("Failed to read dataset file " + path, ioException);
        }
        if (records == null || records.contains(null)) {
            throw new IllegalStateException("Dataset file " + path + " must be an array of records");
        }
        return List.copyOf(records);
    }

    private void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException exception) {
            log.debug("Atomic move not supported for {}, falling back to replace", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
