package com.example.dataingest.service;

import com.example.dataingest.config.IngestionProperties;
import com.example.dataingest.model.FileMetadataRecord;
import com.example.dataingest.model.IngestionHistoryEntry;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Append-only ingestion history plus the path-keyed metadata table, each persisted as a pretty-printed JSON
 * document in the log directory.
 * <p>
 * Every write is a full read-modify-write of one document, replaced through a temp file, so all operations are
 * serialized on this instance. Failures are logged and swallowed: recording an ingestion must never abort it.
 */
@Slf4j
@Service
public class IngestionLogStore {

    private static final TypeReference<List<IngestionHistoryEntry>> HISTORY_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<LinkedHashMap<String, FileMetadataRecord>> METADATA_TYPE =
            new TypeReference<>() {
            };
    private static final String UNKNOWN_PATH = "unknown";

    private final ObjectMapper objectMapper;
    private final Path historyFile;
    private final Path metadataFile;

    @Autowired
    public IngestionLogStore(ObjectMapper objectMapper, IngestionProperties properties) {
        this(objectMapper, properties.historyFile(), properties.metadataFile());
    }

    public IngestionLogStore(ObjectMapper objectMapper, Path historyFile, Path metadataFile) {
        this.objectMapper = objectMapper;
        this.historyFile = historyFile.toAbsolutePath().normalize();
        this.metadataFile = metadataFile.toAbsolutePath().normalize();
        log.info("Ingestion history at {}, metadata table at {}", this.historyFile, this.metadataFile);
    }

    public synchronized void recordStart(String sessionId, int filesDetected) {
        append(IngestionHistoryEntry.start(sessionId, Instant.now(), filesDetected));
        log.info("Started ingestion session {} with {} files", sessionId, filesDetected);
    }

    /**
     * Appends a {@code file_processed} entry and, for a successful extraction only, upserts the metadata
     * keyed by its file path.
     */
    public synchronized void recordFileOutcome(String sessionId, String filePath, FileMetadataRecord metadata,
            boolean success) {
        append(IngestionHistoryEntry.fileProcessed(sessionId, Instant.now(), filePath, metadata, success));

        String name = Path.of(filePath).getFileName().toString();
        if (success && metadata != null && metadata.isSuccessful()) {
            log.info("Successfully processed: {}", name);
            storeMetadata(metadata);
        } else {
            log.error("Failed to process: {}", name);
        }
    }

    public synchronized void recordComplete(String sessionId, int processedCount, int failedCount) {
        append(IngestionHistoryEntry.complete(sessionId, Instant.now(), processedCount, failedCount));
        log.info("Completed ingestion session {}: {} processed, {} failed", sessionId, processedCount, failedCount);
    }

    /**
     * Returns the last {@code limit} entries, oldest first, or the whole history when {@code limit <= 0}.
     */
    public synchronized List<IngestionHistoryEntry> getHistory(int limit) {
        try {
            List<IngestionHistoryEntry> history = readHistory();
            if (limit <= 0 || history.size() <= limit) {
                return List.copyOf(history);
            }
            return List.copyOf(history.subList(history.size() - limit, history.size()));
        } catch (IOException | RuntimeException ex) {
            log.error("Failed to retrieve ingestion history: {}", ex.getMessage(), ex);
            return List.of();
        }
    }

    public synchronized Optional<FileMetadataRecord> getMetadata(String filePath) {
        return Optional.ofNullable(getAllMetadata().get(filePath));
    }

    public synchronized Map<String, FileMetadataRecord> getAllMetadata() {
        try {
            return readMetadata();
        } catch (IOException | RuntimeException ex) {
            log.error("Failed to retrieve metadata: {}", ex.getMessage(), ex);
            return Map.of();
        }
    }

    private void append(IngestionHistoryEntry entry) {
        try {
            List<IngestionHistoryEntry> history = readHistory();
            history.add(entry);
            write(historyFile, history);
        } catch (IOException | RuntimeException ex) {
            log.error("Failed to append {} event for session {} to ingestion history: {}",
                    entry.event().value(), entry.sessionId(), ex.getMessage(), ex);
        }
    }

    private void storeMetadata(FileMetadataRecord metadata) {
        try {
            Map<String, FileMetadataRecord> table = readMetadata();
            String key = metadata.filePath() != null ? metadata.filePath() : UNKNOWN_PATH;
            table.put(key, metadata);
            write(metadataFile, table);
        } catch (IOException | RuntimeException ex) {
            log.error("Failed to store metadata for {}: {}", metadata.filePath(), ex.getMessage(), ex);
        }
    }

    private List<IngestionHistoryEntry> readHistory() throws IOException {
        if (isAbsentOrEmpty(historyFile)) {
            return new ArrayList<>();
        }
        List<IngestionHistoryEntry> history = objectMapper.readValue(historyFile.toFile(), HISTORY_TYPE);
        return history == null ? new ArrayList<>() : new ArrayList<>(history);
    }

    private Map<String, FileMetadataRecord> readMetadata() throws IOException {
        if (isAbsentOrEmpty(metadataFile)) {
            return new LinkedHashMap<>();
        }
        Map<String, FileMetadataRecord> table = objectMapper.readValue(metadataFile.toFile(), METADATA_TYPE);
        return table == null ? new LinkedHashMap<>() : table;
    }

    private static boolean isAbsentOrEmpty(Path file) throws IOException {
        return !Files.exists(file) || Files.size(file) == 0;
    }

    private void write(Path target, Object document) throws IOException {
        Path directory = target.getParent();
        Files.createDirectories(directory);
        Path temp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), document);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
