package com.example.dataingest.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;

/**
 * One immutable event of the append-only ingestion history. Event-specific fields are null for other events.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IngestionHistoryEntry(
        String sessionId,
        Instant timestamp,
        IngestionEvent event,
        Integer filesDetected,
        String filePath,
        Boolean success,
        FileMetadataRecord metadata,
        Integer processedCount,
        Integer failedCount) {

    public static IngestionHistoryEntry start(String sessionId, Instant timestamp, int filesDetected) {
        return new IngestionHistoryEntry(sessionId, timestamp, IngestionEvent.START, filesDetected,
                null, null, null, null, null);
    }

    public static IngestionHistoryEntry fileProcessed(String sessionId,
            Instant timestamp,
            String filePath,
            FileMetadataRecord metadata,
            boolean success) {
        return new IngestionHistoryEntry(sessionId, timestamp, IngestionEvent.FILE_PROCESSED, null,
                filePath, success, metadata, null, null);
    }

    public static IngestionHistoryEntry complete(String sessionId, Instant timestamp, int processedCount,
            int failedCount) {
        return new IngestionHistoryEntry(sessionId, timestamp, IngestionEvent.COMPLETE, null,
                null, null, null, processedCount, failedCount);
    }
}
