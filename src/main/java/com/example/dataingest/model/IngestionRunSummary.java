package com.example.dataingest.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Outcome of one ingestion run, returned to the caller and never persisted.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IngestionRunSummary(
        String sessionId,
        int totalFiles,
        int processedCount,
        int failedCount,
        List<FileProcessingResult> results,
        String error) {

    public static IngestionRunSummary completed(String sessionId, List<FileProcessingResult> results) {
        int processed = (int) results.stream().filter(FileProcessingResult::success).count();
        return new IngestionRunSummary(sessionId, results.size(), processed, results.size() - processed,
                List.copyOf(results), null);
    }

    public static IngestionRunSummary failed(String sessionId, String error) {
        return new IngestionRunSummary(sessionId, 0, 0, 0, List.of(), error);
    }
}
