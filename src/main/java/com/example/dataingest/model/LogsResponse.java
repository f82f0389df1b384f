package com.example.dataingest.model;

import java.util.List;

public record LogsResponse(boolean success, List<IngestionHistoryEntry> logs) {

    public static LogsResponse of(List<IngestionHistoryEntry> logs) {
        return new LogsResponse(true, logs);
    }
}
