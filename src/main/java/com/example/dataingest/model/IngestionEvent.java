package com.example.dataingest.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum IngestionEvent {
    START("start"),
    FILE_PROCESSED("file_processed"),
    COMPLETE("complete");

    private final String value;

    IngestionEvent(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
