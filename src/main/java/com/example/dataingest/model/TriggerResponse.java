package com.example.dataingest.model;

public record TriggerResponse(boolean success, IngestionRunSummary results) {

    public static TriggerResponse of(IngestionRunSummary results) {
        return new TriggerResponse(true, results);
    }
}
