package com.example.dataingest.model;

public record MetadataResponse(boolean success, Object metadata) {

    public static MetadataResponse of(Object metadata) {
        return new MetadataResponse(true, metadata);
    }
}
