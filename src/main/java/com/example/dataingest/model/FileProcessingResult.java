package com.example.dataingest.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record FileProcessingResult(
        String filePath,
        boolean success,
        FileMetadataRecord metadata,
        String error) {

    public static FileProcessingResult extracted(FileMetadataRecord metadata) {
        return new FileProcessingResult(metadata.filePath(), metadata.isSuccessful(), metadata, null);
    }

    public static FileProcessingResult failed(String filePath, String error) {
        return new FileProcessingResult(filePath, false, null, error);
    }
}
