package com.example.dataingest.model;

import java.util.List;

public record UploadResponse(
        boolean success,
        String message,
        List<UploadedFile> uploadedFiles,
        IngestionRunSummary ingestionResults) {

    public static UploadResponse from(List<UploadedFile> uploadedFiles, IngestionRunSummary summary) {
        return new UploadResponse(true,
                "Successfully uploaded %d files".formatted(uploadedFiles.size()),
                uploadedFiles,
                summary);
    }
}
