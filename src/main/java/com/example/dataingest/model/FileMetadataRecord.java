package com.example.dataingest.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;

/**
 * Metadata captured for one file in one extraction attempt. A record with {@code error} set carries
 * only the path and extraction time and is never written to the metadata table.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FileMetadataRecord(
        String filePath,
        String fileName,
        Long fileSizeBytes,
        String fileExtension,
        Instant createdTime,
        Instant modifiedTime,
        String checksum,
        Instant extractionTime,
        FormatDetails formatDetails,
        FormatError formatError,
        String error) {

    public static FileMetadataRecord success(String filePath,
            String fileName,
            long fileSizeBytes,
            String fileExtension,
            Instant createdTime,
            Instant modifiedTime,
            String checksum,
            Instant extractionTime,
            FormatDetails formatDetails,
            FormatError formatError) {
        return new FileMetadataRecord(filePath, fileName, fileSizeBytes, fileExtension, createdTime, modifiedTime,
                checksum, extractionTime, formatDetails, formatError, null);
    }

    public static FileMetadataRecord failure(String filePath, String error, Instant extractionTime) {
        return new FileMetadataRecord(filePath, null, null, null, null, null, null, extractionTime, null, null,
                error == null ? "Unknown extraction error" : error);
    }

    @JsonIgnore
    public boolean isSuccessful() {
        return error == null;
    }
}
