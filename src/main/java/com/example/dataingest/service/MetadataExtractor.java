package com.example.dataingest.service;

import com.example.dataingest.extractor.FormatExtractor;
import com.example.dataingest.extractor.FormatExtractorRegistry;
import com.example.dataingest.model.FileMetadataRecord;
import com.example.dataingest.model.FormatDetails;
import com.example.dataingest.model.FormatError;
import com.example.dataingest.support.ChecksumCalculator;
import com.example.dataingest.support.FileProcessingException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Builds a {@link FileMetadataRecord} for one file. Never throws: a failure of the filesystem facts or the
 * checksum produces a failure record, a failure inside a format branch only sets {@code formatError}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MetadataExtractor {

    private final ChecksumCalculator checksumCalculator;
    private final FormatExtractorRegistry formatExtractorRegistry;

    public FileMetadataRecord extract(Path file) {
        Path absolute = file.toAbsolutePath().normalize();
        String filePath = absolute.toString();
        try {
            BasicFileAttributes attributes = Files.readAttributes(absolute, BasicFileAttributes.class);
            if (!attributes.isRegularFile()) {
                throw new FileProcessingException("Not a regular file: %s".formatted(filePath));
            }
            String extension = FileDetector.extensionOf(absolute);
            String checksum = checksumCalculator.checksum(absolute);

            FormatDetails details = null;
            FormatError formatError = null;
            Optional<FormatExtractor> extractor = formatExtractorRegistry.find(extension);
            if (extractor.isPresent()) {
                try {
                    details = extractor.get().extract(absolute, extension);
                } catch (IOException | RuntimeException ex) {
                    log.error("Failed to extract {} metadata from {}: {}", extractor.get().branch(), filePath,
                            FileProcessingException.describe(ex));
                    formatError = new FormatError(extractor.get().branch(), FileProcessingException.describe(ex));
                }
            }

            FileMetadataRecord record = FileMetadataRecord.success(
                    filePath,
                    absolute.getFileName().toString(),
                    attributes.size(),
                    extension.isEmpty() ? "" : "." + extension,
                    attributes.creationTime().toInstant(),
                    attributes.lastModifiedTime().toInstant(),
                    checksum,
                    Instant.now(),
                    details,
                    formatError);
            log.info("Extracted metadata for: {}", record.fileName());
            return record;
        } catch (IOException | RuntimeException ex) {
            log.error("Failed to extract metadata from {}: {}", filePath, FileProcessingException.describe(ex), ex);
            return FileMetadataRecord.failure(filePath, FileProcessingException.describe(ex), Instant.now());
        }
    }
}
