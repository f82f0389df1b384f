package com.example.dataingest.service;

import com.example.dataingest.config.IngestionProperties;
import com.example.dataingest.model.IngestionRunSummary;
import com.example.dataingest.model.UploadResponse;
import com.example.dataingest.model.UploadedFile;
import com.example.dataingest.support.FileProcessingException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

/**
 * Writes uploaded payloads verbatim into the upload directory and triggers a non-recursive ingestion run.
 */
@Slf4j
@Service
public class FileUploadService {

    private final Path uploadDirectory;
    private final IngestionPipeline ingestionPipeline;

    public FileUploadService(IngestionProperties properties, IngestionPipeline ingestionPipeline) {
        this.uploadDirectory = watchedUploadDirectory(properties);
        this.ingestionPipeline = ingestionPipeline;
        log.info("Uploads are written to {}", uploadDirectory);
    }

    /**
     * Uploads must land where the following run looks, so the upload directory has to be one of the watch
     * directories.
     */
    static Path watchedUploadDirectory(IngestionProperties properties) {
        Path uploadDirectory = properties.uploadDirectoryPath().toAbsolutePath().normalize();
        boolean watched = properties.watchDirectoryPaths().stream()
                .map(directory -> directory.toAbsolutePath().normalize())
                .anyMatch(uploadDirectory::equals);
        if (!watched) {
            throw new IllegalStateException("ingestion.upload-directory %s is not one of ingestion.watch-directories %s"
                    .formatted(uploadDirectory, properties.getWatchDirectories()));
        }
        return uploadDirectory;
    }

    public UploadResponse uploadAndIngest(MultipartFile[] files) {
        List<UploadedFile> uploaded = storeFiles(normalizeFiles(files));
        IngestionRunSummary summary = ingestionPipeline.run(false);
        log.info("Uploaded {} files, ingestion session {} processed={} failed={}",
                uploaded.size(), summary.sessionId(), summary.processedCount(), summary.failedCount());
        return UploadResponse.from(uploaded, summary);
    }

    private List<MultipartFile> normalizeFiles(MultipartFile[] files) {
        if (files == null || files.length == 0) {
            return List.of();
        }
        return Arrays.stream(files)
                .filter(this::hasFilename)
                .toList();
    }

    private boolean hasFilename(MultipartFile file) {
        if (file == null) {
            log.warn("Skipping null file entry provided for upload");
            return false;
        }
        if (resolveFilename(file.getOriginalFilename()) == null) {
            log.warn("Skipping upload entry without a usable file name: {}", file.getOriginalFilename());
            return false;
        }
        return true;
    }

    private List<UploadedFile> storeFiles(List<MultipartFile> files) {
        List<UploadedFile> uploaded = new ArrayList<>(files.size());
        try {
            Files.createDirectories(uploadDirectory);
            for (MultipartFile file : files) {
                String filename = resolveFilename(file.getOriginalFilename());
                Path target = uploadDirectory.resolve(filename);
                long size;
                try (InputStream in = file.getInputStream()) {
                    size = Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
                }
                log.debug("Stored upload {} ({} bytes) at {}", filename, size, target);
                uploaded.add(new UploadedFile(filename, size, target.toString()));
            }
        } catch (IOException ex) {
            throw new FileProcessingException("Upload failed", ex);
        }
        return uploaded;
    }

    /**
     * Keeps only the last path segment of the client-supplied name; returns {@code null} when nothing usable is left.
     */
    static String resolveFilename(String originalFilename) {
        if (originalFilename == null) {
            return null;
        }
        String cleaned = StringUtils.getFilename(StringUtils.cleanPath(originalFilename.trim().replace('\\', '/')));
        if (cleaned == null || cleaned.isBlank() || ".".equals(cleaned) || "..".equals(cleaned)) {
            return null;
        }
        return cleaned;
    }
}
