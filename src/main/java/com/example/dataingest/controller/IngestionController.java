package com.example.dataingest.controller;

import com.example.dataingest.model.ErrorResponse;
import com.example.dataingest.model.HealthResponse;
import com.example.dataingest.model.IngestionRunSummary;
import com.example.dataingest.model.LogsResponse;
import com.example.dataingest.model.MetadataResponse;
import com.example.dataingest.model.TriggerResponse;
import com.example.dataingest.model.UploadResponse;
import com.example.dataingest.service.FileUploadService;
import com.example.dataingest.service.IngestionLogStore;
import com.example.dataingest.service.IngestionPipeline;
import com.example.dataingest.support.FileProcessingException;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@Slf4j
@RestController
@RequiredArgsConstructor
public class IngestionController {

    private final FileUploadService fileUploadService;
    private final IngestionPipeline ingestionPipeline;
    private final IngestionLogStore ingestionLogStore;

    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<UploadResponse> upload(@RequestParam("files") MultipartFile[] files) {
        UploadResponse response = fileUploadService.uploadAndIngest(files);
        log.info("Accepted upload fileCount={} session={}", response.uploadedFiles().size(),
            response.ingestionResults().sessionId());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/metadata")
    public ResponseEntity<MetadataResponse> metadata(@RequestParam(value = "path", required = false) String path) {
        if (path == null || path.isBlank()) {
            return ResponseEntity.ok(MetadataResponse.of(ingestionLogStore.getAllMetadata()));
        }
        return ResponseEntity.ok(MetadataResponse.of(
            ingestionLogStore.getMetadata(path).<Object>map(record -> record).orElse(Map.of())));
    }

    @GetMapping("/logs")
    public ResponseEntity<LogsResponse> logs(@RequestParam(value = "limit", defaultValue = "100") int limit) {
        return ResponseEntity.ok(LogsResponse.of(ingestionLogStore.getHistory(limit)));
    }

    @PostMapping("/trigger-ingestion")
    public ResponseEntity<TriggerResponse> triggerIngestion() {
        IngestionRunSummary summary = ingestionPipeline.run(false);
        log.info("Manual ingestion session={} total={}", summary.sessionId(), summary.totalFiles());
        return ResponseEntity.ok(TriggerResponse.of(summary));
    }

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(new HealthResponse("healthy", "Data Ingestion API is running"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleException(Exception exception) {
        log.error("Ingestion request failed: {}", exception.getMessage(), exception);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(ErrorResponse.of(FileProcessingException.describe(exception)));
    }
}
