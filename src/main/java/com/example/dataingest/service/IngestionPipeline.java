package com.example.dataingest.service;

import com.example.dataingest.config.IngestionProperties;
import com.example.dataingest.model.FileMetadataRecord;
import com.example.dataingest.model.FileProcessingResult;
import com.example.dataingest.model.IngestionRunSummary;
import com.example.dataingest.support.FileProcessingException;
import com.example.dataingest.support.SessionIdGenerator;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Runs one ingestion session at a time: detect, extract each file in isolation, record every outcome, then
 * record completion. With parallelism above one, extraction runs on the ingestion executor while outcomes are still
 * recorded by the calling thread in detection order.
 */
@Slf4j
@Service
public class IngestionPipeline {

    private final FileDetector fileDetector;
    private final MetadataExtractor metadataExtractor;
    private final IngestionLogStore logStore;
    private final SessionIdGenerator sessionIdGenerator;
    private final ExecutorService executor;
    private final int parallelism;
    private final ReentrantLock runLock = new ReentrantLock();

    @Autowired
    public IngestionPipeline(FileDetector fileDetector,
            MetadataExtractor metadataExtractor,
            IngestionLogStore logStore,
            SessionIdGenerator sessionIdGenerator,
            ExecutorService ingestionExecutor,
            IngestionProperties properties) {
        this(fileDetector, metadataExtractor, logStore, sessionIdGenerator, ingestionExecutor,
                properties.getParallelism());
    }

    public IngestionPipeline(FileDetector fileDetector,
            MetadataExtractor metadataExtractor,
            IngestionLogStore logStore,
            SessionIdGenerator sessionIdGenerator,
            ExecutorService executor,
            int parallelism) {
        this.fileDetector = fileDetector;
        this.metadataExtractor = metadataExtractor;
        this.logStore = logStore;
        this.sessionIdGenerator = sessionIdGenerator;
        this.executor = executor;
        this.parallelism = executor == null ? 1 : Math.max(1, parallelism);
    }

    /**
     * Runs one session. Concurrent callers wait for the running session to finish, so each session's history
     * entries stay contiguous.
     */
    public IngestionRunSummary run(boolean recursive) {
        if (runLock.isLocked()) {
            log.info("Ingestion session already running, waiting for it to finish");
        }
        runLock.lock();
        try {
            return runSession(recursive);
        } finally {
            runLock.unlock();
        }
    }

    private IngestionRunSummary runSession(boolean recursive) {
        String sessionId = sessionIdGenerator.nextSessionId();
        Instant start = Instant.now();
        try {
            List<Path> detectedFiles = fileDetector.detect(recursive);
            logStore.recordStart(sessionId, detectedFiles.size());

            List<FileProcessingResult> results = processFiles(sessionId, detectedFiles);
            IngestionRunSummary summary = IngestionRunSummary.completed(sessionId, results);

            logStore.recordComplete(sessionId, summary.processedCount(), summary.failedCount());
            log.info("Ingestion session {} finished total={} processed={} failed={} durationMs={}",
                    sessionId, summary.totalFiles(), summary.processedCount(), summary.failedCount(),
                    Duration.between(start, Instant.now()).toMillis());
            return summary;
        } catch (RuntimeException ex) {
            log.error("Critical error in ingestion session {}: {}", sessionId, ex.getMessage(), ex);
            return IngestionRunSummary.failed(sessionId, FileProcessingException.describe(ex));
        }
    }

    private List<FileProcessingResult> processFiles(String sessionId, List<Path> files) {
        List<Supplier<FileMetadataRecord>> extractions = scheduleExtractions(files);
        List<FileProcessingResult> results = new ArrayList<>(files.size());
        for (int i = 0; i < files.size(); i++) {
            results.add(processFile(sessionId, files.get(i), extractions.get(i)));
        }
        return results;
    }

    private FileProcessingResult processFile(String sessionId, Path file, Supplier<FileMetadataRecord> extraction) {
        FileMetadataRecord metadata;
        try {
            metadata = extraction.get();
        } catch (RuntimeException ex) {
            String error = "Unexpected error processing %s: %s".formatted(file, FileProcessingException.describe(ex));
            log.error(error, ex);
            logStore.recordFileOutcome(sessionId, file.toString(),
                    FileMetadataRecord.failure(file.toString(), error, Instant.now()), false);
            return FileProcessingResult.failed(file.toString(), error);
        }

        try {
            logStore.recordFileOutcome(sessionId, metadata.filePath(), metadata, metadata.isSuccessful());
            return FileProcessingResult.extracted(metadata);
        } catch (RuntimeException ex) {
            String error = "Unexpected error processing %s: %s".formatted(file, FileProcessingException.describe(ex));
            log.error(error, ex);
            return FileProcessingResult.failed(file.toString(), error);
        }
    }

    private List<Supplier<FileMetadataRecord>> scheduleExtractions(List<Path> files) {
        List<Supplier<FileMetadataRecord>> extractions = new ArrayList<>(files.size());
        if (parallelism <= 1 || files.size() <= 1) {
            for (Path file : files) {
                extractions.add(() -> metadataExtractor.extract(file));
            }
            return extractions;
        }

        log.debug("Extracting {} files with parallelism={}", files.size(), parallelism);
        for (Path file : files) {
            Future<FileMetadataRecord> future = executor.submit(() -> metadataExtractor.extract(file));
            extractions.add(() -> await(file, future));
        }
        return extractions;
    }

    private static FileMetadataRecord await(Path file, Future<FileMetadataRecord> future) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new FileProcessingException("Interrupted while extracting %s".formatted(file), ex);
        } catch (ExecutionException ex) {
            throw new FileProcessingException("Extraction failed for %s".formatted(file), ex.getCause());
        }
    }
}
