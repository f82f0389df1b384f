package com.example.dataingest.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.dataingest.TestComponents;
import com.example.dataingest.model.FileMetadataRecord;
import com.example.dataingest.model.FormatError;
import com.example.dataingest.model.IngestionEvent;
import com.example.dataingest.model.IngestionHistoryEntry;
import com.example.dataingest.model.TabularDetails;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class IngestionLogStoreTest {

    @TempDir
    Path tempDir;

    private Path historyFile;
    private Path metadataFile;
    private IngestionLogStore store;

    @BeforeEach
    void setUp() {
        historyFile = tempDir.resolve("logs/ingestion_history.json");
        metadataFile = tempDir.resolve("logs/ingestion_metadata.json");
        store = new IngestionLogStore(TestComponents.objectMapper(), historyFile, metadataFile);
    }

    @Test
    void shouldReturnEmptyViewsBeforeAnythingIsRecorded() {
        assertTrue(store.getHistory(100).isEmpty());
        assertTrue(store.getAllMetadata().isEmpty());
        assertTrue(store.getMetadata("/any/path.csv").isEmpty());
    }

    @Test
    void shouldTreatEmptyStoreFilesAsEmpty() throws IOException {
        Files.createDirectories(historyFile.getParent());
        Files.createFile(historyFile);
        Files.createFile(metadataFile);

        assertTrue(store.getHistory(0).isEmpty());
        assertTrue(store.getAllMetadata().isEmpty());
    }

    @Test
    void shouldAppendEventsInOrderAndHonourLimit() {
        FileMetadataRecord record = record("/data/a.csv", "c1");

        store.recordStart("s1", 1);
        store.recordFileOutcome("s1", record.filePath(), record, true);
        store.recordComplete("s1", 1, 0);

        List<IngestionHistoryEntry> history = store.getHistory(100);
        assertEquals(3, history.size());
        assertEquals(IngestionEvent.START, history.get(0).event());
        assertEquals(1, history.get(0).filesDetected());
        assertEquals(IngestionEvent.FILE_PROCESSED, history.get(1).event());
        assertEquals("/data/a.csv", history.get(1).filePath());
        assertTrue(history.get(1).success());
        assertEquals(IngestionEvent.COMPLETE, history.get(2).event());
        assertEquals(1, history.get(2).processedCount());
        assertEquals(0, history.get(2).failedCount());

        List<IngestionHistoryEntry> lastTwo = store.getHistory(2);
        assertEquals(List.of(IngestionEvent.FILE_PROCESSED, IngestionEvent.COMPLETE),
                lastTwo.stream().map(IngestionHistoryEntry::event).toList());
        assertEquals(3, store.getHistory(0).size());
    }

    @Test
    void shouldRoundTripMetadataThroughTheTable() {
        FileMetadataRecord record = record("/data/a.csv", "c1");

        store.recordFileOutcome("s1", record.filePath(), record, true);

        FileMetadataRecord stored = store.getMetadata("/data/a.csv").orElseThrow();
        assertEquals("a.csv", stored.fileName());
        assertEquals("c1", stored.checksum());
        assertEquals(record.createdTime(), stored.createdTime());
        TabularDetails details = assertInstanceOf(TabularDetails.class, stored.formatDetails());
        assertEquals(List.of("id", "name"), details.columnNames());
        assertEquals("integer", details.columnTypes().get("id"));
        assertNull(stored.error());
    }

    @Test
    void shouldReplaceMetadataForTheSamePath() {
        store.recordFileOutcome("s1", "/data/a.csv", record("/data/a.csv", "old"), true);
        store.recordFileOutcome("s1", "/data/b.csv", record("/data/b.csv", "other"), true);
        store.recordFileOutcome("s2", "/data/a.csv", record("/data/a.csv", "new"), true);

        Map<String, FileMetadataRecord> table = store.getAllMetadata();
        assertEquals(2, table.size());
        assertEquals("new", table.get("/data/a.csv").checksum());
        assertEquals(List.of("/data/a.csv", "/data/b.csv"), List.copyOf(table.keySet()));
    }

    @Test
    void shouldNotStoreFailedOutcomes() {
        FileMetadataRecord failure = FileMetadataRecord.failure("/data/bad.csv", "Permission denied", Instant.now());

        store.recordFileOutcome("s1", "/data/bad.csv", failure, false);

        assertTrue(store.getAllMetadata().isEmpty());
        IngestionHistoryEntry entry = store.getHistory(1).get(0);
        assertFalse(entry.success());
        assertEquals("Permission denied", entry.metadata().error());
    }

    @Test
    void shouldStoreRecordsCarryingOnlyAFormatError() {
        FileMetadataRecord partial = FileMetadataRecord.success("/data/x.parquet", "x.parquet", 4L, ".parquet",
                Instant.EPOCH, Instant.EPOCH, "c", Instant.now(), null, new FormatError("parquet", "bad footer"));

        store.recordFileOutcome("s1", partial.filePath(), partial, true);

        FileMetadataRecord stored = store.getMetadata("/data/x.parquet").orElseThrow();
        assertEquals("parquet", stored.formatError().branch());
        assertNull(stored.formatDetails());
    }

    @Test
    void shouldLeaveCorruptHistoryUntouched() throws IOException {
        Files.createDirectories(historyFile.getParent());
        Files.writeString(historyFile, "{ not json");

        store.recordStart("s1", 0);

        assertTrue(store.getHistory(10).isEmpty());
        assertEquals("{ not json", Files.readString(historyFile));
    }

    private static FileMetadataRecord record(String path, String checksum) {
        return FileMetadataRecord.success(path, Path.of(path).getFileName().toString(), 10L, ".csv",
                Instant.parse("2026-01-01T00:00:00Z"), Instant.parse("2026-01-02T00:00:00Z"), checksum,
                Instant.now(), new TabularDetails(2, 2, List.of("id", "name"), Map.of("id", "integer",
                        "name", "string")), null);
    }
}
