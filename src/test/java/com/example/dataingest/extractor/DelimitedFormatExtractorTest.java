package com.example.dataingest.extractor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.dataingest.TestComponents;
import com.example.dataingest.config.IngestionProperties;
import com.example.dataingest.model.TabularDetails;
import com.example.dataingest.support.FileProcessingException;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.zip.GZIPOutputStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DelimitedFormatExtractorTest {

    @TempDir
    Path tempDir;

    private DelimitedFormatExtractor extractor;

    @BeforeEach
    void setUp() {
        IngestionProperties properties = new IngestionProperties();
        properties.setSampleRows(2);
        extractor = TestComponents.delimitedExtractor(properties);
    }

    @Test
    void shouldSupportCsvAndTsvOnly() {
        assertTrue(extractor.supports("csv"));
        assertTrue(extractor.supports("tsv"));
        assertEquals(false, extractor.supports("txt"));
    }

    @Test
    void shouldDescribeCsvColumnsAndCountAllRows() throws IOException {
        Path file = Files.writeString(tempDir.resolve("a.csv"), "id,name\n1,alpha\n2,beta\n3,gamma\n");

        TabularDetails details = assertInstanceOf(TabularDetails.class, extractor.extract(file, "csv"));

        assertEquals(3, details.rowCount());
        assertEquals(2, details.columnCount());
        assertEquals(List.of("id", "name"), details.columnNames());
        assertEquals("integer", details.columnTypes().get("id"));
        assertEquals("string", details.columnTypes().get("name"));
    }

    @Test
    void shouldCountRowsBeyondTheSample() throws IOException {
        StringBuilder content = new StringBuilder("id,amount\n");
        for (int i = 0; i < 250; i++) {
            content.append(i).append(',').append(i).append(".5\n");
        }
        Path file = Files.writeString(tempDir.resolve("big.csv"), content);

        TabularDetails details = (TabularDetails) extractor.extract(file, "csv");

        assertEquals(250, details.rowCount());
        assertEquals("decimal", details.columnTypes().get("amount"));
    }

    @Test
    void shouldCountLastLineWithoutTrailingNewline() throws IOException {
        Path file = Files.writeString(tempDir.resolve("crlf.csv"), "a,b\r\n1,2\r\n3,4");

        TabularDetails details = (TabularDetails) extractor.extract(file, "csv");

        assertEquals(2, details.rowCount());
        assertEquals(List.of("a", "b"), details.columnNames());
    }

    @Test
    void shouldIgnoreBlankLines() throws IOException {
        Path file = Files.writeString(tempDir.resolve("gaps.csv"), "\nid\n1\n\n2\n\n");

        TabularDetails details = (TabularDetails) extractor.extract(file, "csv");

        assertEquals(2, details.rowCount());
        assertEquals(List.of("id"), details.columnNames());
    }

    @Test
    void shouldSplitTsvOnTabs() throws IOException {
        Path file = Files.writeString(tempDir.resolve("t.tsv"), "city\tpopulation\tcapital\nOslo\t700000\ttrue\n");

        TabularDetails details = (TabularDetails) extractor.extract(file, "tsv");

        assertEquals(1, details.rowCount());
        assertEquals(List.of("city", "population", "capital"), details.columnNames());
        assertEquals("boolean", details.columnTypes().get("capital"));
    }

    @Test
    void shouldNameBlankAndDuplicateHeaders() throws IOException {
        Path file = Files.writeString(tempDir.resolve("dups.csv"), "id,,id\n1,2,3\n");

        TabularDetails details = (TabularDetails) extractor.extract(file, "csv");

        assertEquals(List.of("id", "Unnamed: 1", "id.1"), details.columnNames());
        assertEquals(3, details.columnTypes().size());
    }

    @Test
    void shouldReadGzipCompressedContent() throws IOException {
        Path file = tempDir.resolve("packed.csv");
        try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(file))) {
            out.write("x,y\n1,2\n3,4\n".getBytes(StandardCharsets.UTF_8));
        }

        TabularDetails details = (TabularDetails) extractor.extract(file, "csv");

        assertEquals(2, details.rowCount());
        assertEquals(List.of("x", "y"), details.columnNames());
    }

    @Test
    void shouldRejectEmptyFile() throws IOException {
        Path file = Files.writeString(tempDir.resolve("empty.csv"), "");

        assertThrows(FileProcessingException.class, () -> extractor.extract(file, "csv"));
    }
}
