package com.example.dataingest.extractor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.dataingest.model.TabularDetails;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.example.data.simple.SimpleGroupFactory;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.example.ExampleParquetWriter;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.MessageTypeParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ParquetFormatExtractorTest {

    private static final MessageType SCHEMA = MessageTypeParser.parseMessageType(
            "message trade { required int64 id; required binary symbol (UTF8); optional double price; }");

    @TempDir
    Path tempDir;

    private final ParquetFormatExtractor extractor = new ParquetFormatExtractor();

    @Test
    void shouldReadRowCountAndSchemaFromFooter() throws IOException {
        Path file = tempDir.resolve("trades.parquet");
        SimpleGroupFactory groups = new SimpleGroupFactory(SCHEMA);
        try (ParquetWriter<Group> writer = ExampleParquetWriter.builder(new LocalParquetOutputFile(file))
                .withType(SCHEMA)
                .build()) {
            for (int i = 0; i < 4; i++) {
                writer.write(groups.newGroup()
                        .append("id", (long) i)
                        .append("symbol", "S" + i)
                        .append("price", i * 1.5));
            }
        }

        TabularDetails details = assertInstanceOf(TabularDetails.class, extractor.extract(file, "parquet"));

        assertEquals(4, details.rowCount());
        assertEquals(3, details.columnCount());
        assertEquals(List.of("id", "symbol", "price"), details.columnNames());
        assertEquals("int64", details.columnTypes().get("id"));
        assertTrue(details.columnTypes().get("symbol").startsWith("binary"));
        assertEquals("double", details.columnTypes().get("price"));
    }

    @Test
    void shouldSumRowCountsAcrossRowGroups() throws IOException {
        Path file = tempDir.resolve("groups.parquet");
        SimpleGroupFactory groups = new SimpleGroupFactory(SCHEMA);
        try (ParquetWriter<Group> writer = ExampleParquetWriter.builder(new LocalParquetOutputFile(file))
                .withType(SCHEMA)
                .withRowGroupSize(1024)
                .withPageSize(512)
                .build()) {
            for (int i = 0; i < 2000; i++) {
                writer.write(groups.newGroup()
                        .append("id", (long) i)
                        .append("symbol", "SYMBOL-" + i)
                        .append("price", i * 0.5));
            }
        }

        TabularDetails details = (TabularDetails) extractor.extract(file, "parquet");

        assertEquals(2000, details.rowCount());
    }

    @Test
    void shouldFailOnNonParquetContent() throws IOException {
        Path file = Files.writeString(tempDir.resolve("fake.parquet"), "not a parquet file at all");

        assertThrows(Exception.class, () -> extractor.extract(file, "parquet"));
    }
}
