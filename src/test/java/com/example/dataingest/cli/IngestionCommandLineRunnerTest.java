package com.example.dataingest.cli;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.dataingest.model.IngestionRunSummary;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;

class IngestionCommandLineRunnerTest {

    @Test
    void shouldPrintCountsForCompletedRun() {
        IngestionRunSummary summary = new IngestionRunSummary("ingestion_20261017_090503", 3, 2, 1, List.of(), null);

        String output = print(summary);

        assertTrue(output.contains("INGESTION SUMMARY"));
        assertTrue(output.contains("Session ID: ingestion_20261017_090503"));
        assertTrue(output.contains("Total Files: 3"));
        assertTrue(output.contains("Successfully Processed: 2"));
        assertTrue(output.contains("Failed: 1"));
        assertFalse(output.contains("Error:"));
    }

    @Test
    void shouldPrintErrorForAbortedRun() {
        String output = print(IngestionRunSummary.failed("ingestion_x", "IllegalStateException: scan exploded"));

        assertTrue(output.contains("Total Files: 0"));
        assertTrue(output.contains("Error: IllegalStateException: scan exploded"));
    }

    private static String print(IngestionRunSummary summary) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        IngestionCommandLineRunner.printSummary(summary, new PrintStream(buffer, true, StandardCharsets.UTF_8));
        return buffer.toString(StandardCharsets.UTF_8);
    }
}
