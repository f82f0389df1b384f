package com.example.dataingest.cli;

import com.example.dataingest.config.IngestionProperties;
import com.example.dataingest.model.IngestionRunSummary;
import com.example.dataingest.service.IngestionPipeline;
import java.io.PrintStream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * One-shot ingestion at startup, e.g.
 * {@code --ingestion.cli.enabled=true --spring.main.web-application-type=none
 * --ingestion.watch-directories=./in,./more --ingestion.log-directory=./logs --ingestion.recursive=false}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "ingestion.cli", name = "enabled", havingValue = "true")
public class IngestionCommandLineRunner implements CommandLineRunner {

    private static final String RULE = "=".repeat(50);

    private final IngestionPipeline ingestionPipeline;
    private final IngestionProperties properties;

    @Override
    public void run(String... args) {
        log.info("Running command-line ingestion over {} (recursive={})",
                properties.getWatchDirectories(), properties.isRecursive());
        IngestionRunSummary summary = ingestionPipeline.run(properties.isRecursive());
        printSummary(summary, System.out);
    }

    static void printSummary(IngestionRunSummary summary, PrintStream out) {
        out.println();
        out.println(RULE);
        out.println("INGESTION SUMMARY");
        out.println(RULE);
        out.println("Session ID: " + summary.sessionId());
        out.println("Total Files: " + summary.totalFiles());
        out.println("Successfully Processed: " + summary.processedCount());
        out.println("Failed: " + summary.failedCount());
        if (summary.error() != null) {
            out.println("Error: " + summary.error());
        }
        out.println(RULE);
    }
}
