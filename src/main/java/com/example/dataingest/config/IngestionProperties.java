package com.example.dataingest.config;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Externalized ingestion settings bound from {@code application.yml} and {@code --ingestion.*} arguments.
 */
@Getter
@Setter
@ToString
@ConfigurationProperties(prefix = "ingestion")
public class IngestionProperties {

    private List<String> watchDirectories = new ArrayList<>(List.of("./data/incoming"));
    /**
     * Where {@code /upload} writes payloads; defaults to the first watch directory.
     */
    private String uploadDirectory;
    private String logDirectory = "./logs";
    private boolean recursive = true;
    private String checksumAlgorithm = "MD5";
    private int checksumChunkSize = 4096;
    private int sampleRows = 5;
    private int maxCharsPerColumn = 65536;
    private int parallelism = 1;
    private String historyFileName = "ingestion_history.json";
    private String metadataFileName = "ingestion_metadata.json";
    private Cli cli = new Cli();
    private Cors cors = new Cors();

    public List<Path> watchDirectoryPaths() {
        return watchDirectories.stream().map(Path::of).toList();
    }

    public Path uploadDirectoryPath() {
        if (uploadDirectory != null && !uploadDirectory.isBlank()) {
            return Path.of(uploadDirectory);
        }
        if (watchDirectories.isEmpty()) {
            throw new IllegalStateException("ingestion.watch-directories must name at least one directory");
        }
        return Path.of(watchDirectories.get(0));
    }

    public Path historyFile() {
        return Path.of(logDirectory).resolve(historyFileName);
    }

    public Path metadataFile() {
        return Path.of(logDirectory).resolve(metadataFileName);
    }

    @Getter
    @Setter
    @ToString
    public static class Cli {
        private boolean enabled = false;
    }

    @Getter
    @Setter
    @ToString
    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:3000"));
    }
}
