package com.example.dataingest.service;

import com.example.dataingest.config.IngestionProperties;
import java.io.IOException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Finds files with a supported extension under the watched directories. Read-only.
 */
@Slf4j
@Service
public class FileDetector {

    public static final Set<String> SUPPORTED_EXTENSIONS = Set.of("csv", "xlsx", "xls", "json", "parquet", "txt", "tsv");

    private final List<Path> watchDirectories;

    @Autowired
    public FileDetector(IngestionProperties properties) {
        this(properties.watchDirectoryPaths());
    }

    public FileDetector(List<Path> watchDirectories) {
        this.watchDirectories = List.copyOf(watchDirectories);
    }

    public List<Path> detect(boolean recursive) {
        return detect(watchDirectories, recursive);
    }

    /**
     * Returns absolute, normalised paths without duplicates, sorted within each directory.
     * Missing or non-directory entries are skipped with a warning. Symbolic links are followed, and a link cycle
     * is reported and skipped like any other unreadable entry.
     */
    public List<Path> detect(List<Path> directories, boolean recursive) {
        Set<Path> detected = new LinkedHashSet<>();
        for (Path directory : directories) {
            if (!Files.exists(directory)) {
                log.warn("Directory does not exist: {}", directory);
                continue;
            }
            if (!Files.isDirectory(directory)) {
                log.warn("Path is not a directory: {}", directory);
                continue;
            }
            detected.addAll(scan(directory, recursive));
        }
        log.info("Detected {} files in {} directories (recursive={})", detected.size(), directories.size(), recursive);
        return List.copyOf(detected);
    }

    public static String extensionOf(Path file) {
        Path name = file.getFileName();
        if (name == null) {
            return "";
        }
        String fileName = name.toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
    }

    public static boolean isSupported(Path file) {
        return SUPPORTED_EXTENSIONS.contains(extensionOf(file));
    }

    private List<Path> scan(Path directory, boolean recursive) {
        List<Path> found = new ArrayList<>();
        int maxDepth = recursive ? Integer.MAX_VALUE : 1;
        try {
            Files.walkFileTree(directory, EnumSet.of(FileVisitOption.FOLLOW_LINKS), maxDepth, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (Files.isRegularFile(file) && isSupported(file)) {
                        found.add(file.toAbsolutePath().normalize());
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    log.warn("Skipping unreadable path {}: {}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException ex) {
            log.warn("Failed to scan directory {}: {}", directory, ex.getMessage());
        }
        found.sort(null);
        return found;
    }
}
