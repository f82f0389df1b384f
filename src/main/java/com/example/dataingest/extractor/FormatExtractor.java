package com.example.dataingest.extractor;

import com.example.dataingest.model.FormatDetails;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Extracts structural facts for one family of file formats.
 */
public interface FormatExtractor {

    /**
     * @param extension lowercase extension without the leading dot, e.g. {@code "csv"}
     */
    boolean supports(String extension);

    /**
     * Name of the format branch, used to scope failures (for example {@code "csv"} or {@code "excel"}).
     */
    String branch();

    /**
     * Reads the file and describes its structure.
     *
     * @param file      the file to inspect
     * @param extension lowercase extension without the leading dot
     * @return the format-specific details, never {@code null}
     * @throws IOException if the file cannot be read or parsed
     */
    FormatDetails extract(Path file, String extension) throws IOException;
}
