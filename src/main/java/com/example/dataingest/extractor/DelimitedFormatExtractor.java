package com.example.dataingest.extractor;

import com.example.dataingest.config.IngestionProperties;
import com.example.dataingest.model.FormatDetails;
import com.example.dataingest.model.TabularDetails;
import com.example.dataingest.support.CamelCsvParserFactory;
import com.example.dataingest.support.ColumnTypeInference;
import com.example.dataingest.support.CompressionSupport;
import com.example.dataingest.support.FileProcessingException;
import com.univocity.parsers.csv.CsvParser;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * CSV and TSV files. Column names and types come from the header and a short sample;
 * the row count comes from a full line scan so it is exact for any file size.
 */
@Slf4j
@Component
public class DelimitedFormatExtractor implements FormatExtractor {

    private static final Set<String> EXTENSIONS = Set.of("csv", "tsv");

    private final CamelCsvParserFactory parserFactory;
    private final CompressionSupport compressionSupport;
    private final int sampleRows;

    public DelimitedFormatExtractor(CamelCsvParserFactory parserFactory,
            CompressionSupport compressionSupport,
            IngestionProperties properties) {
        this.parserFactory = parserFactory;
        this.compressionSupport = compressionSupport;
        this.sampleRows = Math.max(1, properties.getSampleRows());
    }

    @Override
    public boolean supports(String extension) {
        return EXTENSIONS.contains(extension);
    }

    @Override
    public String branch() {
        return "csv";
    }

    @Override
    public FormatDetails extract(Path file, String extension) throws IOException {
        char delimiter = "tsv".equals(extension) ? '\t' : ',';
        Sample sample = readSample(file, delimiter);
        long rowCount = countDataRows(file);

        Map<String, String> columnTypes = new LinkedHashMap<>();
        ColumnTypeInference.inferColumnTypes(sample.columnNames(), sample.rows())
                .forEach((name, type) -> columnTypes.put(name, type.typeName()));

        log.debug("Delimited file={} rows={} columns={}", file.getFileName(), rowCount, sample.columnNames().size());
        return new TabularDetails(rowCount, sample.columnNames().size(), sample.columnNames(), columnTypes);
    }

    private Sample readSample(Path file, char delimiter) throws IOException {
        String filename = file.getFileName().toString();
        CsvParser parser = parserFactory.newParser(delimiter);
        try (InputStream decoded = compressionSupport.openDecoded(file);
                Reader reader = new InputStreamReader(decoded, StandardCharsets.UTF_8)) {
            parser.beginParsing(reader);
            try {
                String[] header = parser.parseNext();
                if (header == null || header.length == 0) {
                    throw new FileProcessingException("No columns to parse from file %s".formatted(filename));
                }
                List<String[]> rows = new ArrayList<>(sampleRows);
                String[] row;
                while (rows.size() < sampleRows && (row = parser.parseNext()) != null) {
                    rows.add(row);
                }
                return new Sample(columnNames(header), rows);
            } finally {
                parser.stopParsing();
            }
        }
    }

    /**
     * Counts non-blank lines after the header line.
     */
    long countDataRows(Path file) throws IOException {
        try (InputStream decoded = compressionSupport.openDecoded(file);
                BufferedReader reader = new BufferedReader(new InputStreamReader(decoded, StandardCharsets.UTF_8))) {
            boolean headerSkipped = false;
            long count = 0;
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                if (!headerSkipped) {
                    headerSkipped = true;
                    continue;
                }
                count++;
            }
            return count;
        }
    }

    private static List<String> columnNames(String[] header) {
        List<String> names = new ArrayList<>(header.length);
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < header.length; i++) {
            String base = header[i] == null || header[i].isBlank() ? "Unnamed: " + i : header[i].trim();
            String name = base;
            int suffix = 1;
            while (!seen.add(name)) {
                name = base + "." + suffix++;
            }
            names.add(name);
        }
        return names;
    }

    private record Sample(List<String> columnNames, List<String[]> rows) {
    }
}
