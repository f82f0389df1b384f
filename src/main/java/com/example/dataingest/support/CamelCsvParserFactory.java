package com.example.dataingest.support;

import com.example.dataingest.config.IngestionProperties;
import com.univocity.parsers.csv.CsvParser;
import com.univocity.parsers.csv.CsvParserSettings;
import lombok.extern.slf4j.Slf4j;
import org.apache.camel.dataformat.univocity.UniVocityCsvDataFormat;
import org.springframework.stereotype.Component;

/**
 * Builds univocity parsers for delimited files from the Camel data format defaults.
 * Each call returns a fresh parser since parsers hold per-file state.
 */
@Slf4j
@Component
public class CamelCsvParserFactory extends UniVocityCsvDataFormat {

    private final int maxCharsPerColumn;

    public CamelCsvParserFactory(IngestionProperties properties) {
        this.maxCharsPerColumn = Math.max(256, properties.getMaxCharsPerColumn());
        setHeaderExtractionEnabled(false);
        setSkipEmptyLines(true);
        setIgnoreLeadingWhitespaces(true);
        setIgnoreTrailingWhitespaces(true);
        setLazyLoad(true);
        setAsMap(false);
    }

    public CsvParser newParser(char delimiter) {
        CsvParserSettings settings = createParserSettings();
        configureParserSettings(settings);
        settings.setColumnReorderingEnabled(false);
        settings.setMaxCharsPerColumn(maxCharsPerColumn);
        settings.setIgnoreLeadingWhitespaces(true);
        settings.setIgnoreTrailingWhitespaces(true);
        settings.setLineSeparatorDetectionEnabled(true);
        settings.getFormat().setDelimiter(delimiter);
        log.debug("Created CsvParser with delimiter={} maxCharsPerColumn={} lazyLoad={}",
            delimiter == '\t' ? "TAB" : String.valueOf(delimiter), settings.getMaxCharsPerColumn(), isLazyLoad());
        return createParser(settings);
    }
}
