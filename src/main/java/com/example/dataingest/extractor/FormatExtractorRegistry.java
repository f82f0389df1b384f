package com.example.dataingest.extractor;

import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Picks the first {@link FormatExtractor} that supports an extension. Extensions without one
 * (such as {@code txt}) get filesystem facts only.
 */
@Slf4j
@Service
public class FormatExtractorRegistry {

    private final List<FormatExtractor> extractors;

    public FormatExtractorRegistry(List<FormatExtractor> extractors) {
        this.extractors = List.copyOf(extractors);
        log.info("FormatExtractorRegistry initialized with {} extractors", extractors.size());
    }

    public Optional<FormatExtractor> find(String extension) {
        Optional<FormatExtractor> extractor = extractors.stream()
                .filter(candidate -> candidate.supports(extension))
                .findFirst();
        log.debug("Extractor for extension '{}': {}", extension,
                extractor.map(found -> found.getClass().getSimpleName()).orElse("none"));
        return extractor;
    }
}
