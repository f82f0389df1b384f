package com.example.dataingest.support;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.springframework.stereotype.Component;

/**
 * Detects gzip payloads by their magic bytes, so a compressed {@code .csv} reads like a plain one.
 * The extension is never consulted.
 */
@Slf4j
@Component
public class CompressionSupport {

    private static final int SIGNATURE_LENGTH = 2;
    private static final int BUFFER_SIZE = 64 * 1024;

    /**
     * Opens the file for reading its logical content. The caller closes the returned stream.
     */
    public InputStream openDecoded(Path file) throws IOException {
        InputStream raw = Files.newInputStream(file);
        try {
            return decodeIfNecessary(raw, file.getFileName().toString());
        } catch (IOException | RuntimeException ex) {
            raw.close();
            throw ex;
        }
    }

    InputStream decodeIfNecessary(InputStream original, String filename) throws IOException {
        BufferedInputStream buffered = new BufferedInputStream(original, BUFFER_SIZE);
        if (isGzipStream(buffered)) {
            log.debug("Reading gzip-compressed content of {}", filename);
            return new GzipCompressorInputStream(buffered, true);
        }
        return buffered;
    }

    private static boolean isGzipStream(BufferedInputStream stream) throws IOException {
        stream.mark(SIGNATURE_LENGTH);
        byte[] signature = stream.readNBytes(SIGNATURE_LENGTH);
        stream.reset();
        return GzipCompressorInputStream.matches(signature, signature.length);
    }
}
