package com.example.dataingest.support;

import com.example.dataingest.config.IngestionProperties;
import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.binary.Hex;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Streams a file through a message digest in fixed-size chunks and returns the lowercase hex value.
 */
@Slf4j
@Component
public class ChecksumCalculator {

    private final String algorithm;
    private final int chunkSize;

    @Autowired
    public ChecksumCalculator(IngestionProperties properties) {
        this(properties.getChecksumAlgorithm(), properties.getChecksumChunkSize());
    }

    public ChecksumCalculator(String algorithm, int chunkSize) {
        if (!DigestUtils.isAvailable(algorithm)) {
            throw new IllegalArgumentException("Unsupported checksum algorithm: " + algorithm);
        }
        this.algorithm = algorithm;
        this.chunkSize = Math.max(1, chunkSize);
    }

    public String checksum(Path file) {
        MessageDigest digest = DigestUtils.getDigest(algorithm);
        byte[] buffer = new byte[chunkSize];
        try (InputStream in = new BufferedInputStream(Files.newInputStream(file), chunkSize)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        } catch (IOException ex) {
            throw new FileProcessingException("Failed to calculate %s checksum for %s".formatted(algorithm, file), ex);
        }
        String hex = Hex.encodeHexString(digest.digest());
        log.debug("Computed {} checksum for file={}: {}", algorithm, file.getFileName(), hex);
        return hex;
    }
}
