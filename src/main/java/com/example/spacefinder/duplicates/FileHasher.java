package com.example.spacefinder.duplicates;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Optional;

/**
 * MD5 digests over a file prefix or the whole file. MD5 only narrows candidates here; equal
 * full digests are what makes two files duplicates.
 */
public class FileHasher {
    private static final Logger LOGGER = LoggerFactory.getLogger(FileHasher.class);

    public static final int PARTIAL_HASH_BYTES = 4096;
    private static final int BUFFER_SIZE = 8192;

    /**
     * Digest of the first {@value #PARTIAL_HASH_BYTES} bytes, or empty when the file can't be read.
     */
    public Optional<String> partialHash(Path path) {
        MessageDigest digest = newDigest();
        try (InputStream inputStream = Files.newInputStream(path)) {
            digest.update(inputStream.readNBytes(PARTIAL_HASH_BYTES));
        } catch (IOException | SecurityException ex) {
            LOGGER.debug("Failed to read {} for partial hash", path, ex);
            return Optional.empty();
        }
        return Optional.of(HexFormat.of().formatHex(digest.digest()));
    }

    /**
     * Digest of the entire content, or empty when the file can't be read.
     */
    public Optional<String> fullHash(Path path) {
        MessageDigest digest = newDigest();
        try (InputStream inputStream = Files.newInputStream(path)) {
            byte[] buffer = new byte[BUFFER_SIZE];
            int read;
            while ((read = inputStream.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        } catch (IOException | SecurityException ex) {
            LOGGER.debug("Failed to read {} for full hash", path, ex);
            return Optional.empty();
        }
        return Optional.of(HexFormat.of().formatHex(digest.digest()));
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
