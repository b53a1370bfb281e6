package com.example.spacefinder.scan;

import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.Locale;

/**
 * Metadata of a single file discovered during a scan.
 */
public record FileRecord(
        String path,
        String name,
        long size,
        Instant lastAccessed,
        Instant lastModified,
        String extension
) {
    public FileRecord {
        if (size < 0) {
            throw new IllegalArgumentException("size must not be negative: " + size);
        }
        extension = extension == null ? "" : extension;
    }

    /**
     * Creates a record, deriving the extension from the file name.
     */
    public static FileRecord of(String path, String name, long size, Instant lastAccessed, Instant lastModified) {
        return new FileRecord(path, name, size, lastAccessed, lastModified, extensionOf(name));
    }

    static FileRecord of(Path path, BasicFileAttributes attributes) {
        return of(
                path.toAbsolutePath().toString(),
                path.getFileName().toString(),
                attributes.size(),
                attributes.lastAccessTime().toInstant(),
                attributes.lastModifiedTime().toInstant()
        );
    }

    /**
     * Lower-cased suffix including the leading dot, or an empty string.
     * Dot-files such as {@code .bashrc} and names ending in a dot have no extension.
     */
    public static String extensionOf(String name) {
        if (name == null) {
            return "";
        }
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return "";
        }
        return name.substring(dot).toLowerCase(Locale.ROOT);
    }
}
