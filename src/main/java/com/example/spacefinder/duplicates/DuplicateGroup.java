package com.example.spacefinder.duplicates;

import com.example.spacefinder.analysis.ClassifiedFile;

import java.util.List;

/**
 * Two or more files of the same size whose full-content digests match.
 */
public record DuplicateGroup(
        String hash,
        long fileSize,
        List<ClassifiedFile> files
) {
    public DuplicateGroup {
        files = List.copyOf(files);
        if (files.size() < 2) {
            throw new IllegalArgumentException("A duplicate group needs at least two files");
        }
        if (fileSize <= 0) {
            throw new IllegalArgumentException("Empty files are never grouped");
        }
    }

    /**
     * Bytes freed by keeping one copy and removing the rest.
     */
    public long wastedBytes() {
        return fileSize * (files.size() - 1L);
    }
}
