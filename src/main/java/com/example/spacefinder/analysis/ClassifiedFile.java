package com.example.spacefinder.analysis;

import com.example.spacefinder.scan.FileRecord;

import java.util.Objects;

/**
 * A scanned file with its category and staleness score, computed once at analysis time.
 */
public record ClassifiedFile(
        FileRecord file,
        Category category,
        double stalenessScore
) {
    public ClassifiedFile {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(category, "category");
        if (stalenessScore < 0) {
            throw new IllegalArgumentException("stalenessScore must not be negative: " + stalenessScore);
        }
    }

    public String path() {
        return file.path();
    }

    public long size() {
        return file.size();
    }
}
