package com.example.spacefinder.analysis;

public record CategoryTotal(
        Category category,
        long fileCount,
        long totalBytes
) {
}
