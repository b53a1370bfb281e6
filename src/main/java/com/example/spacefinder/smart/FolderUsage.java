package com.example.spacefinder.smart;

public record FolderUsage(
        String path,
        long totalBytes,
        long fileCount
) {
}
