package com.example.spacefinder.smart;

/**
 * Running totals for the files directly inside one folder.
 */
final class FolderStats {
    private long totalFiles;
    private long totalBytes;

    void addFile(long size) {
        totalFiles++;
        totalBytes += size;
    }

    long totalFiles() {
        return totalFiles;
    }

    long totalBytes() {
        return totalBytes;
    }

    FolderUsage snapshot(String folder) {
        return new FolderUsage(folder, totalBytes, totalFiles);
    }
}
