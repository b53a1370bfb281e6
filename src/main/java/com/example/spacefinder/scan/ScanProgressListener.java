package com.example.spacefinder.scan;

@FunctionalInterface
public interface ScanProgressListener {
    /**
     * Called from the scanning thread with the directory being scanned and the running file count.
     */
    void onProgress(String currentPath, long fileCount);

    ScanProgressListener NONE = (currentPath, fileCount) -> {
    };
}
