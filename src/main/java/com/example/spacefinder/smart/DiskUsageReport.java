package com.example.spacefinder.smart;

import com.example.spacefinder.analysis.ClassifiedFile;

import java.util.List;

/**
 * Combined clean-up suggestions. {@code potentialSavings} counts each file once even when it is
 * both a temp file and an old download; large folders are informational and not part of it.
 */
public record DiskUsageReport(
        List<ClassifiedFile> tempFiles,
        List<ClassifiedFile> oldDownloads,
        List<FolderUsage> largeFolders,
        long tempBytes,
        long downloadBytes,
        long potentialSavings
) {
    public DiskUsageReport {
        tempFiles = List.copyOf(tempFiles);
        oldDownloads = List.copyOf(oldDownloads);
        largeFolders = List.copyOf(largeFolders);
    }
}
