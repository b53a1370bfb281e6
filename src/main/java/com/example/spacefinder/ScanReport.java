package com.example.spacefinder;

import com.example.spacefinder.analysis.CategoryTotal;
import com.example.spacefinder.analysis.ClassifiedFile;
import com.example.spacefinder.duplicates.DuplicateGroup;
import com.example.spacefinder.duplicates.DuplicateStats;
import com.example.spacefinder.smart.DiskUsageReport;

import java.time.Instant;
import java.util.List;

/**
 * Everything one scan produced. A cancelled scan still yields a consistent, if incomplete, report.
 */
public record ScanReport(
        Instant generatedAt,
        List<String> roots,
        boolean cancelled,
        long totalFiles,
        long totalBytes,
        List<CategoryTotal> categoryTotals,
        List<ClassifiedFile> files,
        DiskUsageReport diskUsage,
        List<String> emptyFolders,
        List<DuplicateGroup> duplicates,
        DuplicateStats duplicateStats
) {
}
