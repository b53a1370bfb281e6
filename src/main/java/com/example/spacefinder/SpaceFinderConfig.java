package com.example.spacefinder;

import com.example.spacefinder.analysis.Category;
import com.example.spacefinder.analysis.SortKey;

import java.nio.file.Path;
import java.util.List;

/**
 * Immutable runtime settings for a scan.
 */
public record SpaceFinderConfig(
        List<Path> roots,
        Path outputDirectory,
        boolean followLinks,
        List<String> skipDirectoryNames,
        List<String> exclusions,
        List<Category> categories,
        long minSizeBytes,
        int minDaysOld,
        SortKey sortKey,
        boolean descending,
        boolean findDuplicates,
        boolean findEmptyFolders,
        int oldDownloadDays,
        long largeFolderThresholdBytes,
        boolean exportCsv
) {
}
