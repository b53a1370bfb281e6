package com.example.spacefinder.smart;

import com.example.spacefinder.analysis.ClassifiedFile;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Derived clean-up views over analyzed files: temp and cache files, stale downloads and folders
 * that hold a lot of data directly.
 */
public final class SmartAnalyzer {
    public static final int DEFAULT_OLD_DOWNLOAD_DAYS = 30;
    public static final long DEFAULT_LARGE_FOLDER_BYTES = 1024L * 1024L * 1024L;

    static final List<String> TEMP_PATTERNS = List.of(
            "temp", "tmp", "cache", "caches", ".cache",
            "temporary", "__pycache__", "node_modules",
            ".npm", ".yarn", ".nuget", "obj", "bin",
            "thumbs.db", "desktop.ini", ".ds_store"
    );

    static final Set<String> TEMP_EXTENSIONS = Set.of(
            ".tmp", ".temp", ".bak", ".old", ".orig",
            ".log", ".dmp", ".crash", ".swp", ".swo"
    );

    static final List<String> USER_CACHE_PATHS = List.of(
            "appdata\\local\\temp",
            "appdata\\local\\microsoft\\windows\\temporary internet files",
            "appdata\\local\\microsoft\\windows\\inetcache",
            "appdata\\local\\microsoft\\windows\\webcache",
            "appdata\\local\\google\\chrome\\user data\\default\\cache",
            "appdata\\local\\mozilla\\firefox\\profiles"
    );

    private static final String DOWNLOADS = "downloads";

    private final Clock clock;

    public SmartAnalyzer() {
        this(Clock.systemDefaultZone());
    }

    public SmartAnalyzer(Clock clock) {
        this.clock = clock;
    }

    public List<ClassifiedFile> findTempFiles(List<ClassifiedFile> files) {
        List<ClassifiedFile> temp = new ArrayList<>();
        if (files == null) {
            return temp;
        }
        for (ClassifiedFile entry : files) {
            if (isTempFile(entry)) {
                temp.add(entry);
            }
        }
        return temp;
    }

    boolean isTempFile(ClassifiedFile entry) {
        if (TEMP_EXTENSIONS.contains(entry.file().extension().toLowerCase(Locale.ROOT))) {
            return true;
        }
        String path = entry.path().toLowerCase(Locale.ROOT);
        for (String pattern : TEMP_PATTERNS) {
            if (path.contains(pattern)) {
                return true;
            }
        }
        for (String cachePath : USER_CACHE_PATHS) {
            if (path.contains(cachePath)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Files under a downloads folder last accessed more than {@code daysOld} days ago.
     */
    public List<ClassifiedFile> findOldDownloads(List<ClassifiedFile> files, int daysOld) {
        List<ClassifiedFile> old = new ArrayList<>();
        if (files == null) {
            return old;
        }
        Instant cutoff = clock.instant().minus(Duration.ofDays(daysOld));
        for (ClassifiedFile entry : files) {
            if (!entry.path().toLowerCase(Locale.ROOT).contains(DOWNLOADS)) {
                continue;
            }
            Instant accessed = entry.file().lastAccessed();
            if (accessed != null && accessed.isBefore(cutoff)) {
                old.add(entry);
            }
        }
        return old;
    }

    /**
     * Groups files by their immediate parent folder and reports folders holding at least
     * {@code minBytes}, largest first. Subfolder contents are not rolled up.
     */
    public List<FolderUsage> findLargeFolders(List<ClassifiedFile> files, long minBytes) {
        Map<String, FolderStats> folders = new LinkedHashMap<>();
        if (files != null) {
            for (ClassifiedFile entry : files) {
                folders.computeIfAbsent(parentOf(entry.path()), ignored -> new FolderStats()).addFile(entry.size());
            }
        }
        List<FolderUsage> large = new ArrayList<>();
        folders.forEach((folder, stats) -> {
            if (stats.totalBytes() >= minBytes) {
                large.add(stats.snapshot(folder));
            }
        });
        large.sort(Comparator.comparingLong(FolderUsage::totalBytes).reversed());
        return large;
    }

    public DiskUsageReport analyzeDiskUsage(List<ClassifiedFile> files) {
        return analyzeDiskUsage(files, DEFAULT_OLD_DOWNLOAD_DAYS, DEFAULT_LARGE_FOLDER_BYTES);
    }

    public DiskUsageReport analyzeDiskUsage(List<ClassifiedFile> files, int oldDownloadDays, long largeFolderBytes) {
        List<ClassifiedFile> tempFiles = findTempFiles(files);
        List<ClassifiedFile> oldDownloads = findOldDownloads(files, oldDownloadDays);
        List<FolderUsage> largeFolders = findLargeFolders(files, largeFolderBytes);

        long tempBytes = totalBytes(tempFiles);
        long downloadBytes = totalBytes(oldDownloads);
        Set<String> counted = new HashSet<>();
        long savings = 0L;
        for (List<ClassifiedFile> list : List.of(tempFiles, oldDownloads)) {
            for (ClassifiedFile entry : list) {
                if (counted.add(entry.path())) {
                    savings += entry.size();
                }
            }
        }
        return new DiskUsageReport(tempFiles, oldDownloads, largeFolders, tempBytes, downloadBytes, savings);
    }

    private static long totalBytes(List<ClassifiedFile> files) {
        long total = 0L;
        for (ClassifiedFile entry : files) {
            total += entry.size();
        }
        return total;
    }

    /**
     * Text before the last separator of either style, or an empty string for a bare name.
     */
    static String parentOf(String path) {
        int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        if (slash < 0) {
            return "";
        }
        if (slash == 0) {
            return path.substring(0, 1);
        }
        return path.substring(0, slash);
    }
}
