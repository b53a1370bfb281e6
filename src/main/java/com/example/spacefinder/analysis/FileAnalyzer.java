package com.example.spacefinder.analysis;

import com.example.spacefinder.scan.FileRecord;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Classifies scanned files and ranks them by staleness. All operations return new lists and
 * never modify their input.
 */
public final class FileAnalyzer {
    private static final String EXECUTABLE_EXTENSION = ".exe";
    private static final long SECONDS_PER_DAY = 24L * 60 * 60;
    private static final double BYTES_PER_MIB = 1024.0 * 1024.0;

    static final List<String> GAME_PATHS = List.of(
            "steam",
            "steamapps",
            "epic games",
            "origin",
            "ubisoft",
            "games",
            "riot games",
            "battle.net",
            "gog galaxy",
            "xbox"
    );

    private final Clock clock;

    public FileAnalyzer() {
        this(Clock.systemDefaultZone());
    }

    public FileAnalyzer(Clock clock) {
        this.clock = clock;
    }

    /**
     * Maps a file to exactly one category using its extension, and for executables its path.
     */
    public Category categorize(FileRecord record) {
        String extension = record.extension().toLowerCase(Locale.ROOT);
        if (EXECUTABLE_EXTENSION.equals(extension)) {
            String path = record.path().toLowerCase(Locale.ROOT);
            for (String gamePath : GAME_PATHS) {
                if (path.contains(gamePath)) {
                    return Category.GAME;
                }
            }
            return Category.OTHER;
        }
        for (Category category : Category.values()) {
            if (category.matches(extension)) {
                return category;
            }
        }
        return Category.OTHER;
    }

    /**
     * Size in MiB multiplied by whole days since last access.
     */
    public double score(FileRecord record) {
        return (record.size() / BYTES_PER_MIB) * daysSinceAccess(record);
    }

    /**
     * Whole days between the last access and now, truncated. Access times in the future count as 0.
     */
    public long daysSinceAccess(FileRecord record) {
        Instant accessed = record.lastAccessed();
        if (accessed == null) {
            return 0;
        }
        long seconds = Duration.between(accessed, clock.instant()).getSeconds();
        return Math.max(0, Math.floorDiv(seconds, SECONDS_PER_DAY));
    }

    public List<ClassifiedFile> analyze(List<FileRecord> records) {
        if (records == null) {
            return List.of();
        }
        List<ClassifiedFile> analyzed = new ArrayList<>(records.size());
        for (FileRecord record : records) {
            analyzed.add(new ClassifiedFile(record, categorize(record), score(record)));
        }
        return analyzed;
    }

    public List<ClassifiedFile> filter(List<ClassifiedFile> files,
                                       Collection<Category> categories,
                                       long minSizeBytes,
                                       long minDaysOld) {
        return filter(files, categories, minSizeBytes, minDaysOld, ExclusionList.EMPTY);
    }

    /**
     * Keeps entries that pass every criterion, preserving their relative order. An empty or null
     * category collection admits every category.
     */
    public List<ClassifiedFile> filter(List<ClassifiedFile> files,
                                       Collection<Category> categories,
                                       long minSizeBytes,
                                       long minDaysOld,
                                       ExclusionList exclusions) {
        if (files == null) {
            return List.of();
        }
        Set<Category> allowed = categories == null || categories.isEmpty()
                ? EnumSet.allOf(Category.class)
                : EnumSet.copyOf(categories);
        ExclusionList excluded = exclusions == null ? ExclusionList.EMPTY : exclusions;
        List<ClassifiedFile> filtered = new ArrayList<>();
        for (ClassifiedFile entry : files) {
            if (!allowed.contains(entry.category())) {
                continue;
            }
            if (entry.size() < minSizeBytes) {
                continue;
            }
            if (daysSinceAccess(entry.file()) < minDaysOld) {
                continue;
            }
            if (excluded.isExcluded(entry.path())) {
                continue;
            }
            filtered.add(entry);
        }
        return filtered;
    }

    public List<ClassifiedFile> sort(List<ClassifiedFile> files, SortKey key) {
        SortKey resolved = key == null ? SortKey.SIZE : key;
        return sort(files, resolved, resolved.defaultDescending());
    }

    /**
     * Stable sort; entries that compare equal keep their input order in either direction.
     */
    public List<ClassifiedFile> sort(List<ClassifiedFile> files, SortKey key, boolean descending) {
        if (files == null) {
            return List.of();
        }
        Comparator<ClassifiedFile> comparator = (key == null ? SortKey.SIZE : key).comparator();
        List<ClassifiedFile> sorted = new ArrayList<>(files);
        sorted.sort(descending ? comparator.reversed() : comparator);
        return sorted;
    }

    public List<ClassifiedFile> sort(List<ClassifiedFile> files, String key, boolean descending) {
        return sort(files, SortKey.fromKey(key), descending);
    }

    /**
     * File count and byte total for every category, in declaration order.
     */
    public List<CategoryTotal> categoryTotals(List<ClassifiedFile> files) {
        Map<Category, long[]> totals = new EnumMap<>(Category.class);
        for (Category category : Category.values()) {
            totals.put(category, new long[2]);
        }
        if (files != null) {
            for (ClassifiedFile entry : files) {
                long[] total = totals.get(entry.category());
                total[0]++;
                total[1] += entry.size();
            }
        }
        List<CategoryTotal> result = new ArrayList<>();
        totals.forEach((category, total) -> result.add(new CategoryTotal(category, total[0], total[1])));
        return result;
    }
}
