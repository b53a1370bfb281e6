package com.example.spacefinder.duplicates;

import java.util.Map;

public record DuplicateStats(
        int totalGroups,
        int totalFiles,
        long wastedBytes
) {
    public static final DuplicateStats EMPTY = new DuplicateStats(0, 0, 0L);

    /**
     * Totals over the groups returned by {@link DuplicateFinder#findDuplicates}.
     */
    public static DuplicateStats of(Map<String, DuplicateGroup> groups) {
        if (groups == null || groups.isEmpty()) {
            return EMPTY;
        }
        int totalFiles = 0;
        long wastedBytes = 0L;
        for (DuplicateGroup group : groups.values()) {
            totalFiles += group.files().size();
            wastedBytes += group.wastedBytes();
        }
        return new DuplicateStats(groups.size(), totalFiles, wastedBytes);
    }
}
