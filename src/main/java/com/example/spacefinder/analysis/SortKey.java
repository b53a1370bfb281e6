package com.example.spacefinder.analysis;

import java.time.Instant;
import java.util.Comparator;
import java.util.Locale;

/**
 * Sort orders offered for classified files. Unknown keys fall back to {@link #SIZE}.
 */
public enum SortKey {
    SIZE("size", true, Comparator.comparingLong(ClassifiedFile::size)),
    // Unknown access times sort as the oldest.
    LAST_ACCESSED("accessed", true, Comparator.comparing(
            (ClassifiedFile entry) -> entry.file().lastAccessed(),
            Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))),
    STALENESS("staleness", false, Comparator.comparingDouble(ClassifiedFile::stalenessScore)),
    NAME("name", false, Comparator.comparing(entry -> entry.file().name().toLowerCase(Locale.ROOT))),
    CATEGORY("category", false, Comparator.comparing(entry -> entry.category().label()));

    private final String key;
    private final boolean defaultDescending;
    private final Comparator<ClassifiedFile> comparator;

    SortKey(String key, boolean defaultDescending, Comparator<ClassifiedFile> comparator) {
        this.key = key;
        this.defaultDescending = defaultDescending;
        this.comparator = comparator;
    }

    public String key() {
        return key;
    }

    public boolean defaultDescending() {
        return defaultDescending;
    }

    Comparator<ClassifiedFile> comparator() {
        return comparator;
    }

    /**
     * Resolves a key such as {@code "size"}, {@code "accessed"} or {@code "lastAccessed"}.
     */
    public static SortKey fromKey(String value) {
        if (value == null) {
            return SIZE;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "accessed":
            case "lastaccessed":
            case "last_accessed":
                return LAST_ACCESSED;
            case "staleness":
            case "stalenessscore":
                return STALENESS;
            case "name":
            case "namecaseinsensitive":
                return NAME;
            case "category":
                return CATEGORY;
            default:
                return SIZE;
        }
    }
}
