package com.example.spacefinder;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Human-readable sizes and timestamps, using binary multiples.
 */
public final class SizeFormat {
    private static final long KB = 1024L;
    private static final long MB = KB * 1024L;
    private static final long GB = MB * 1024L;
    private static final long TB = GB * 1024L;

    // Longest suffix first so "KB" is not read as "B".
    private static final String[] SUFFIXES = {"KB", "MB", "GB", "TB", "B"};
    private static final long[] MULTIPLIERS = {KB, MB, GB, TB, 1L};

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm", Locale.ROOT);

    private SizeFormat() {
    }

    public static String format(long bytes) {
        if (bytes < KB) {
            return bytes + " B";
        } else if (bytes < MB) {
            return String.format(Locale.ROOT, "%.1f KB", bytes / (double) KB);
        } else if (bytes < GB) {
            return String.format(Locale.ROOT, "%.1f MB", bytes / (double) MB);
        } else if (bytes < TB) {
            return String.format(Locale.ROOT, "%.2f GB", bytes / (double) GB);
        }
        return String.format(Locale.ROOT, "%.2f TB", bytes / (double) TB);
    }

    /**
     * Parses strings such as {@code "500 MB"} or {@code "2.5 kb"}; a bare number is bytes.
     * Malformed input yields 0.
     */
    public static long parse(String text) {
        if (text == null) {
            return 0L;
        }
        String value = text.trim().toUpperCase(Locale.ROOT);
        if (value.isEmpty() || value.equals("0")) {
            return 0L;
        }
        for (int i = 0; i < SUFFIXES.length; i++) {
            if (value.endsWith(SUFFIXES[i])) {
                String number = value.substring(0, value.length() - SUFFIXES[i].length()).trim();
                return toBytes(number, MULTIPLIERS[i]);
            }
        }
        return toBytes(value, 1L);
    }

    private static long toBytes(String number, long multiplier) {
        try {
            double parsed = Double.parseDouble(number);
            if (parsed < 0 || Double.isNaN(parsed)) {
                return 0L;
            }
            return (long) (parsed * multiplier);
        } catch (NumberFormatException ex) {
            return 0L;
        }
    }

    public static String formatDate(Instant instant) {
        if (instant == null) {
            return "Unknown";
        }
        return DATE_FORMAT.format(instant.atZone(ZoneId.systemDefault()));
    }
}
