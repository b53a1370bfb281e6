package com.example.spacefinder.analysis;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Path prefixes whose files are hidden from filtered views. Matching ignores case and accepts
 * either separator, so {@code C:\Data} excludes {@code C:\Data\a.txt} but not {@code C:\Database}.
 */
public final class ExclusionList {
    public static final ExclusionList EMPTY = new ExclusionList(List.of());

    private final List<String> prefixes;

    private ExclusionList(List<String> prefixes) {
        this.prefixes = prefixes;
    }

    public static ExclusionList of(Collection<String> paths) {
        if (paths == null || paths.isEmpty()) {
            return EMPTY;
        }
        List<String> prefixes = new ArrayList<>();
        for (String path : paths) {
            if (path == null || path.isBlank()) {
                continue;
            }
            String normalized = stripTrailingSeparators(path.trim().toLowerCase(Locale.ROOT));
            if (!normalized.isEmpty() && !prefixes.contains(normalized)) {
                prefixes.add(normalized);
            }
        }
        return new ExclusionList(List.copyOf(prefixes));
    }

    public boolean isExcluded(String path) {
        if (path == null || prefixes.isEmpty()) {
            return false;
        }
        String candidate = path.toLowerCase(Locale.ROOT);
        for (String prefix : prefixes) {
            if (candidate.equals(prefix)) {
                return true;
            }
            if (isSeparator(prefix.charAt(prefix.length() - 1)) && candidate.startsWith(prefix)) {
                return true;
            }
            if (candidate.startsWith(prefix) && candidate.length() > prefix.length()) {
                if (isSeparator(candidate.charAt(prefix.length()))) {
                    return true;
                }
            }
        }
        return false;
    }

    public boolean isEmpty() {
        return prefixes.isEmpty();
    }

    public List<String> prefixes() {
        return prefixes;
    }

    private static String stripTrailingSeparators(String path) {
        int end = path.length();
        // Keep a lone "/" so the filesystem root still works as a prefix.
        while (end > 1 && isSeparator(path.charAt(end - 1))) {
            end--;
        }
        return path.substring(0, end);
    }

    private static boolean isSeparator(char c) {
        return c == '/' || c == '\\';
    }
}
