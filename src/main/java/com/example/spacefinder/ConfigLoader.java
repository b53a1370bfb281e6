package com.example.spacefinder;

import com.example.spacefinder.analysis.Category;
import com.example.spacefinder.analysis.SortKey;
import com.example.spacefinder.scan.FileScanner;
import com.example.spacefinder.smart.SmartAnalyzer;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;
import java.util.regex.Pattern;

public class ConfigLoader {
    private static final String DEFAULT_OUTPUT_DIRECTORY = "output";
    private static final String DEFAULT_LARGE_FOLDER_THRESHOLD = "1 GB";
    private static final Pattern SIZE_PATTERN = Pattern.compile("\\d+(\\.\\d+)?\\s*([KMGT]?B)?", Pattern.CASE_INSENSITIVE);

    private final ObjectMapper mapper;

    public ConfigLoader() {
        mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public SpaceFinderConfig load(Path path) throws IOException {
        RawConfig raw = mapper.readValue(path.toFile(), RawConfig.class);

        if (raw.roots == null || raw.roots.stream().allMatch(root -> root == null || root.isBlank())) {
            throw new IllegalArgumentException("Config must include at least one root path.");
        }

        List<Path> roots = raw.roots.stream()
                .filter(root -> root != null && !root.isBlank())
                .map(Path::of)
                .toList();
        Path outputDirectory = Path.of(optionalString(raw.outputDirectory, DEFAULT_OUTPUT_DIRECTORY));
        boolean followLinks = raw.followLinks != null && raw.followLinks;

        List<String> skipDirectoryNames = mergePatterns(new TreeSet<>(FileScanner.DEFAULT_SKIP_DIRECTORIES), raw.skipDirectoryNames);
        List<String> exclusions = mergePatterns(List.of(), raw.exclusions);
        List<Category> categories = parseCategories(raw.categories);

        long minSizeBytes = parseSize("minSize", raw.minSize, 0L);
        int minDaysOld = nonNegative("minDaysOld", raw.minDaysOld, 0);
        SortKey sortKey = SortKey.fromKey(raw.sortBy);
        boolean descending = raw.descending == null ? sortKey.defaultDescending() : raw.descending;
        boolean findDuplicates = raw.findDuplicates == null || raw.findDuplicates;
        boolean findEmptyFolders = raw.findEmptyFolders != null && raw.findEmptyFolders;
        int oldDownloadDays = nonNegative("oldDownloadDays", raw.oldDownloadDays, SmartAnalyzer.DEFAULT_OLD_DOWNLOAD_DAYS);
        long largeFolderThreshold = parseSize("largeFolderThreshold", raw.largeFolderThreshold,
                SizeFormat.parse(DEFAULT_LARGE_FOLDER_THRESHOLD));
        boolean exportCsv = raw.exportCsv != null && raw.exportCsv;

        return new SpaceFinderConfig(
                roots,
                outputDirectory,
                followLinks,
                skipDirectoryNames,
                exclusions,
                categories,
                minSizeBytes,
                minDaysOld,
                sortKey,
                descending,
                findDuplicates,
                findEmptyFolders,
                oldDownloadDays,
                largeFolderThreshold,
                exportCsv
        );
    }

    private List<Category> parseCategories(List<String> labels) {
        List<Category> categories = new ArrayList<>();
        if (labels == null) {
            return categories;
        }
        for (String label : labels) {
            if (label == null || label.isBlank()) {
                continue;
            }
            Category category = Category.fromLabel(label)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown category in categories: " + label));
            if (!categories.contains(category)) {
                categories.add(category);
            }
        }
        return List.copyOf(categories);
    }

    /**
     * Accepts a JSON number of bytes or a string such as "500 MB".
     */
    private long parseSize(String field, JsonNode value, long fallback) {
        if (value == null || value.isNull()) {
            return fallback;
        }
        if (value.isIntegralNumber()) {
            long bytes = value.asLong();
            if (bytes < 0) {
                throw new IllegalArgumentException(field + " must not be negative.");
            }
            return bytes;
        }
        if (value.isTextual()) {
            String text = value.asText().trim();
            if (text.isEmpty()) {
                return fallback;
            }
            if (!SIZE_PATTERN.matcher(text).matches()) {
                throw new IllegalArgumentException(field + " is not a valid size: " + text);
            }
            return SizeFormat.parse(text);
        }
        throw new IllegalArgumentException(field + " must be a number of bytes or a size string.");
    }

    private int nonNegative(String field, Integer value, int fallback) {
        if (value == null) {
            return fallback;
        }
        if (value < 0) {
            throw new IllegalArgumentException(field + " must not be negative.");
        }
        return value;
    }

    private List<String> mergePatterns(Collection<String> defaults, List<String> overrides) {
        List<String> merged = new ArrayList<>(defaults);
        if (overrides != null) {
            for (String pattern : overrides) {
                if (pattern == null || pattern.isBlank() || merged.contains(pattern)) {
                    continue;
                }
                merged.add(pattern);
            }
        }
        return List.copyOf(merged);
    }

    private String optionalString(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value;
    }

    private static class RawConfig {
        public List<String> roots = new ArrayList<>();
        public String outputDirectory;
        public Boolean followLinks;
        public List<String> skipDirectoryNames;
        public List<String> exclusions;
        public List<String> categories;
        public JsonNode minSize;
        public Integer minDaysOld;
        public String sortBy;
        public Boolean descending;
        public Boolean findDuplicates;
        public Boolean findEmptyFolders;
        public Integer oldDownloadDays;
        public JsonNode largeFolderThreshold;
        public Boolean exportCsv;
    }
}
