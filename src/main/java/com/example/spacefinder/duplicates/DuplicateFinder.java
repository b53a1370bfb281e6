package com.example.spacefinder.duplicates;

import com.example.spacefinder.StopSignal;
import com.example.spacefinder.analysis.ClassifiedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Finds byte-identical files in three narrowing passes: equal size, equal digest of the first
 * {@value FileHasher#PARTIAL_HASH_BYTES} bytes, and finally equal digest of the whole content.
 * Only the last pass creates groups, so a stopped search returns complete groups only.
 */
public final class DuplicateFinder {
    private static final Logger LOGGER = LoggerFactory.getLogger(DuplicateFinder.class);

    static final int SIZE_PROGRESS_INTERVAL = 100;
    static final int HASH_PROGRESS_INTERVAL = 50;

    private final FileHasher hasher;

    public DuplicateFinder() {
        this(new FileHasher());
    }

    public DuplicateFinder(FileHasher hasher) {
        this.hasher = hasher;
    }

    /**
     * Returns confirmed groups keyed by full-content hash, in the order they were confirmed.
     * Unreadable files are dropped from their bucket. When {@code stop} fires the groups confirmed
     * so far are returned.
     */
    public Map<String, DuplicateGroup> findDuplicates(List<ClassifiedFile> files,
                                                      DuplicateProgressListener listener,
                                                      StopSignal stop) {
        DuplicateProgressListener progress = listener == null ? DuplicateProgressListener.NONE : listener;
        StopSignal stopSignal = StopSignal.orNever(stop);
        Map<String, DuplicateGroup> duplicates = new LinkedHashMap<>();
        if (stopSignal.shouldStop()) {
            return duplicates;
        }
        if (files == null || files.isEmpty()) {
            progress.onProgress(DuplicateStage.COMPLETE, 0, 0);
            return duplicates;
        }

        Optional<List<List<ClassifiedFile>>> sizeGroups = groupBySize(files, progress, stopSignal);
        if (sizeGroups.isEmpty()) {
            LOGGER.info("Duplicate search stopped while grouping by size");
            return duplicates;
        }
        List<List<ClassifiedFile>> candidates = sizeGroups.get();
        long totalToCheck = 0;
        for (List<ClassifiedFile> group : candidates) {
            totalToCheck += group.size();
        }

        progress.onProgress(DuplicateStage.PARTIAL_HASHING, 0, totalToCheck);
        long checked = 0;
        for (List<ClassifiedFile> sizeGroup : candidates) {
            if (stopSignal.shouldStop()) {
                return stopped(duplicates);
            }
            Map<String, List<ClassifiedFile>> partialGroups = new LinkedHashMap<>();
            for (ClassifiedFile file : sizeGroup) {
                if (stopSignal.shouldStop()) {
                    return stopped(duplicates);
                }
                hash(file, hasher::partialHash)
                        .ifPresent(hash -> partialGroups.computeIfAbsent(hash, ignored -> new ArrayList<>()).add(file));
                checked++;
                if (checked % HASH_PROGRESS_INTERVAL == 0) {
                    progress.onProgress(DuplicateStage.PARTIAL_HASHING, checked, totalToCheck);
                }
            }

            for (List<ClassifiedFile> matching : partialGroups.values()) {
                if (matching.size() < 2) {
                    continue;
                }
                if (stopSignal.shouldStop()) {
                    return stopped(duplicates);
                }
                Optional<Map<String, List<ClassifiedFile>>> fullGroups = groupByFullHash(matching, stopSignal);
                if (fullGroups.isEmpty()) {
                    return stopped(duplicates);
                }
                long size = matching.get(0).size();
                fullGroups.get().forEach((hash, members) -> {
                    if (members.size() >= 2) {
                        duplicates.put(hash, new DuplicateGroup(hash, size, members));
                    }
                });
            }
        }

        progress.onProgress(DuplicateStage.COMPLETE, totalToCheck, totalToCheck);
        LOGGER.info("Duplicate search finished: {} candidates, {} groups", totalToCheck, duplicates.size());
        return duplicates;
    }

    /**
     * Same-size buckets with at least two non-empty members, or empty when stopped.
     */
    private Optional<List<List<ClassifiedFile>>> groupBySize(List<ClassifiedFile> files,
                                                           DuplicateProgressListener progress,
                                                           StopSignal stop) {
        int total = files.size();
        progress.onProgress(DuplicateStage.GROUPING_BY_SIZE, 0, total);
        Map<Long, List<ClassifiedFile>> bySize = new LinkedHashMap<>();
        Set<String> seenPaths = new HashSet<>();
        for (int i = 0; i < total; i++) {
            if (stop.shouldStop()) {
                return Optional.empty();
            }
            ClassifiedFile file = files.get(i);
            // A path listed twice is one file, never a duplicate of itself.
            if (file.size() > 0 && seenPaths.add(file.path())) {
                bySize.computeIfAbsent(file.size(), ignored -> new ArrayList<>()).add(file);
            }
            int done = i + 1;
            if (done < total && done % SIZE_PROGRESS_INTERVAL == 0) {
                progress.onProgress(DuplicateStage.GROUPING_BY_SIZE, done, total);
            }
        }
        progress.onProgress(DuplicateStage.GROUPING_BY_SIZE, total, total);

        List<List<ClassifiedFile>> candidates = new ArrayList<>();
        for (List<ClassifiedFile> group : bySize.values()) {
            if (group.size() >= 2) {
                candidates.add(group);
            }
        }
        return Optional.of(candidates);
    }

    private Optional<Map<String, List<ClassifiedFile>>> groupByFullHash(List<ClassifiedFile> matching, StopSignal stop) {
        Map<String, List<ClassifiedFile>> fullGroups = new LinkedHashMap<>();
        for (ClassifiedFile file : matching) {
            if (stop.shouldStop()) {
                return Optional.empty();
            }
            hash(file, hasher::fullHash)
                    .ifPresent(hash -> fullGroups.computeIfAbsent(hash, ignored -> new ArrayList<>()).add(file));
        }
        return Optional.of(fullGroups);
    }

    private Optional<String> hash(ClassifiedFile file, Function<Path, Optional<String>> digest) {
        Path path;
        try {
            path = Path.of(file.path());
        } catch (InvalidPathException ex) {
            LOGGER.debug("Skipping invalid path {}", file.path(), ex);
            return Optional.empty();
        }
        return digest.apply(path);
    }

    private Map<String, DuplicateGroup> stopped(Map<String, DuplicateGroup> duplicates) {
        LOGGER.info("Duplicate search stopped with {} confirmed groups", duplicates.size());
        return duplicates;
    }
}
