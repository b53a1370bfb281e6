package com.example.spacefinder.scan;

import com.example.spacefinder.StopSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Walks directory trees depth-first and collects {@link FileRecord}s for every regular file.
 * System and hidden directories are never descended into. Files or directories that cannot be
 * read are skipped without failing the scan.
 */
public final class FileScanner {
    private static final Logger LOGGER = LoggerFactory.getLogger(FileScanner.class);

    /**
     * Path reported with the final progress callback.
     */
    public static final String SCAN_COMPLETE = "Scan complete";

    static final int PROGRESS_INTERVAL = 100;

    public static final Set<String> DEFAULT_SKIP_DIRECTORIES = Set.of(
            "$Recycle.Bin",
            "System Volume Information",
            "Windows",
            "ProgramData",
            "Program Files",
            "Program Files (x86)",
            "Recovery",
            "PerfLogs",
            "$WinREAgent",
            "Config.Msi",
            "Documents and Settings",
            "MSOCache",
            "Intel",
            "AMD",
            "NVIDIA",
            "AppData"
    );

    private final Set<String> skipDirectoryNames;
    private final boolean followLinks;

    public FileScanner() {
        this(DEFAULT_SKIP_DIRECTORIES, false);
    }

    public FileScanner(Collection<String> skipDirectoryNames, boolean followLinks) {
        this.skipDirectoryNames = Set.copyOf(skipDirectoryNames);
        this.followLinks = followLinks;
    }

    /**
     * Scans a single root. Returns whatever was collected when {@code stop} fires.
     */
    public List<FileRecord> scan(Path root, ScanProgressListener listener, StopSignal stop) {
        return scan(root == null ? List.of() : List.of(root), listener, stop);
    }

    /**
     * Scans the roots one after another. Progress counts run on across roots, and roots after
     * the one where {@code stop} fired are not visited. A file reachable from more than one root
     * (nested or repeated roots) is recorded once.
     */
    public List<FileRecord> scan(List<Path> roots, ScanProgressListener listener, StopSignal stop) {
        ScanProgressListener progress = listener == null ? ScanProgressListener.NONE : listener;
        StopSignal stopSignal = StopSignal.orNever(stop);
        List<FileRecord> files = new ArrayList<>();
        Set<Path> collected = new HashSet<>();
        if (roots != null) {
            for (Path root : roots) {
                if (stopSignal.shouldStop()) {
                    LOGGER.info("Scan stopped before {}", root);
                    break;
                }
                int before = files.size();
                walk(root, files, collected, progress, stopSignal);
                LOGGER.info("Scanned {}: {} files", root, files.size() - before);
            }
        }
        progress.onProgress(SCAN_COMPLETE, files.size());
        return files;
    }

    private void walk(Path root, List<FileRecord> sink, Set<Path> collected, ScanProgressListener progress,
                      StopSignal stop) {
        long offset = sink.size();
        long count = 0;
        LinkOption[] linkOptions = followLinks ? new LinkOption[0] : new LinkOption[]{LinkOption.NOFOLLOW_LINKS};
        Set<Object> visited = new HashSet<>();
        Deque<Path> pending = new ArrayDeque<>();
        pending.push(root);

        while (!pending.isEmpty()) {
            if (stop.shouldStop()) {
                return;
            }
            Path current = pending.pop();
            List<Path> subdirectories = new ArrayList<>();
            // The stream is closed before any subdirectory is opened.
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(current)) {
                for (Path entry : stream) {
                    if (stop.shouldStop()) {
                        return;
                    }
                    BasicFileAttributes attrs;
                    try {
                        attrs = Files.readAttributes(entry, BasicFileAttributes.class, linkOptions);
                    } catch (IOException | SecurityException ex) {
                        LOGGER.debug("Skipping unreadable entry {}", entry, ex);
                        continue;
                    }
                    if (attrs.isDirectory()) {
                        if (!shouldSkipDirectory(entry) && firstVisit(visited, attrs)) {
                            subdirectories.add(entry);
                        }
                    } else if (attrs.isRegularFile()) {
                        if (!collected.add(entry.toAbsolutePath().normalize())) {
                            continue;
                        }
                        sink.add(FileRecord.of(entry, attrs));
                        count++;
                        if (count % PROGRESS_INTERVAL == 0) {
                            progress.onProgress(current.toString(), offset + count);
                        }
                    }
                }
            } catch (IOException | DirectoryIteratorException | SecurityException ex) {
                LOGGER.debug("Skipping unreadable directory {}", current, ex);
                continue;
            }
            // Reverse push keeps listing order for the depth-first walk.
            for (int i = subdirectories.size() - 1; i >= 0; i--) {
                pending.push(subdirectories.get(i));
            }
        }
    }

    private boolean firstVisit(Set<Object> visited, BasicFileAttributes attrs) {
        // Only relevant when links are followed, where a link back to an ancestor would loop forever.
        Object key = attrs.fileKey();
        return !followLinks || key == null || visited.add(key);
    }

    boolean shouldSkipDirectory(Path directory) {
        Path fileName = directory.getFileName();
        if (fileName == null) {
            return false;
        }
        String name = fileName.toString();
        return name.startsWith(".") || skipDirectoryNames.contains(name);
    }
}
