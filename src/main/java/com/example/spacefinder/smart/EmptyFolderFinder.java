package com.example.spacefinder.smart;

import com.example.spacefinder.StopSignal;
import com.example.spacefinder.scan.ScanProgressListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;

/**
 * Finds folders that contain no files at any depth. Each folder is decided after all of its
 * children, so a folder holding only empty folders is itself reported as empty.
 */
public final class EmptyFolderFinder {
    private static final Logger LOGGER = LoggerFactory.getLogger(EmptyFolderFinder.class);

    static final int PROGRESS_INTERVAL = 100;
    static final List<String> SYSTEM_FOLDER_MARKERS = List.of("$recycle", "system volume");

    /**
     * Empty folders in post-order (children before parents). Unreadable folders and system
     * folders are never reported and keep their parents from being reported.
     */
    public List<Path> findEmptyFolders(List<Path> roots, ScanProgressListener listener, StopSignal stop) {
        ScanProgressListener progress = listener == null ? ScanProgressListener.NONE : listener;
        StopSignal stopSignal = StopSignal.orNever(stop);
        EmptyFolderVisitor visitor = new EmptyFolderVisitor(progress, stopSignal);
        if (roots == null) {
            return visitor.emptyFolders;
        }
        for (Path root : roots) {
            if (stopSignal.shouldStop()) {
                break;
            }
            try {
                Files.walkFileTree(root, visitor);
            } catch (IOException ex) {
                LOGGER.warn("Failed to walk {}", root, ex);
            }
            visitor.pending.clear();
        }
        LOGGER.info("Found {} empty folders in {} checked", visitor.emptyFolders.size(), visitor.checked);
        return visitor.emptyFolders;
    }

    static boolean isSystemFolder(Path directory) {
        String path = directory.toString().toLowerCase(Locale.ROOT);
        for (String marker : SYSTEM_FOLDER_MARKERS) {
            if (path.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    private static final class EmptyFolderVisitor extends SimpleFileVisitor<Path> {
        private final ScanProgressListener progress;
        private final StopSignal stop;
        private final Deque<boolean[]> pending = new ArrayDeque<>();
        private final List<Path> emptyFolders = new ArrayList<>();
        private long checked;

        private EmptyFolderVisitor(ScanProgressListener progress, StopSignal stop) {
            this.progress = progress;
            this.stop = stop;
        }

        @Override
        public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
            if (stop.shouldStop()) {
                return FileVisitResult.TERMINATE;
            }
            // Slot 0 flips once anything that is not an empty folder shows up inside.
            pending.push(new boolean[1]);
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            markParentOccupied();
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) {
            LOGGER.debug("Cannot inspect {}", file, exc);
            markParentOccupied();
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
            boolean occupied = pending.pop()[0];
            checked++;
            if (checked % PROGRESS_INTERVAL == 0) {
                progress.onProgress(dir.toString(), checked);
            }
            if (exc != null) {
                LOGGER.debug("Failed to list {}", dir, exc);
                occupied = true;
            }
            if (occupied || isSystemFolder(dir)) {
                markParentOccupied();
            } else {
                emptyFolders.add(dir);
            }
            return stop.shouldStop() ? FileVisitResult.TERMINATE : FileVisitResult.CONTINUE;
        }

        private void markParentOccupied() {
            boolean[] parent = pending.peek();
            if (parent != null) {
                parent[0] = true;
            }
        }
    }
}
