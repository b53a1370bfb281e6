package com.example.spacefinder;

import com.example.spacefinder.analysis.ClassifiedFile;
import com.example.spacefinder.analysis.ExclusionList;
import com.example.spacefinder.analysis.FileAnalyzer;
import com.example.spacefinder.duplicates.DuplicateFinder;
import com.example.spacefinder.duplicates.DuplicateGroup;
import com.example.spacefinder.duplicates.DuplicateStage;
import com.example.spacefinder.duplicates.DuplicateStats;
import com.example.spacefinder.scan.FileRecord;
import com.example.spacefinder.scan.FileScanner;
import com.example.spacefinder.smart.DiskUsageReport;
import com.example.spacefinder.smart.EmptyFolderFinder;
import com.example.spacefinder.smart.SmartAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs scan, analysis, clean-up suggestions and duplicate search for one configuration on a
 * dedicated worker thread. {@link #cancel()} is observed by every stage; a cancelled job still
 * completes normally with what it gathered.
 */
public final class ScanJob {
    private static final Logger LOGGER = LoggerFactory.getLogger(ScanJob.class);

    /**
     * Progress callbacks, invoked synchronously on the worker thread.
     */
    public interface Listener {
        default void scanProgress(String currentPath, long fileCount) {
        }

        default void emptyFolderProgress(String currentPath, long foldersChecked) {
        }

        default void duplicateProgress(DuplicateStage stage, long current, long total) {
        }

        Listener NONE = new Listener() {
        };
    }

    private final SpaceFinderConfig config;
    private final Clock clock;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public ScanJob(SpaceFinderConfig config) {
        this(config, Clock.systemDefaultZone());
    }

    ScanJob(SpaceFinderConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    public CompletableFuture<ScanReport> start(Listener listener) {
        ExecutorService executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread worker = new Thread(runnable, "space-finder-scan");
            worker.setDaemon(true);
            return worker;
        });
        try {
            return CompletableFuture.supplyAsync(() -> run(listener), executor);
        } finally {
            executor.shutdown();
        }
    }

    public void cancel() {
        if (!cancelled.getAndSet(true)) {
            LOGGER.info("Cancellation requested");
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Runs every stage on the calling thread.
     */
    public ScanReport run(Listener listener) {
        Listener progress = listener == null ? Listener.NONE : listener;
        StopSignal stop = cancelled::get;

        FileScanner scanner = new FileScanner(config.skipDirectoryNames(), config.followLinks());
        FileAnalyzer analyzer = new FileAnalyzer(clock);
        SmartAnalyzer smartAnalyzer = new SmartAnalyzer(clock);

        LOGGER.info("Scanning {}", config.roots());
        List<FileRecord> records = scanner.scan(config.roots(), progress::scanProgress, stop);
        List<ClassifiedFile> classified = analyzer.analyze(records);

        ExclusionList exclusions = ExclusionList.of(config.exclusions());
        List<ClassifiedFile> visible = analyzer.filter(classified, List.of(), 0L, 0L, exclusions);
        List<ClassifiedFile> shown = analyzer.sort(
                analyzer.filter(visible, config.categories(), config.minSizeBytes(), config.minDaysOld()),
                config.sortKey(),
                config.descending()
        );
        DiskUsageReport diskUsage = smartAnalyzer.analyzeDiskUsage(
                visible,
                config.oldDownloadDays(),
                config.largeFolderThresholdBytes()
        );

        List<String> emptyFolders = new ArrayList<>();
        if (config.findEmptyFolders() && !stop.shouldStop()) {
            for (Path folder : new EmptyFolderFinder().findEmptyFolders(config.roots(), progress::emptyFolderProgress, stop)) {
                emptyFolders.add(folder.toString());
            }
        }

        Map<String, DuplicateGroup> duplicates = Map.of();
        if (config.findDuplicates() && !stop.shouldStop()) {
            duplicates = new DuplicateFinder().findDuplicates(visible, progress::duplicateProgress, stop);
        }

        long totalBytes = 0L;
        for (FileRecord record : records) {
            totalBytes += record.size();
        }
        ScanReport report = new ScanReport(
                clock.instant(),
                config.roots().stream().map(Path::toString).toList(),
                cancelled.get(),
                records.size(),
                totalBytes,
                analyzer.categoryTotals(classified),
                shown,
                diskUsage,
                emptyFolders,
                List.copyOf(duplicates.values()),
                DuplicateStats.of(duplicates)
        );
        LOGGER.info("Scan {}: {} files, {} shown, {} duplicate groups",
                report.cancelled() ? "cancelled" : "completed",
                report.totalFiles(),
                shown.size(),
                duplicates.size());
        return report;
    }
}
