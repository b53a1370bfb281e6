package com.example.spacefinder;

import com.example.spacefinder.duplicates.DuplicateStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

public final class App {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);
    private static final long SHUTDOWN_GRACE_SECONDS = 30;

    private App() {
    }

    public static void main(String[] args) throws Exception {
        // Basic CLI contract: a single JSON config file path is required.
        if (args.length < 1) {
            LOGGER.error("Usage: java -jar space-finder.jar <config.json>");
            System.exit(1);
        }
        Path configPath = Path.of(args[0]);
        SpaceFinderConfig config = new ConfigLoader().load(configPath);

        ScanJob job = new ScanJob(config);
        CountDownLatch finished = new CountDownLatch(1);
        // Ctrl-C stops the running stage and waits for the partial report to be written.
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            if (finished.getCount() == 0) {
                return;
            }
            job.cancel();
            try {
                finished.await(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        }, "space-finder-cancel"));

        try {
            ScanReport report = job.start(new LoggingListener()).join();
            new ReportWriter(config.outputDirectory()).write(report);
            if (config.exportCsv()) {
                new CsvExporter().export(report.files(), config.outputDirectory());
            }
            LOGGER.info("{} files ({}), potential savings {}, duplicates waste {}",
                    report.totalFiles(),
                    SizeFormat.format(report.totalBytes()),
                    SizeFormat.format(report.diskUsage().potentialSavings()),
                    SizeFormat.format(report.duplicateStats().wastedBytes()));
        } catch (Exception ex) {
            LOGGER.error("Scan failed", ex);
            finished.countDown();
            System.exit(2);
        } finally {
            finished.countDown();
        }
    }

    private static final class LoggingListener implements ScanJob.Listener {
        @Override
        public void scanProgress(String currentPath, long fileCount) {
            LOGGER.debug("Scanned {} files ({})", fileCount, currentPath);
        }

        @Override
        public void emptyFolderProgress(String currentPath, long foldersChecked) {
            LOGGER.debug("Checked {} folders ({})", foldersChecked, currentPath);
        }

        @Override
        public void duplicateProgress(DuplicateStage stage, long current, long total) {
            LOGGER.debug("{}: {}/{}", stage, current, total);
        }
    }
}
