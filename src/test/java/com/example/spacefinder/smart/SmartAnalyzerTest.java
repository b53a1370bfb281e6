package com.example.spacefinder.smart;

import com.example.spacefinder.analysis.ClassifiedFile;
import com.example.spacefinder.analysis.FileAnalyzer;
import com.example.spacefinder.scan.FileRecord;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SmartAnalyzerTest {
    private static final Instant NOW = Instant.parse("2026-06-01T12:00:00Z");
    private static final long MIB = 1024L * 1024L;
    private static final long GIB = 1024L * MIB;

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final FileAnalyzer analyzer = new FileAnalyzer(clock);
    private final SmartAnalyzer smart = new SmartAnalyzer(clock);

    @Test
    void findsTempFilesByExtensionFolderAndUserCachePath() {
        List<ClassifiedFile> files = analyzer.analyze(List.of(
                file("/data/music/song.mp3", 10, 1),
                file("/data/music/crash.DMP", 10, 1),
                file("/home/u/project/node_modules/left-pad/index.js", 10, 1),
                file("C:\\Users\\bob\\AppData\\Local\\Google\\Chrome\\User Data\\Default\\Cache\\f_0001", 10, 1),
                file("/data/photos/Thumbs.db", 10, 1),
                file("/data/books/novel.pdf", 10, 1)
        ));

        List<ClassifiedFile> temp = smart.findTempFiles(files);

        assertEquals(List.of(
                "/data/music/crash.DMP",
                "/home/u/project/node_modules/left-pad/index.js",
                "C:\\Users\\bob\\AppData\\Local\\Google\\Chrome\\User Data\\Default\\Cache\\f_0001",
                "/data/photos/Thumbs.db"
        ), temp.stream().map(ClassifiedFile::path).toList());
    }

    @Test
    void findsDownloadsOlderThanThreshold() {
        List<ClassifiedFile> files = analyzer.analyze(List.of(
                file("/home/u/Downloads/installer.zip", 10, 40),
                file("/home/u/Downloads/recent.pdf", 10, 10),
                file("/home/u/Music/old.mp3", 10, 400),
                file("D:\\DOWNLOADS\\movie.mkv", 10, 31)
        ));

        assertEquals(List.of("/home/u/Downloads/installer.zip", "D:\\DOWNLOADS\\movie.mkv"),
                smart.findOldDownloads(files, SmartAnalyzer.DEFAULT_OLD_DOWNLOAD_DAYS).stream().map(ClassifiedFile::path).toList());
        assertEquals(3, smart.findOldDownloads(files, 5).size());
    }

    @Test
    void largeFoldersUseImmediateParentOnly() {
        List<ClassifiedFile> files = analyzer.analyze(List.of(
                file("/data/videos/a.mkv", GIB, 1),
                file("/data/videos/b.mkv", GIB, 1),
                file("/data/videos/sub/c.mkv", 500 * MIB, 1),
                file("/data/iso/disk.iso", 3 * GIB, 1),
                file("/data/small/readme.txt", 10, 1)
        ));

        List<FolderUsage> large = smart.findLargeFolders(files, SmartAnalyzer.DEFAULT_LARGE_FOLDER_BYTES);

        assertEquals(List.of(
                new FolderUsage("/data/iso", 3 * GIB, 1),
                new FolderUsage("/data/videos", 2 * GIB, 2)
        ), large);
    }

    @Test
    void savingsCountOverlappingFilesOnce() {
        List<ClassifiedFile> files = analyzer.analyze(List.of(
                file("/home/u/Downloads/setup.tmp", 100, 60),
                file("/home/u/Downloads/archive.zip", 1000, 60),
                file("/srv/logs/app.log", 10, 1),
                file("/home/u/Documents/cv.docx", 5000, 900)
        ));

        DiskUsageReport report = smart.analyzeDiskUsage(files);

        assertEquals(110L, report.tempBytes());
        assertEquals(1100L, report.downloadBytes());
        assertEquals(1110L, report.potentialSavings());
        assertTrue(report.largeFolders().isEmpty());
    }

    @Test
    void parentOfHandlesBothSeparators() {
        assertEquals("/data/videos", SmartAnalyzer.parentOf("/data/videos/a.mkv"));
        assertEquals("C:\\Users\\bob", SmartAnalyzer.parentOf("C:\\Users\\bob\\a.txt"));
        assertEquals("/", SmartAnalyzer.parentOf("/a.txt"));
        assertEquals("", SmartAnalyzer.parentOf("a.txt"));
    }

    @Test
    void regularFilesAreNotTemp() {
        ClassifiedFile plain = analyzer.analyze(List.of(file("/data/books/novel.pdf", 10, 1))).get(0);
        assertFalse(smart.isTempFile(plain));
    }

    private static FileRecord file(String path, long size, int daysSinceAccess) {
        String name = path.substring(Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\')) + 1);
        Instant accessed = NOW.minus(Duration.ofDays(daysSinceAccess));
        return FileRecord.of(path, name, size, accessed, accessed);
    }
}
