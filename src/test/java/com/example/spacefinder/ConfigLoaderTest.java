package com.example.spacefinder;

import com.example.spacefinder.analysis.Category;
import com.example.spacefinder.analysis.SortKey;
import com.example.spacefinder.scan.FileScanner;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigLoaderTest {
    @Test
    void appliesDefaults() throws Exception {
        Path config = writeConfig("{\"roots\": [\"/data\"]}");

        SpaceFinderConfig loaded = new ConfigLoader().load(config);

        assertEquals(List.of(Path.of("/data")), loaded.roots());
        assertEquals(Path.of("output"), loaded.outputDirectory());
        assertFalse(loaded.followLinks());
        assertTrue(loaded.skipDirectoryNames().containsAll(FileScanner.DEFAULT_SKIP_DIRECTORIES));
        assertTrue(loaded.exclusions().isEmpty());
        assertTrue(loaded.categories().isEmpty());
        assertEquals(0L, loaded.minSizeBytes());
        assertEquals(0, loaded.minDaysOld());
        assertEquals(SortKey.SIZE, loaded.sortKey());
        assertTrue(loaded.descending());
        assertTrue(loaded.findDuplicates());
        assertFalse(loaded.findEmptyFolders());
        assertEquals(30, loaded.oldDownloadDays());
        assertEquals(1024L * 1024 * 1024, loaded.largeFolderThresholdBytes());
        assertFalse(loaded.exportCsv());
    }

    @Test
    void readsOverrides() throws Exception {
        Path config = writeConfig("""
                {
                  "roots": ["/data", "/media"],
                  "outputDirectory": "reports",
                  "skipDirectoryNames": ["node_modules", "Windows"],
                  "exclusions": ["/data/keep"],
                  "categories": ["video", "Audio"],
                  "minSize": "500 MB",
                  "minDaysOld": 90,
                  "sortBy": "name",
                  "findDuplicates": false,
                  "findEmptyFolders": true,
                  "oldDownloadDays": 7,
                  "largeFolderThreshold": 2048,
                  "exportCsv": true,
                  "somethingUnknown": 1
                }
                """);

        SpaceFinderConfig loaded = new ConfigLoader().load(config);

        assertEquals(2, loaded.roots().size());
        assertEquals(Path.of("reports"), loaded.outputDirectory());
        assertTrue(loaded.skipDirectoryNames().contains("node_modules"));
        assertEquals(1, loaded.skipDirectoryNames().stream().filter("Windows"::equals).count());
        assertEquals(List.of("/data/keep"), loaded.exclusions());
        assertEquals(List.of(Category.VIDEO, Category.AUDIO), loaded.categories());
        assertEquals(500L * 1024 * 1024, loaded.minSizeBytes());
        assertEquals(90, loaded.minDaysOld());
        assertEquals(SortKey.NAME, loaded.sortKey());
        assertFalse(loaded.descending());
        assertFalse(loaded.findDuplicates());
        assertTrue(loaded.findEmptyFolders());
        assertEquals(7, loaded.oldDownloadDays());
        assertEquals(2048L, loaded.largeFolderThresholdBytes());
        assertTrue(loaded.exportCsv());
    }

    @Test
    void rejectsInvalidConfigs() throws Exception {
        ConfigLoader loader = new ConfigLoader();

        assertThrows(IllegalArgumentException.class, () -> loader.load(writeConfig("{}")));
        assertThrows(IllegalArgumentException.class, () -> loader.load(writeConfig("{\"roots\": []}")));
        assertThrows(IllegalArgumentException.class,
                () -> loader.load(writeConfig("{\"roots\": [\"/d\"], \"categories\": [\"Spreadsheets\"]}")));
        assertThrows(IllegalArgumentException.class,
                () -> loader.load(writeConfig("{\"roots\": [\"/d\"], \"minSize\": \"huge\"}")));
        assertThrows(IllegalArgumentException.class,
                () -> loader.load(writeConfig("{\"roots\": [\"/d\"], \"minDaysOld\": -1}")));
    }

    private static Path writeConfig(String json) throws Exception {
        Path dir = Files.createTempDirectory("config-test");
        return Files.writeString(dir.resolve("config.json"), json);
    }
}
