package com.example.spacefinder.smart;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EmptyFolderFinderTest {
    @Test
    void reportsFoldersWithoutFilesAtAnyDepth() throws Exception {
        Path root = Files.createTempDirectory("empty-folders");
        Path lonely = Files.createDirectory(root.resolve("lonely"));
        Path outer = Files.createDirectories(root.resolve("outer/inner/innermost"));
        Path inner = outer.getParent();
        Path wrapper = inner.getParent();
        Files.writeString(Files.createDirectories(root.resolve("full")).resolve("file.txt"), "x");
        Path mixed = Files.createDirectories(root.resolve("mixed/empty-child"));
        Files.writeString(root.resolve("mixed/deep-file.txt"), "x");

        List<Path> empty = new EmptyFolderFinder().findEmptyFolders(List.of(root), null, null);

        assertEquals(Set.of(lonely, outer, inner, wrapper, mixed), Set.copyOf(empty));
        assertTrue(empty.indexOf(outer) < empty.indexOf(inner));
        assertTrue(empty.indexOf(inner) < empty.indexOf(wrapper));
    }

    @Test
    void completelyEmptyRootIsReported() throws Exception {
        Path root = Files.createTempDirectory("empty-root");
        Files.createDirectories(root.resolve("a/b"));

        List<Path> empty = new EmptyFolderFinder().findEmptyFolders(List.of(root), null, null);

        assertEquals(List.of(root.resolve("a/b"), root.resolve("a"), root), empty);
    }

    @Test
    void systemFoldersAreNeverReportedAndKeepParentsOccupied() throws Exception {
        Path root = Files.createTempDirectory("empty-system");
        Path holder = Files.createDirectories(root.resolve("holder"));
        Files.createDirectories(holder.resolve("$RECYCLE.BIN/S-1-5"));

        List<Path> empty = new EmptyFolderFinder().findEmptyFolders(List.of(root), null, null);

        assertTrue(empty.isEmpty());
    }

    @Test
    void stopBeforeStartFindsNothing() throws Exception {
        Path root = Files.createTempDirectory("empty-stop");
        Files.createDirectories(root.resolve("a"));

        assertTrue(new EmptyFolderFinder().findEmptyFolders(List.of(root), null, () -> true).isEmpty());
        assertTrue(new EmptyFolderFinder().findEmptyFolders(List.of(root.resolve("missing")), null, null).isEmpty());
    }
}
