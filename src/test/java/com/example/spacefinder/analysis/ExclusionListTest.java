package com.example.spacefinder.analysis;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExclusionListTest {
    @Test
    void matchesPrefixOnSeparatorBoundary() {
        ExclusionList exclusions = ExclusionList.of(List.of("C:\\Data"));

        assertTrue(exclusions.isExcluded("C:\\Data"));
        assertTrue(exclusions.isExcluded("c:\\data\\report.pdf"));
        assertFalse(exclusions.isExcluded("C:\\Database\\report.pdf"));
    }

    @Test
    void ignoresBlankEntriesAndTrailingSeparators() {
        ExclusionList exclusions = ExclusionList.of(Arrays.asList("/home/u/keep/", " ", null, "/home/u/keep"));

        assertEquals(List.of("/home/u/keep"), exclusions.prefixes());
        assertTrue(exclusions.isExcluded("/home/u/keep/a/b.txt"));
        assertFalse(exclusions.isExcluded("/home/u/keeper.txt"));
    }

    @Test
    void rootExcludesEverything() {
        assertTrue(ExclusionList.of(List.of("/")).isExcluded("/any/file"));
        assertFalse(ExclusionList.EMPTY.isExcluded("/any/file"));
        assertTrue(ExclusionList.of(null).isEmpty());
    }
}
