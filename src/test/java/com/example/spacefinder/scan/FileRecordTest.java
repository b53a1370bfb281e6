package com.example.spacefinder.scan;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FileRecordTest {
    @Test
    void derivesLowerCasedExtension() {
        assertEquals(".mp4", FileRecord.extensionOf("Holiday.MP4"));
        assertEquals(".gz", FileRecord.extensionOf("backup.tar.gz"));
        assertEquals("", FileRecord.extensionOf("Makefile"));
        assertEquals("", FileRecord.extensionOf(".bashrc"));
        assertEquals("", FileRecord.extensionOf("trailing."));
    }

    @Test
    void rejectsNegativeSize() {
        Instant now = Instant.now();
        assertThrows(IllegalArgumentException.class, () -> FileRecord.of("/a", "a", -1L, now, now));
    }
}
