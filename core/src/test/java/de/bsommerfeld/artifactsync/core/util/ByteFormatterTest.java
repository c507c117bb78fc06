package de.bsommerfeld.artifactsync.core.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ByteFormatterTest {

    @Test
    void format_shouldKeepSmallValuesInBytes() {
        assertEquals("0 B", ByteFormatter.format(0));
        assertEquals("1023 B", ByteFormatter.format(1023));
    }

    @Test
    void format_shouldScaleToLargerUnits() {
        assertEquals("1.0 KB", ByteFormatter.format(1024));
        assertEquals("1.5 MB", ByteFormatter.format(1024L * 1024 * 3 / 2));
        assertEquals("2.0 GB", ByteFormatter.format(2L * 1024 * 1024 * 1024));
    }

    @Test
    void format_shouldHandleNegative() {
        assertEquals("? B", ByteFormatter.format(-1));
    }
}
