package de.bsommerfeld.artifactsync.repository.download;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class HashUtilTest {

    private static final String ABC_SHA256 = "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad";

    @TempDir
    Path tempDir;

    @Test
    void sha256_shouldHashBytes() {
        assertEquals(ABC_SHA256, HashUtil.sha256("abc".getBytes(StandardCharsets.US_ASCII)));
    }

    @Test
    void sha256_shouldHashFileLikeBytes() throws IOException {
        Path file = tempDir.resolve("abc.txt");
        Files.writeString(file, "abc", StandardCharsets.US_ASCII);

        assertEquals(ABC_SHA256, HashUtil.sha256(file));
    }

    @Test
    void sha256_shouldFailForMissingFile() {
        assertThrows(IOException.class, () -> HashUtil.sha256(tempDir.resolve("missing")));
    }
}
