package de.bsommerfeld.artifactsync.engine.extract;

import java.nio.file.Path;

/**
 * Outcome of a successful extraction.
 *
 * @param directory the swapped-in target directory
 * @param files     regular files written
 * @param bytes     uncompressed bytes written
 */
public record ExtractionResult(Path directory, int files, long bytes) {
}
