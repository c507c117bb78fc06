package de.bsommerfeld.artifactsync.launcher;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Parsed command line: {@code [--once | --status] [--config <file>]}.
 */
public record LaunchOptions(Mode mode, Optional<Path> configFile) {

    public enum Mode {
        /** Poll until stopped. */
        DAEMON,
        /** Run one cycle and exit. */
        ONCE,
        /** Print the ledger and exit. */
        STATUS
    }

    static final String USAGE = "Usage: artifact-sync [--once | --status] [--config <file>]";

    /**
     * @throws IllegalArgumentException for unknown or conflicting options
     */
    public static LaunchOptions parse(String... args) {
        Mode mode = Mode.DAEMON;
        Path config = null;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--once", "--status" -> {
                    if (mode != Mode.DAEMON) {
                        throw new IllegalArgumentException("--once and --status are mutually exclusive");
                    }
                    mode = arg.equals("--once") ? Mode.ONCE : Mode.STATUS;
                }
                case "--config" -> {
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("--config needs a file argument");
                    }
                    config = Path.of(args[++i]);
                }
                default -> throw new IllegalArgumentException("Unknown option: " + arg);
            }
        }
        return new LaunchOptions(mode, Optional.ofNullable(config));
    }
}
