package de.bsommerfeld.artifactsync.core.util;

/**
 * Human-readable byte sizes for log lines and audit details.
 */
public final class ByteFormatter {

    private static final String[] UNITS = {"B", "KB", "MB", "GB", "TB"};

    private ByteFormatter() {}

    /**
     * Formats a byte count, e.g. {@code 14.3 MB}. Negative input yields
     * {@code ? B}.
     */
    public static String format(long bytes) {
        if (bytes < 0) return "? B";

        double value = bytes;
        int unit = 0;
        while (value >= 1024 && unit < UNITS.length - 1) {
            value /= 1024;
            unit++;
        }

        if (unit == 0) return bytes + " B";
        return String.format(java.util.Locale.ROOT, "%.1f %s", value, UNITS[unit]);
    }
}
