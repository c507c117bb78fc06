package de.bsommerfeld.artifactsync.core.domain;

import java.util.Locale;

/**
 * Which part of a {@link VersionTuple} advances on a new release. Lower parts
 * are reset to zero, except for {@link #REVISION} which only bumps the last
 * part. {@link #BUILD} advances the patch part; the naming follows the
 * administration screens where "build" means a patch-level release.
 */
public enum AutoIncrement {

    MAJOR,
    MINOR,
    BUILD,
    REVISION;

    /**
     * @throws IllegalStateException if the part to advance is already
     *                               {@link Integer#MAX_VALUE}
     */
    public VersionTuple next(VersionTuple current) {
        try {
            return switch (this) {
                case MAJOR -> new VersionTuple(Math.addExact(current.major(), 1), 0, 0, 0);
                case MINOR -> new VersionTuple(current.major(), Math.addExact(current.minor(), 1), 0, 0);
                case BUILD -> new VersionTuple(current.major(), current.minor(), Math.addExact(current.patch(), 1), 0);
                case REVISION -> new VersionTuple(current.major(), current.minor(), current.patch(),
                        Math.addExact(current.build(), 1));
            };
        } catch (ArithmeticException e) {
            throw new IllegalStateException("Version " + current.render() + " cannot advance by " + name(), e);
        }
    }

    /**
     * Case-insensitive lookup of the stored policy name. Unknown or missing
     * values fall back to {@link #BUILD}, the catalog's column default.
     */
    public static AutoIncrement fromString(String value) {
        if (value == null || value.isBlank()) return BUILD;
        try {
            return valueOf(value.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return BUILD;
        }
    }
}
