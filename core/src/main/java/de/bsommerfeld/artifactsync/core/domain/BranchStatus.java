package de.bsommerfeld.artifactsync.core.domain;

import java.util.Locale;

/** Lifecycle of a branch. Only {@link #ACTIVE} branches are synchronized. */
public enum BranchStatus {

    ACTIVE,
    INACTIVE,
    ARCHIVED;

    /**
     * Parses the catalog value. Anything unknown is treated as
     * {@link #INACTIVE} so a typo never starts pulling builds.
     */
    public static BranchStatus fromString(String value) {
        if (value == null) return INACTIVE;
        try {
            return valueOf(value.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return INACTIVE;
        }
    }

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
