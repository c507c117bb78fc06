package de.bsommerfeld.artifactsync.core.domain;

import java.util.Locale;

/** Pipeline stage an {@link AuditEntry} belongs to. */
public enum AuditCategory {

    DETECT,
    DOWNLOAD,
    EXTRACT,
    CLEANUP,
    ERROR;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AuditCategory fromDbValue(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
