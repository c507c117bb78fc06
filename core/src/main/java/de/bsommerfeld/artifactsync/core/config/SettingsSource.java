package de.bsommerfeld.artifactsync.core.config;

/**
 * Supplies the configuration snapshot for the next cycle. Implementations
 * may reload from disk; callers must not cache the result across cycles.
 */
@FunctionalInterface
public interface SettingsSource {

    SyncSettings current();
}
