package de.bsommerfeld.artifactsync.repository;

import de.bsommerfeld.artifactsync.core.config.SyncSettings;

/**
 * Creates a {@link RepositoryClient} bound to one configuration snapshot.
 * The scheduler asks for a client once per cycle so a changed URL or
 * credential takes effect at the next cycle boundary.
 */
@FunctionalInterface
public interface RepositoryClientFactory {

    RepositoryClient create(SyncSettings settings);
}
