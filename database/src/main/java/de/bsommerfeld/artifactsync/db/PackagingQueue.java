package de.bsommerfeld.artifactsync.db;

import com.google.common.eventbus.Subscribe;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.artifactsync.core.domain.PackagingRequest;
import de.bsommerfeld.artifactsync.core.event.ApplicationEventBus;
import de.bsommerfeld.artifactsync.core.event.SyncEvents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Turns {@link SyncEvents.BuildStagedEvent}s into {@code pending} rows of the
 * {@code packaging_queue} table, where the installer build picks them up.
 * Registers itself on the event bus on construction.
 */
@Singleton
public class PackagingQueue {

    private static final Logger LOG = LoggerFactory.getLogger(PackagingQueue.class);

    private final DatabaseService database;

    @Inject
    public PackagingQueue(DatabaseService database, ApplicationEventBus eventBus) {
        this.database = database;
        eventBus.register(this);
    }

    @Subscribe
    public void onBuildStaged(SyncEvents.BuildStagedEvent event) {
        PackagingRequest request = event.request();
        try {
            database.enqueuePackaging(request);
            LOG.info("Queued packaging for branch {} build {} ({} -> {})",
                    request.branchId(), request.build(), request.currentVersion(), request.proposedVersion());
        } catch (DatabaseException e) {
            LOG.error("Failed to queue packaging for branch {} build {}", request.branchId(), request.build(), e);
        }
    }

    public List<PackagingRequest> pending() {
        return database.getPendingPackaging();
    }
}
