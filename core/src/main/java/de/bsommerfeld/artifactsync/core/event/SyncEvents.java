package de.bsommerfeld.artifactsync.core.event;

import de.bsommerfeld.artifactsync.core.domain.PackagingRequest;

/**
 * Events published by the sync engine.
 */
public final class SyncEvents {

    private SyncEvents() {
    }

    /**
     * A build was downloaded, extracted and committed to the ledger. Posted
     * after the ledger commit, never before.
     */
    public record BuildStagedEvent(PackagingRequest request) {
    }
}
