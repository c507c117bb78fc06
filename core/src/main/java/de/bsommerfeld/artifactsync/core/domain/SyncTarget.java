package de.bsommerfeld.artifactsync.core.domain;

/**
 * One unit of synchronization work: a branch together with its owning
 * component. Created from a {@link CatalogSnapshot} at the start of each
 * cycle.
 */
public record SyncTarget(Component component, Branch branch) {

    public long branchId() {
        return branch.id();
    }

    /** Human-readable label for logs, e.g. {@code PaymentService/develop}. */
    public String label() {
        return component.name() + "/" + branch.name();
    }
}
