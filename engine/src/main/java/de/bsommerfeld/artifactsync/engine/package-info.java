/**
 * The polling engine.
 *
 * <pre>
 * SyncScheduler       loop thread, one cycle per poll interval
 * BranchSyncJob       check, download, extract, commit, retain for one branch
 * BranchLocks         at most one job per branch
 * extract/            zip extraction with an atomic directory swap
 * staging/            on-disk layout, crash sweep, retention
 * </pre>
 */
package de.bsommerfeld.artifactsync.engine;
