package de.bsommerfeld.artifactsync.engine;

import com.google.inject.Singleton;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * At most one job per branch. A job that cannot acquire the lock is skipped,
 * never queued behind the running one.
 */
@Singleton
public class BranchLocks {

    private final Set<Long> held = ConcurrentHashMap.newKeySet();

    public boolean tryAcquire(long branchId) {
        return held.add(branchId);
    }

    public void release(long branchId) {
        held.remove(branchId);
    }

    public boolean isHeld(long branchId) {
        return held.contains(branchId);
    }
}
