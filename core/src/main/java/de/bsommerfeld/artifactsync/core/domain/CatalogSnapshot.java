package de.bsommerfeld.artifactsync.core.domain;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read-only view of the administration catalog taken once per cycle.
 * Changes made by administration while a cycle runs only become visible in
 * the next snapshot.
 */
public record CatalogSnapshot(List<Component> components, List<Branch> branches) {

    public CatalogSnapshot {
        components = List.copyOf(components);
        branches = List.copyOf(branches);
    }

    public static CatalogSnapshot empty() {
        return new CatalogSnapshot(List.of(), List.of());
    }

    /**
     * Returns every branch that must be polled this cycle: the component is
     * enabled and the branch is {@link BranchStatus#ACTIVE}. Branches whose
     * component is missing from the snapshot are dropped. The result is
     * ordered by component id, then branch id, so dispatch order is stable
     * between cycles.
     */
    public List<SyncTarget> activeTargets() {
        Map<Long, Component> byId = components.stream()
                .collect(Collectors.toMap(Component::id, Function.identity(), (a, b) -> a));

        List<SyncTarget> targets = new ArrayList<>();
        for (Branch branch : branches) {
            Component component = byId.get(branch.componentId());
            if (component == null || !component.enabled() || !branch.isActive()) continue;
            targets.add(new SyncTarget(component, branch));
        }
        targets.sort(Comparator.comparingLong((SyncTarget t) -> t.component().id())
                .thenComparingLong(SyncTarget::branchId));
        return targets;
    }
}
