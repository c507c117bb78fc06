package de.bsommerfeld.artifactsync.launcher;

import com.google.inject.Inject;
import de.bsommerfeld.artifactsync.core.domain.CatalogSnapshot;
import de.bsommerfeld.artifactsync.core.domain.Component;
import de.bsommerfeld.artifactsync.core.domain.LedgerEntry;
import de.bsommerfeld.artifactsync.core.domain.SyncTarget;
import de.bsommerfeld.artifactsync.core.error.CatalogUnavailableException;
import de.bsommerfeld.artifactsync.db.DatabaseService;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Text table of every ledger entry with the branch's version and its check
 * and success times. Branches missing from the catalog are shown by id.
 */
public class StatusReport {

    private static final String ROW = "%-40s %-12s %-18s %-22s %-22s";

    private final DatabaseService database;

    @Inject
    public StatusReport(DatabaseService database) {
        this.database = database;
    }

    public List<String> render() {
        Map<Long, SyncTarget> targets;
        try {
            targets = byBranchId(database.loadCatalog());
        } catch (CatalogUnavailableException e) {
            targets = Map.of();
        }

        List<String> lines = new ArrayList<>();
        lines.add(String.format(ROW, "BRANCH", "VERSION", "LATEST BUILD", "LAST CHECKED", "LAST SUCCESS"));
        for (LedgerEntry entry : database.getLedgerEntries()) {
            SyncTarget target = targets.get(entry.branchId());
            lines.add(String.format(ROW,
                    target == null ? "#" + entry.branchId() : target.label(),
                    target == null ? "-" : target.branch().version().render(),
                    entry.latest().map(Object::toString).orElse("-"),
                    time(entry.lastChecked()),
                    time(entry.lastSuccess())));
        }
        lines.add(database.getPendingPackaging().size() + " packaging request(s) pending");
        return lines;
    }

    private static Map<Long, SyncTarget> byBranchId(CatalogSnapshot catalog) {
        Map<Long, Component> components = catalog.components().stream()
                .collect(Collectors.toMap(Component::id, Function.identity(), (a, b) -> a));
        return catalog.branches().stream()
                .filter(b -> components.containsKey(b.componentId()))
                .map(b -> new SyncTarget(components.get(b.componentId()), b))
                .collect(Collectors.toMap(SyncTarget::branchId, Function.identity(), (a, b) -> a));
    }

    private static String time(Instant instant) {
        return instant == null ? "-" : instant.toString();
    }
}
