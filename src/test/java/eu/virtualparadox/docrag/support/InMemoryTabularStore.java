package eu.virtualparadox.docrag.support;

import eu.virtualparadox.docrag.store.EWriteMode;
import eu.virtualparadox.docrag.store.SegmentRow;
import eu.virtualparadox.docrag.store.TabularStore;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Map-backed {@link TabularStore} for tests that do not need a database. Safe for concurrent use.
 */
public class InMemoryTabularStore implements TabularStore {

    private final Map<String, List<SegmentRow>> rows = new HashMap<>();
    private final Map<String, Long> versions = new HashMap<>();
    private final Set<String> tracked = new HashSet<>();
    private boolean unreachable;

    public synchronized void setUnreachable(final boolean unreachable) {
        this.unreachable = unreachable;
    }

    @Override
    public synchronized void write(final String location, final List<SegmentRow> newRows, final EWriteMode mode) {
        checkReachable();
        final List<SegmentRow> target = mode == EWriteMode.OVERWRITE
                ? new ArrayList<>()
                : new ArrayList<>(rows.getOrDefault(location, List.of()));
        target.addAll(newRows);
        target.sort(Comparator.comparingLong(SegmentRow::id));
        rows.put(location, target);
        versions.merge(location, 1L, Long::sum);
    }

    @Override
    public synchronized void enableChangeTracking(final String location) {
        checkReachable();
        if (!versions.containsKey(location)) {
            throw new IllegalArgumentException("Unknown store location: " + location);
        }
        tracked.add(location);
    }

    @Override
    public synchronized boolean isChangeTrackingEnabled(final String location) {
        return tracked.contains(location);
    }

    @Override
    public synchronized List<SegmentRow> read(final String location) {
        checkReachable();
        return List.copyOf(rows.getOrDefault(location, List.of()));
    }

    @Override
    public synchronized long changeVersion(final String location) {
        checkReachable();
        return versions.getOrDefault(location, 0L);
    }

    private void checkReachable() {
        if (unreachable) {
            throw new IllegalStateException("store offline");
        }
    }
}
