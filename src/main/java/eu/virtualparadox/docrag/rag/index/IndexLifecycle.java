package eu.virtualparadox.docrag.rag.index;

import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static eu.virtualparadox.docrag.rag.index.EIndexState.*;

/**
 * State machine of one named vector index.
 * <pre>
 *   ABSENT   -> BUILDING            (create)
 *   BUILDING -> READY | ABSENT      (build succeeded | build failed or delete)
 *   READY    -> STALE | BUILDING | ABSENT
 *   STALE    -> BUILDING | ABSENT
 * </pre>
 * Only {@link EIndexState#READY} and {@link EIndexState#STALE} indexes can be queried.
 */
@Slf4j
public final class IndexLifecycle {

    private static final Map<EIndexState, Set<EIndexState>> TRANSITIONS = new EnumMap<>(EIndexState.class);

    static {
        TRANSITIONS.put(ABSENT, EnumSet.of(BUILDING));
        TRANSITIONS.put(BUILDING, EnumSet.of(READY, ABSENT));
        TRANSITIONS.put(READY, EnumSet.of(STALE, BUILDING, ABSENT));
        TRANSITIONS.put(STALE, EnumSet.of(BUILDING, ABSENT));
    }

    private final String indexName;
    private EIndexState state = ABSENT;

    public IndexLifecycle(final String indexName) {
        this.indexName = indexName;
    }

    public synchronized EIndexState state() {
        return state;
    }

    public synchronized boolean isQueryable() {
        return state == READY || state == STALE;
    }

    /**
     * Moves to {@code target}.
     *
     * @throws IllegalStateException if the transition is not allowed from the current state
     */
    public synchronized void transition(final EIndexState target) {
        if (!TRANSITIONS.get(state).contains(target)) {
            throw new IllegalStateException(
                    "Index " + indexName + " cannot move from " + state + " to " + target);
        }
        log.debug("Index {}: {} -> {}", indexName, state, target);
        state = target;
    }

    /**
     * Moves to {@code target} only if the current state is {@code expected}.
     *
     * @return {@code true} if the transition happened
     */
    public synchronized boolean transitionIf(final EIndexState expected, final EIndexState target) {
        if (state != expected) {
            return false;
        }
        transition(target);
        return true;
    }
}
