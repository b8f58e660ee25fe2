package eu.virtualparadox.docrag.store.jpa;

import eu.virtualparadox.docrag.store.EWriteMode;
import eu.virtualparadox.docrag.store.SegmentRow;
import eu.virtualparadox.docrag.store.TabularStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * {@link TabularStore} persisted in the relational database (H2) through Spring Data JPA.
 * <p>
 * Rows of every location live in one table keyed by {@code (location, segment_id)}; per-location
 * bookkeeping (change tracking flag, change version, row count) lives in {@code store_locations}.
 * Each write runs in a single transaction, so readers see either the previous generation or the
 * new one, never a mix.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaTabularStore implements TabularStore {

    private final SegmentRowRepository rowRepository;
    private final StoreLocationRepository locationRepository;

    @Override
    @Transactional
    public void write(final String location, final List<SegmentRow> rows, final EWriteMode mode) {
        requireLocation(location);
        if (rows == null) {
            throw new IllegalArgumentException("rows must not be null");
        }
        if (mode == null) {
            throw new IllegalArgumentException("mode must not be null");
        }

        if (mode == EWriteMode.OVERWRITE) {
            final int removed = rowRepository.deleteAllByLocation(location);
            log.debug("Removed {} rows of previous generation at {}", removed, location);
        }

        rowRepository.saveAll(rows.stream()
                .map(r -> SegmentRowEntity.builder()
                        .location(location)
                        .segmentId(r.id())
                        .content(r.content())
                        .build())
                .toList());

        final StoreLocationEntity state = locationRepository.findById(location)
                .orElseGet(() -> StoreLocationEntity.builder()
                        .location(location)
                        .changeTracking(false)
                        .changeVersion(0)
                        .build());
        state.setChangeVersion(state.getChangeVersion() + 1);
        state.setRowCount(rowRepository.countByLocation(location));
        state.setUpdatedAt(Instant.now());
        locationRepository.save(state);

        log.info("Wrote {} rows to {} ({}), change version {}", rows.size(), location, mode, state.getChangeVersion());
    }

    @Override
    @Transactional
    public void enableChangeTracking(final String location) {
        requireLocation(location);
        final StoreLocationEntity state = locationRepository.findById(location)
                .orElseThrow(() -> new IllegalArgumentException("Unknown store location: " + location));
        if (!state.isChangeTracking()) {
            state.setChangeTracking(true);
            locationRepository.save(state);
            log.info("Change tracking enabled for {}", location);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public boolean isChangeTrackingEnabled(final String location) {
        return locationRepository.findById(location)
                .map(StoreLocationEntity::isChangeTracking)
                .orElse(false);
    }

    @Override
    @Transactional(readOnly = true)
    public List<SegmentRow> read(final String location) {
        return rowRepository.findByLocationOrderBySegmentIdAsc(location).stream()
                .map(e -> new SegmentRow(e.getSegmentId(), e.getContent()))
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public long changeVersion(final String location) {
        return locationRepository.findById(location)
                .map(StoreLocationEntity::getChangeVersion)
                .orElse(0L);
    }

    private static void requireLocation(final String location) {
        if (location == null || location.isBlank()) {
            throw new IllegalArgumentException("location must not be blank");
        }
    }
}
