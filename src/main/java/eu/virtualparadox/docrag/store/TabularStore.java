package eu.virtualparadox.docrag.store;

import java.util.List;

/**
 * Durable table of segment rows, addressed by a location name.
 * <p>
 * Every successful {@link #write} is one change batch: it is applied atomically and bumps the
 * location's change version by exactly one, which lets an index detect that its source moved on.
 */
public interface TabularStore {

    /**
     * Writes rows to a location.
     *
     * @param location store location name (non-blank)
     * @param rows     rows to write (non-null, may be empty)
     * @param mode     {@link EWriteMode#OVERWRITE} replaces all prior rows of the location
     */
    void write(final String location, final List<SegmentRow> rows, final EWriteMode mode);

    /**
     * Turns on change tracking for a location. Idempotent.
     *
     * @param location store location name
     * @throws IllegalArgumentException if the location was never written
     */
    void enableChangeTracking(final String location);

    boolean isChangeTrackingEnabled(final String location);

    /**
     * @param location store location name
     * @return rows ordered by id; empty for unknown locations
     */
    List<SegmentRow> read(final String location);

    /**
     * @param location store location name
     * @return number of change batches applied so far, {@code 0} for unknown locations
     */
    long changeVersion(final String location);
}
