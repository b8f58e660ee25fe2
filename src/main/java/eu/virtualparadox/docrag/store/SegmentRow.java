package eu.virtualparadox.docrag.store;

import eu.virtualparadox.docrag.ingest.model.Segment;

import java.util.Set;

/**
 * One row of the tabular segment store.
 *
 * @param id      primary key column
 * @param content text column, the one that gets embedded
 */
public record SegmentRow(long id, String content) {

    public static final String COLUMN_ID = "id";
    public static final String COLUMN_CONTENT = "content";
    public static final Set<String> COLUMNS = Set.of(COLUMN_ID, COLUMN_CONTENT);

    public static SegmentRow of(final Segment segment) {
        return new SegmentRow(segment.id(), segment.content());
    }

    /**
     * Reads a column by name.
     *
     * @param column one of {@link #COLUMNS}
     * @return column value
     * @throws IllegalArgumentException for unknown columns
     */
    public Object column(final String column) {
        return switch (column) {
            case COLUMN_ID -> id;
            case COLUMN_CONTENT -> content;
            default -> throw new IllegalArgumentException("Unknown column: " + column);
        };
    }
}
