package eu.virtualparadox.docrag.ingest.model;

/**
 * Immutable slice of the ingested document.
 *
 * @param id      ordered, unique key starting at 1
 * @param content segment text as produced by the chunker
 */
public record Segment(long id, String content) {

    public Segment {
        if (id < 1) {
            throw new IllegalArgumentException("Segment id must be >= 1, got " + id);
        }
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
    }
}
