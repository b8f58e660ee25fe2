package eu.virtualparadox.docrag.rag.retriever.model;

import java.util.List;

/**
 * Segments ordered by descending score, at most {@code k} of them, no duplicate ids.
 */
public record RetrievalResult(List<RetrievedSegment> segments) {

    public RetrievalResult {
        segments = List.copyOf(segments);
    }

    public static RetrievalResult empty() {
        return new RetrievalResult(List.of());
    }

    public boolean isEmpty() {
        return segments.isEmpty();
    }

    public int size() {
        return segments.size();
    }
}
