package eu.virtualparadox.docrag.rag.retriever.model;

/**
 * @param id      Segment id, {@code null} when the id column was not requested.
 * @param content Segment text, {@code null} when the content column was not requested.
 * @param score   Similarity score as returned by Lucene (higher = better).
 */
public record RetrievedSegment(Long id, String content, float score) {

}
