package eu.virtualparadox.docrag.rag.index;

/**
 * Point-in-time view of an index.
 *
 * @param name           index name
 * @param sourceLocation store location the index is bound to
 * @param state          lifecycle state
 * @param indexedVersion store change version the searchable data was built from, {@code -1} if never built
 * @param documentCount  number of searchable rows
 */
public record IndexStatus(String name,
                          String sourceLocation,
                          EIndexState state,
                          long indexedVersion,
                          int documentCount) {
}
