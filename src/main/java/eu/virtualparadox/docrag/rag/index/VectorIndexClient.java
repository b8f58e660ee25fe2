package eu.virtualparadox.docrag.rag.index;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Named similarity-search indexes bound to locations of a tabular store.
 */
public interface VectorIndexClient {

    /**
     * Creates an empty index. It becomes searchable after {@link #triggerSync(String)}.
     *
     * @throws IllegalStateException    if an index with the same name exists, or the source
     *                                  location has no change tracking
     * @throws IllegalArgumentException if the definition is invalid
     */
    void create(final IndexDefinition definition);

    /**
     * Drops an index and its data.
     *
     * @return {@code false} if no such index existed
     */
    boolean delete(final String indexName);

    boolean exists(final String indexName);

    /**
     * Rebuilds the index from the current rows of its source location.
     *
     * @return status after the build
     * @throws eu.virtualparadox.docrag.exception.IndexUnavailableException if the index does not exist
     *         or the embedding capability or storage fails; the index is dropped in the latter case
     */
    IndexStatus triggerSync(final String indexName);

    Optional<IndexStatus> describe(final String indexName);

    /**
     * Nearest-neighbour query.
     *
     * @param indexName index to query
     * @param vector    query embedding
     * @param k         maximum number of hits ({@code > 0})
     * @param fields    columns to return
     * @return hits ordered by descending score, no duplicate primary keys
     * @throws eu.virtualparadox.docrag.exception.IndexUnavailableException if the index does not exist,
     *         is not built, or cannot be read
     */
    List<IndexedRow> query(final String indexName, final float[] vector, final int k, final Set<String> fields);
}
