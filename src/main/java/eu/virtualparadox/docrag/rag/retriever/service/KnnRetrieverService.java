package eu.virtualparadox.docrag.rag.retriever.service;

import eu.virtualparadox.docrag.exception.IndexUnavailableException;
import eu.virtualparadox.docrag.rag.index.IndexHandle;
import eu.virtualparadox.docrag.rag.index.IndexedRow;
import eu.virtualparadox.docrag.rag.index.VectorIndexClient;
import eu.virtualparadox.docrag.rag.retriever.model.RetrievalResult;
import eu.virtualparadox.docrag.rag.retriever.model.RetrievedSegment;
import eu.virtualparadox.docrag.store.SegmentRow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Provides semantic query capabilities over a synced index.
 * <p>
 * Steps:
 * <ol>
 *   <li>Embed the query with the capability carried by the {@link IndexHandle}</li>
 *   <li>Run a k-NN query against the index</li>
 *   <li>Convert the ranked rows into {@link RetrievedSegment}s</li>
 * </ol>
 * An index whose source moved on since its last build is still searched; results then reflect
 * the last completed build.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public final class KnnRetrieverService implements RetrieverService {

    private final VectorIndexClient indexClient;

    /**
     * Executes a semantic search against the index.
     *
     * @param handle  handle returned by the last successful sync
     * @param query   user input string
     * @param k       maximum number of results to return ({@code > 0})
     * @param columns columns to return, subset of {@link SegmentRow#COLUMNS}
     * @return up to {@code k} segments by descending score; fewer if the index holds fewer
     * @throws IndexUnavailableException if the index is missing or the embedding endpoint fails
     */
    @Override
    public RetrievalResult search(final IndexHandle handle,
                                  final String query,
                                  final int k,
                                  final Set<String> columns) {
        if (handle == null) {
            throw new IllegalArgumentException("handle must not be null");
        }
        if (query == null) {
            throw new IllegalArgumentException("query must not be null");
        }
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive, got " + k);
        }
        if (columns == null || columns.isEmpty()) {
            throw new IllegalArgumentException("at least one column must be requested");
        }

        final float[] vector;
        try {
            vector = handle.embedding().embed(query);
        }
        catch (final RuntimeException e) {
            throw new IndexUnavailableException(handle.indexName(),
                    "Embedding capability " + handle.embedding().modelId() + " failed for query", e);
        }

        // The index client returns at most one row per primary key.
        final List<IndexedRow> rows = indexClient.query(handle.indexName(), vector, k, columns);

        final List<RetrievedSegment> results = new ArrayList<>(rows.size());
        for (final IndexedRow row : rows) {
            results.add(new RetrievedSegment(
                    (Long) row.fields().get(SegmentRow.COLUMN_ID),
                    (String) row.fields().get(SegmentRow.COLUMN_CONTENT),
                    row.score()));
        }

        log.debug("Retrieved {} of k={} segments from {} for query '{}'", results.size(), k, handle.indexName(), query);
        return new RetrievalResult(results);
    }
}
