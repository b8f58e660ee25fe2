package eu.virtualparadox.docrag.rag.index;

import eu.virtualparadox.docrag.ingest.model.Segment;
import eu.virtualparadox.docrag.rag.embed.EmbeddingCapability;
import eu.virtualparadox.docrag.store.EWriteMode;
import eu.virtualparadox.docrag.store.SegmentRow;
import eu.virtualparadox.docrag.store.TabularStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Publishes a segment collection as a new, fully replaced index generation.
 * <ol>
 *   <li>Overwrite the {@code (id, content)} rows at the store location</li>
 *   <li>Enable change tracking on the location</li>
 *   <li>Drop the previous index if any, create it again with {@link ESyncMode#TRIGGERED} sync
 *       and trigger the build</li>
 * </ol>
 * If the build fails the store rows stay in place and the call can simply be repeated.
 * Callers must not run two syncs on the same location concurrently.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IndexSynchronizer {

    private final TabularStore store;
    private final VectorIndexClient indexClient;

    /**
     * @param segments      segments of one ingestion run (non-null, may be empty)
     * @param storeLocation store location to overwrite
     * @param indexName     index to (re)create over the location
     * @param embedding     capability used to embed {@code content}, carried in the returned handle
     * @return handle for querying the new generation
     * @throws eu.virtualparadox.docrag.exception.IndexUnavailableException if the index build fails
     */
    public IndexHandle sync(final List<Segment> segments,
                            final String storeLocation,
                            final String indexName,
                            final EmbeddingCapability embedding) {
        if (segments == null) {
            throw new IllegalArgumentException("segments must not be null");
        }
        if (embedding == null) {
            throw new IllegalArgumentException("embedding capability must not be null");
        }

        // 1) persist the new generation
        final List<SegmentRow> rows = segments.stream().map(SegmentRow::of).toList();
        store.write(storeLocation, rows, EWriteMode.OVERWRITE);

        // 2) change tracking lets the index detect the overwrite as one batch
        store.enableChangeTracking(storeLocation);

        // 3) tear down and rebuild the index
        if (indexClient.delete(indexName)) {
            log.info("Dropped previous generation of index {}", indexName);
        }
        indexClient.create(new IndexDefinition(
                indexName,
                storeLocation,
                SegmentRow.COLUMN_CONTENT,
                SegmentRow.COLUMN_ID,
                ESyncMode.TRIGGERED,
                embedding));

        final IndexStatus status = indexClient.triggerSync(indexName);
        log.info("Synced {} segments from {} into {}", status.documentCount(), storeLocation, indexName);

        return new IndexHandle(indexName, storeLocation, embedding, status.indexedVersion());
    }
}
