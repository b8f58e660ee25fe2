package eu.virtualparadox.docrag.rag.index;

import eu.virtualparadox.docrag.exception.IndexUnavailableException;
import eu.virtualparadox.docrag.ingest.model.Segment;
import eu.virtualparadox.docrag.store.SegmentRow;
import eu.virtualparadox.docrag.support.InMemoryTabularStore;
import eu.virtualparadox.docrag.support.LetterHistogramEmbedding;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IndexSynchronizerTest {

    private static final String LOCATION = "segments";
    private static final String INDEX = "segments_index";
    private static final Set<String> ALL = Set.of(SegmentRow.COLUMN_ID, SegmentRow.COLUMN_CONTENT);

    private InMemoryTabularStore store;
    private LetterHistogramEmbedding embedding;
    private LuceneVectorIndexClient client;
    private IndexSynchronizer synchronizer;

    @BeforeEach
    void setUp() {
        store = new InMemoryTabularStore();
        embedding = new LetterHistogramEmbedding();
        client = new LuceneVectorIndexClient(null, store);
        synchronizer = new IndexSynchronizer(store, client);
    }

    @AfterEach
    void tearDown() {
        client.close();
    }

    private static List<Segment> segments(final String... contents) {
        final Segment[] out = new Segment[contents.length];
        for (int i = 0; i < contents.length; i++) {
            out[i] = new Segment(i + 1, contents[i]);
        }
        return List.of(out);
    }

    @Test
    @DisplayName("Sync persists rows, enables change tracking and publishes a ready index")
    void syncPublishesGeneration() {
        final IndexHandle handle = synchronizer.sync(segments("A.", "B.", "C."), LOCATION, INDEX, embedding);

        assertThat(handle.indexName()).isEqualTo(INDEX);
        assertThat(handle.sourceLocation()).isEqualTo(LOCATION);
        assertThat(handle.embedding()).isSameAs(embedding);
        assertThat(handle.storeVersion()).isEqualTo(store.changeVersion(LOCATION));

        assertThat(store.read(LOCATION)).containsExactly(
                new SegmentRow(1, "A."), new SegmentRow(2, "B."), new SegmentRow(3, "C."));
        assertThat(store.isChangeTrackingEnabled(LOCATION)).isTrue();
        assertThat(client.describe(INDEX)).get().extracting(IndexStatus::state).isEqualTo(EIndexState.READY);

        final List<IndexedRow> rows = client.query(INDEX, embedding.embed("C"), 3, ALL);
        assertThat(rows).extracting(r -> r.fields().get(SegmentRow.COLUMN_ID))
                .containsExactlyInAnyOrder(1L, 2L, 3L);
    }

    @Test
    @DisplayName("A second sync fully replaces the first generation")
    void secondSyncReplacesFirst() {
        synchronizer.sync(segments("alpha", "beta", "gamma", "delta", "epsilon"), LOCATION, INDEX, embedding);
        synchronizer.sync(segments("one", "two"), LOCATION, INDEX, embedding);

        final List<IndexedRow> rows = client.query(INDEX, embedding.embed("alpha"), 10, ALL);

        assertThat(rows).extracting(r -> r.fields().get(SegmentRow.COLUMN_ID)).containsExactlyInAnyOrder(1L, 2L);
        assertThat(rows).extracting(r -> r.fields().get(SegmentRow.COLUMN_CONTENT)).containsExactlyInAnyOrder("one", "two");
        assertThat(store.read(LOCATION)).hasSize(2);
    }

    @Test
    @DisplayName("Syncing an empty collection publishes an empty index")
    void emptyCollection() {
        synchronizer.sync(List.of(), LOCATION, INDEX, embedding);

        assertThat(client.query(INDEX, embedding.embed("anything"), 5, ALL)).isEmpty();
    }

    @Test
    @DisplayName("A failed build keeps the store rows and can simply be retried")
    void failedBuildCanBeRetried() {
        embedding.setUnreachable(true);

        assertThatThrownBy(() -> synchronizer.sync(segments("A.", "B."), LOCATION, INDEX, embedding))
                .isInstanceOf(IndexUnavailableException.class);
        assertThat(store.read(LOCATION)).hasSize(2);
        assertThat(client.exists(INDEX)).isFalse();

        embedding.setUnreachable(false);
        synchronizer.sync(segments("A.", "B."), LOCATION, INDEX, embedding);
        assertThat(client.query(INDEX, embedding.embed("A"), 2, ALL)).hasSize(2);
    }

    @Test
    @DisplayName("Null inputs are rejected before touching the store")
    void nullInputs() {
        assertThatThrownBy(() -> synchronizer.sync(null, LOCATION, INDEX, embedding))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> synchronizer.sync(List.of(), LOCATION, INDEX, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(store.changeVersion(LOCATION)).isZero();
    }
}
