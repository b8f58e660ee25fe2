package eu.virtualparadox.docrag.ingest;

import eu.virtualparadox.docrag.application.config.ApplicationConfig;
import eu.virtualparadox.docrag.catalog.entity.IngestionRunEntity;
import eu.virtualparadox.docrag.catalog.service.IngestionCatalogService;
import eu.virtualparadox.docrag.exception.IndexUnavailableException;
import eu.virtualparadox.docrag.ingest.chunker.RecursiveChunker;
import eu.virtualparadox.docrag.ingest.extractor.PdfTextExtractor;
import eu.virtualparadox.docrag.ingest.extractor.PlainTextExtractor;
import eu.virtualparadox.docrag.ingest.identity.SegmentIdAssigner;
import eu.virtualparadox.docrag.rag.index.IndexSynchronizer;
import eu.virtualparadox.docrag.rag.index.LuceneVectorIndexClient;
import eu.virtualparadox.docrag.store.SegmentRow;
import eu.virtualparadox.docrag.support.InMemoryTabularStore;
import eu.virtualparadox.docrag.support.LetterHistogramEmbedding;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class IngestionPipelineTest {

    @Mock
    private IngestionCatalogService catalog;

    private InMemoryTabularStore store;
    private LetterHistogramEmbedding embedding;
    private LuceneVectorIndexClient client;
    private IngestionPipeline pipeline;
    private IngestionRunEntity run;

    @BeforeEach
    void setUp() {
        store = new InMemoryTabularStore();
        embedding = new LetterHistogramEmbedding();
        client = new LuceneVectorIndexClient(null, store);

        final ApplicationConfig config = new ApplicationConfig();
        config.setStoreLocation("segments");
        config.setIndexName("segments_index");

        pipeline = new IngestionPipeline(
                List.of(new PdfTextExtractor(), new PlainTextExtractor()),
                new RecursiveChunker(5, 0),
                new SegmentIdAssigner(),
                new IndexSynchronizer(store, client),
                embedding,
                catalog,
                config);

        run = IngestionRunEntity.builder().id("run-1").build();
        lenient().when(catalog.start(anyString(), eq("segments"), eq("segments_index"), eq(5), eq(0), eq("letter-histogram")))
                .thenReturn(run);
    }

    @AfterEach
    void tearDown() {
        client.close();
    }

    @Test
    @DisplayName("A text file is extracted, chunked, stored and indexed")
    void ingestsFile(@TempDir final Path dir) throws IOException {
        final Path file = dir.resolve("letters.txt");
        Files.writeString(file, "A.\n\nB.\n\nC.");

        final IngestionReport report = pipeline.ingest(file);

        assertThat(report.runId()).isEqualTo("run-1");
        assertThat(report.segments()).isEqualTo(3);
        assertThat(report.handle().indexName()).isEqualTo("segments_index");
        assertThat(store.read("segments")).containsExactly(
                new SegmentRow(1, "A."), new SegmentRow(2, "B."), new SegmentRow(3, "C."));
        assertThat(client.exists("segments_index")).isTrue();
        verify(catalog).markIndexed(same(run), eq(3), eq(report.handle().storeVersion()));
    }

    @Test
    @DisplayName("Already extracted text can be ingested directly")
    void ingestsText() {
        final IngestionReport report = pipeline.ingestText("inline", "A. B. C.");

        assertThat(report.segments()).isEqualTo(2);
        assertThat(store.read("segments")).extracting(SegmentRow::content).containsExactly("A. B.", "C.");
    }

    @Test
    @DisplayName("A failed index build is recorded and rethrown")
    void failureIsRecorded() {
        embedding.setUnreachable(true);

        assertThatThrownBy(() -> pipeline.ingestText("inline", "A.\n\nB."))
                .isInstanceOf(IndexUnavailableException.class);
        verify(catalog).markFailed(same(run), any(IndexUnavailableException.class));
        verify(catalog, never()).markIndexed(any(), anyInt(), anyLong());
    }

    @Test
    @DisplayName("Files no extractor understands are rejected before a run starts")
    void unsupportedFile() {
        assertThatThrownBy(() -> pipeline.ingest(Path.of("image.png")))
                .isInstanceOf(IllegalArgumentException.class);
        verify(catalog, never()).start(anyString(), anyString(), anyString(), anyInt(), anyInt(), anyString());
    }
}
