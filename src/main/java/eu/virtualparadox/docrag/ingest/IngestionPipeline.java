package eu.virtualparadox.docrag.ingest;

import eu.virtualparadox.docrag.application.config.ApplicationConfig;
import eu.virtualparadox.docrag.catalog.entity.IngestionRunEntity;
import eu.virtualparadox.docrag.catalog.service.IngestionCatalogService;
import eu.virtualparadox.docrag.ingest.chunker.RecursiveChunker;
import eu.virtualparadox.docrag.ingest.extractor.TextExtractor;
import eu.virtualparadox.docrag.ingest.identity.SegmentIdAssigner;
import eu.virtualparadox.docrag.ingest.model.Segment;
import eu.virtualparadox.docrag.rag.embed.EmbeddingCapability;
import eu.virtualparadox.docrag.rag.index.IndexHandle;
import eu.virtualparadox.docrag.rag.index.IndexSynchronizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.function.Supplier;

/**
 * Orchestrates one ingestion run:
 * <ol>
 *     <li>Extract the document into a single text</li>
 *     <li>Chunk the text into overlapping segments</li>
 *     <li>Assign segment ids {@code 1..N}</li>
 *     <li>Overwrite the store location and rebuild the index</li>
 *     <li>Record the run in the catalog</li>
 * </ol>
 * <p>
 * Steps run strictly in sequence on the calling thread. Any failure aborts the run, is recorded
 * as {@code FAILED} and rethrown unchanged.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionPipeline {

    private final List<TextExtractor> extractors;
    private final RecursiveChunker chunker;
    private final SegmentIdAssigner idAssigner;
    private final IndexSynchronizer synchronizer;
    private final EmbeddingCapability embedding;
    private final IngestionCatalogService catalog;
    private final ApplicationConfig config;

    /**
     * Ingests a document file.
     *
     * @param source path of the document
     * @return report of the completed run
     * @throws IllegalArgumentException if no extractor supports the file
     */
    public IngestionReport ingest(final Path source) {
        final TextExtractor extractor = extractors.stream()
                .filter(e -> e.supports(source))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No extractor supports " + source));

        return run(source.toString(), () -> extractor.extract(source));
    }

    /**
     * Ingests text that was already extracted.
     *
     * @param sourceName name recorded in the catalog
     * @param text       document text
     * @return report of the completed run
     */
    public IngestionReport ingestText(final String sourceName, final String text) {
        return run(sourceName, () -> text);
    }

    private IngestionReport run(final String sourceName, final Supplier<String> extraction) {
        final String storeLocation = config.getStoreLocation();
        final String indexName = config.getIndexName();

        final IngestionRunEntity run = catalog.start(sourceName, storeLocation, indexName,
                chunker.getChunkSize(), chunker.getOverlap(), embedding.modelId());
        log.info("Ingestion {} started for {}", run.getId(), sourceName);

        try {
            // extract
            final String text = extraction.get();

            // chunk + ids
            final List<String> chunks = chunker.chunk(text);
            final List<Segment> segments = idAssigner.assignIds(chunks);
            log.info("Split {} characters into {} segments", text.length(), segments.size());

            // store + index
            final IndexHandle handle = synchronizer.sync(segments, storeLocation, indexName, embedding);

            catalog.markIndexed(run, segments.size(), handle.storeVersion());
            log.info("Ingestion {} completed: {} segments in {}", run.getId(), segments.size(), indexName);

            return new IngestionReport(run.getId(), segments.size(), handle);
        }
        catch (final RuntimeException e) {
            log.error("Ingestion {} failed for {}", run.getId(), sourceName, e);
            catalog.markFailed(run, e);
            throw e;
        }
    }
}
