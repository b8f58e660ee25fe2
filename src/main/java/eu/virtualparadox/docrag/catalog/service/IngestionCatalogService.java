package eu.virtualparadox.docrag.catalog.service;

import eu.virtualparadox.docrag.catalog.EIngestionStatus;
import eu.virtualparadox.docrag.catalog.entity.IngestionRunEntity;
import eu.virtualparadox.docrag.catalog.repo.IngestionRunRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Keeps a record of every ingestion run.
 * <p>
 * A run is registered as {@link EIngestionStatus#RUNNING} before extraction starts and is
 * closed as either {@link EIngestionStatus#INDEXED} or {@link EIngestionStatus#FAILED}.
 * The catalog is bookkeeping only; the store and the index stay the source of truth.
 */
@Service
@RequiredArgsConstructor
public class IngestionCatalogService {

    /** Longest error message kept, matches the column length. */
    private static final int MAX_ERROR_LENGTH = 2048;

    private final IngestionRunRepository repository;

    /**
     * Registers a new run.
     *
     * @param source        human-readable source (file path or name)
     * @param storeLocation target store location
     * @param indexName     target index
     * @param chunkSize     chunker size limit
     * @param chunkOverlap  chunker overlap
     * @param embedModel    embedding model identifier
     * @return the persisted run
     */
    @Transactional
    public IngestionRunEntity start(final String source,
                                    final String storeLocation,
                                    final String indexName,
                                    final int chunkSize,
                                    final int chunkOverlap,
                                    final String embedModel) {
        final IngestionRunEntity run = IngestionRunEntity.builder()
                .id(generateId())
                .source(source)
                .storeLocation(storeLocation)
                .indexName(indexName)
                .chunkSize(chunkSize)
                .chunkOverlap(chunkOverlap)
                .embedModel(embedModel)
                .segments(0)
                .status(EIngestionStatus.RUNNING)
                .startedAt(Instant.now())
                .build();
        return repository.save(run);
    }

    @Transactional
    public IngestionRunEntity markIndexed(final IngestionRunEntity run, final int segments, final long storeVersion) {
        run.setSegments(segments);
        run.setStoreVersion(storeVersion);
        run.setStatus(EIngestionStatus.INDEXED);
        run.setFinishedAt(Instant.now());
        return repository.save(run);
    }

    @Transactional
    public IngestionRunEntity markFailed(final IngestionRunEntity run, final Throwable error) {
        run.setStatus(EIngestionStatus.FAILED);
        run.setError(truncate(String.valueOf(error.getMessage())));
        run.setFinishedAt(Instant.now());
        return repository.save(run);
    }

    @Transactional(readOnly = true)
    public List<IngestionRunEntity> listAll() {
        return repository.findAllByOrderByStartedAtDesc();
    }

    /**
     * @param indexName index name
     * @return the most recently finished successful run for the index
     */
    @Transactional(readOnly = true)
    public Optional<IngestionRunEntity> latestIndexed(final String indexName) {
        return repository.findFirstByIndexNameAndStatusOrderByFinishedAtDesc(indexName, EIngestionStatus.INDEXED);
    }

    /**
     * Random UUID with the dashes removed.
     */
    private String generateId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    private static String truncate(final String message) {
        return message.length() <= MAX_ERROR_LENGTH ? message : message.substring(0, MAX_ERROR_LENGTH);
    }
}
