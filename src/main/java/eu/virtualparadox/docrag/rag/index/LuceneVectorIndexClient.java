package eu.virtualparadox.docrag.rag.index;

import eu.virtualparadox.docrag.exception.IndexUnavailableException;
import eu.virtualparadox.docrag.rag.embed.EmbeddingCapability;
import eu.virtualparadox.docrag.store.SegmentRow;
import eu.virtualparadox.docrag.store.TabularStore;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.KnnFloatVectorField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.IndexableField;
import org.apache.lucene.index.SegmentInfos;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.KnnFloatVectorQuery;
import org.apache.lucene.search.MatchAllDocsQuery;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.AlreadyClosedException;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Stream;

import static eu.virtualparadox.docrag.util.LuceneConstants.FIELD_VECTOR;
import static eu.virtualparadox.docrag.util.LuceneConstants.VECTOR_SIMILARITY;

/**
 * Lucene-backed implementation of {@link VectorIndexClient} using the HNSW k-NN graph.
 * <p>
 * Every named index owns one Lucene directory, either {@code root/<name>} on disk or an in-memory
 * {@link ByteBuffersDirectory} when no root is configured. A triggered sync reads all rows of the
 * source location, embeds the embedding column and rewrites the directory in
 * {@link IndexWriterConfig.OpenMode#CREATE} mode with a single commit, so searchers move from one
 * generation to the next in one step.
 *
 * <h3>Field layout</h3>
 * <ul>
 *   <li>one {@link StoredField} per store column ({@code id} as long, {@code content} as string)</li>
 *   <li>{@code _vector}: {@link KnnFloatVectorField}, cosine similarity, HNSW indexed</li>
 * </ul>
 *
 * <h3>Restart</h3>
 * Each commit carries the index definition and the source change version it was built from as
 * commit user data. On construction every committed directory under the root is registered again
 * as {@link EIndexState#READY}, provided it was built with the same embedding model as the
 * recovery capability.
 *
 * <h3>Thread-safety</h3>
 * Lookups, staleness checks and searches share a read lock; create, delete, sync and close take
 * the write lock, so a searcher is never released against a closed manager.
 */
@Slf4j
public final class LuceneVectorIndexClient implements VectorIndexClient, Closeable {

    private static final String COMMIT_SOURCE = "docrag.source";
    private static final String COMMIT_EMBEDDING_FIELD = "docrag.embeddingField";
    private static final String COMMIT_PRIMARY_KEY = "docrag.primaryKey";
    private static final String COMMIT_MODEL = "docrag.model";
    private static final String COMMIT_VERSION = "docrag.indexedVersion";
    private static final String COMMIT_COUNT = "docrag.documentCount";

    private final Path root;
    private final TabularStore store;
    private final EmbeddingCapability recoveryEmbedding;
    private final Map<String, IndexEntry> indexes = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Client without restart recovery.
     *
     * @param root  parent directory for on-disk indexes, or {@code null} to keep indexes in memory
     * @param store tabular store the indexes read their source rows from
     */
    public LuceneVectorIndexClient(final Path root, final TabularStore store) {
        this(root, store, null);
    }

    /**
     * @param root              parent directory for on-disk indexes, or {@code null} to keep indexes in memory
     * @param store             tabular store the indexes read their source rows from
     * @param recoveryEmbedding capability attached to indexes found on disk; {@code null} disables recovery
     */
    public LuceneVectorIndexClient(final Path root,
                                   final TabularStore store,
                                   final EmbeddingCapability recoveryEmbedding) {
        this.root = root;
        this.store = store;
        this.recoveryEmbedding = recoveryEmbedding;
        recover();
    }

    @Override
    public void create(final IndexDefinition definition) {
        validate(definition);
        final String name = definition.name();

        lock.writeLock().lock();
        try {
            if (indexes.containsKey(name)) {
                throw new IllegalStateException("Index already exists: " + name);
            }
            if (!store.isChangeTrackingEnabled(definition.sourceLocation())) {
                throw new IllegalStateException(
                        "Change tracking must be enabled on " + definition.sourceLocation() + " before indexing it");
            }

            final IndexEntry entry = new IndexEntry(definition, openDirectory(name));
            entry.lifecycle.transition(EIndexState.BUILDING);
            indexes.put(name, entry);
        } finally {
            lock.writeLock().unlock();
        }

        log.info("Created index {} on {} (embedding field={}, primary key={}, sync={}, model={})",
                name, definition.sourceLocation(), definition.embeddingField(), definition.primaryKey(),
                definition.syncMode(), definition.embedding().modelId());
    }

    @Override
    public boolean delete(final String indexName) {
        lock.writeLock().lock();
        try {
            final IndexEntry entry = indexes.remove(indexName);
            if (entry == null) {
                log.debug("Index {} does not exist, nothing to delete", indexName);
                return false;
            }
            drop(entry);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Deleted index {}", indexName);
        return true;
    }

    @Override
    public boolean exists(final String indexName) {
        lock.readLock().lock();
        try {
            return indexes.containsKey(indexName);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public IndexStatus triggerSync(final String indexName) {
        lock.writeLock().lock();
        try {
            return sync(indexName);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<IndexStatus> describe(final String indexName) {
        lock.readLock().lock();
        try {
            final IndexEntry entry = indexes.get(indexName);
            if (entry == null) {
                return Optional.empty();
            }
            refreshStaleness(entry);
            return Optional.of(status(entry));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<IndexedRow> query(final String indexName,
                                  final float[] vector,
                                  final int k,
                                  final Set<String> fields) {
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive, got " + k);
        }
        if (vector == null || vector.length == 0) {
            throw new IllegalArgumentException("query vector must not be empty");
        }
        requireKnownColumns(fields);

        lock.readLock().lock();
        try {
            final IndexEntry entry = indexes.get(indexName);
            if (entry == null) {
                throw new IndexUnavailableException(indexName, "Index does not exist: " + indexName);
            }
            refreshStaleness(entry);
            if (!entry.lifecycle.isQueryable()) {
                throw new IndexUnavailableException(indexName,
                        "Index " + indexName + " is not searchable yet (state " + entry.lifecycle.state() + ")");
            }

            final SearcherManager manager = entry.searcherManager;
            final IndexSearcher searcher = manager.acquire();
            try {
                return search(searcher, entry.definition, vector, k, fields);
            } finally {
                manager.release(searcher);
            }
        }
        catch (final IOException | AlreadyClosedException e) {
            throw new IndexUnavailableException(indexName, "Failed to search index " + indexName, e);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Closes every index without deleting its files.
     */
    @Override
    public void close() {
        lock.writeLock().lock();
        try {
            for (final IndexEntry entry : indexes.values()) {
                closeQuietly(entry);
            }
            indexes.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Rebuilds the index from its source location. Caller holds the write lock.
     */
    private IndexStatus sync(final String indexName) {
        final IndexEntry entry = require(indexName);
        if (entry.lifecycle.state() != EIndexState.BUILDING) {
            entry.lifecycle.transition(EIndexState.BUILDING);
        }

        final IndexDefinition definition = entry.definition;
        final String source = definition.sourceLocation();

        final long version;
        final List<SegmentRow> rows;
        try {
            version = store.changeVersion(source);
            rows = store.read(source);
        }
        catch (final RuntimeException e) {
            abandon(entry);
            throw new IndexUnavailableException(indexName, "Source location " + source + " is unreachable", e);
        }

        final List<float[]> vectors = new ArrayList<>(rows.size());
        try {
            for (final SegmentRow row : rows) {
                vectors.add(definition.embedding().embed(String.valueOf(row.column(definition.embeddingField()))));
            }
            ensureConsistentDimension(vectors);
        }
        catch (final RuntimeException e) {
            abandon(entry);
            throw new IndexUnavailableException(indexName,
                    "Embedding capability " + definition.embedding().modelId() + " failed while building " + indexName, e);
        }

        try {
            writeGeneration(entry, rows, vectors, version);
        }
        catch (final IOException e) {
            abandon(entry);
            throw new IndexUnavailableException(indexName, "Failed to write index " + indexName, e);
        }

        entry.indexedVersion = version;
        entry.documentCount = rows.size();
        entry.lifecycle.transition(EIndexState.READY);

        log.info("Index {} is ready: {} rows from {} at change version {}", indexName, rows.size(), source, version);
        return status(entry);
    }

    private List<IndexedRow> search(final IndexSearcher searcher,
                                    final IndexDefinition definition,
                                    final float[] vector,
                                    final int k,
                                    final Set<String> fields) throws IOException {
        // The match-all filter makes Lucene fall back to exact search whenever the index fits in k.
        final KnnFloatVectorQuery knn = new KnnFloatVectorQuery(FIELD_VECTOR, vector, k, new MatchAllDocsQuery());
        final TopDocs topDocs = searcher.search(knn, k);
        final StoredFields storedFields = searcher.storedFields();

        final Map<Object, IndexedRow> byKey = new LinkedHashMap<>();
        for (final ScoreDoc sd : topDocs.scoreDocs) {
            final Document doc = storedFields.document(sd.doc);
            final Object key = readColumn(doc, definition.primaryKey());
            if (byKey.containsKey(key)) {
                continue;
            }

            final Map<String, Object> values = new LinkedHashMap<>();
            for (final String field : fields) {
                values.put(field, readColumn(doc, field));
            }
            byKey.put(key, new IndexedRow(values, sd.score));
        }
        return List.copyOf(byKey.values());
    }

    private void writeGeneration(final IndexEntry entry,
                                 final List<SegmentRow> rows,
                                 final List<float[]> vectors,
                                 final long version) throws IOException {
        final IndexWriterConfig config = new IndexWriterConfig()
                .setOpenMode(IndexWriterConfig.OpenMode.CREATE);

        try (IndexWriter writer = new IndexWriter(entry.directory, config)) {
            for (int i = 0; i < rows.size(); i++) {
                writer.addDocument(buildLuceneDocument(rows.get(i), vectors.get(i)));
            }
            writer.setLiveCommitData(commitData(entry.definition, version, rows.size()).entrySet());
            writer.commit();
        }

        // Searchers keep the previous commit until this refresh.
        if (entry.searcherManager == null) {
            entry.searcherManager = new SearcherManager(entry.directory, null);
        } else {
            entry.searcherManager.maybeRefreshBlocking();
        }
    }

    private static Map<String, String> commitData(final IndexDefinition definition,
                                                  final long version,
                                                  final int documentCount) {
        final Map<String, String> data = new HashMap<>();
        data.put(COMMIT_SOURCE, definition.sourceLocation());
        data.put(COMMIT_EMBEDDING_FIELD, definition.embeddingField());
        data.put(COMMIT_PRIMARY_KEY, definition.primaryKey());
        data.put(COMMIT_MODEL, definition.embedding().modelId());
        data.put(COMMIT_VERSION, Long.toString(version));
        data.put(COMMIT_COUNT, Integer.toString(documentCount));
        return data;
    }

    /**
     * Registers every committed index directory under {@link #root} as ready.
     */
    private void recover() {
        if (root == null || recoveryEmbedding == null || !Files.isDirectory(root)) {
            return;
        }

        final List<Path> candidates;
        try (Stream<Path> dirs = Files.list(root)) {
            candidates = dirs.filter(Files::isDirectory).sorted().toList();
        }
        catch (final IOException e) {
            log.warn("Unable to scan index root {}", root, e);
            return;
        }

        for (final Path dir : candidates) {
            recoverIndex(dir.getFileName().toString(), dir);
        }
    }

    private void recoverIndex(final String name, final Path dir) {
        Directory directory = null;
        try {
            directory = FSDirectory.open(dir);
            if (!DirectoryReader.indexExists(directory)) {
                directory.close();
                return;
            }

            final Map<String, String> data = SegmentInfos.readLatestCommit(directory).getUserData();
            final String model = data.get(COMMIT_MODEL);
            if (data.get(COMMIT_SOURCE) == null || model == null) {
                log.warn("Index {} carries no build metadata, skipping it", name);
                directory.close();
                return;
            }
            if (!model.equals(recoveryEmbedding.modelId())) {
                log.warn("Index {} was built with {} but the current model is {}, skipping it",
                        name, model, recoveryEmbedding.modelId());
                directory.close();
                return;
            }

            final IndexDefinition definition = new IndexDefinition(
                    name,
                    data.get(COMMIT_SOURCE),
                    data.get(COMMIT_EMBEDDING_FIELD),
                    data.get(COMMIT_PRIMARY_KEY),
                    ESyncMode.TRIGGERED,
                    recoveryEmbedding);
            validate(definition);

            final IndexEntry entry = new IndexEntry(definition, directory);
            entry.searcherManager = new SearcherManager(directory, null);
            entry.indexedVersion = Long.parseLong(data.getOrDefault(COMMIT_VERSION, "-1"));
            entry.documentCount = Integer.parseInt(data.getOrDefault(COMMIT_COUNT, "0"));
            entry.lifecycle.transition(EIndexState.BUILDING);
            entry.lifecycle.transition(EIndexState.READY);
            indexes.put(name, entry);

            log.info("Recovered index {} on {}: {} rows at change version {}",
                    name, definition.sourceLocation(), entry.documentCount, entry.indexedVersion);
        }
        catch (final IOException | RuntimeException e) {
            log.warn("Unable to recover index {} from {}", name, dir, e);
            if (directory != null) {
                try {
                    directory.close();
                }
                catch (final IOException closeError) {
                    log.error("Unable to close Directory of {}", name, closeError);
                }
            }
        }
    }

    /**
     * Builds a Lucene {@link Document} for a single row+vector pair.
     */
    private static Document buildLuceneDocument(final SegmentRow row, final float[] vector) {
        final Document d = new Document();
        d.add(new StoredField(SegmentRow.COLUMN_ID, row.id()));
        d.add(new StoredField(SegmentRow.COLUMN_CONTENT, row.content()));
        d.add(new KnnFloatVectorField(FIELD_VECTOR, vector, VECTOR_SIMILARITY));
        return d;
    }

    private static Object readColumn(final Document doc, final String column) {
        final IndexableField field = doc.getField(column);
        if (field == null) {
            return null;
        }
        return field.numericValue() != null ? Long.valueOf(field.numericValue().longValue()) : field.stringValue();
    }

    /**
     * Marks a ready index stale once its source location has moved past the indexed version.
     * Concurrent readers may race here; only one of them performs the transition.
     */
    private void refreshStaleness(final IndexEntry entry) {
        if (entry.lifecycle.state() != EIndexState.READY) {
            return;
        }
        final String source = entry.definition.sourceLocation();
        final long current;
        try {
            current = store.changeVersion(source);
        }
        catch (final RuntimeException e) {
            throw new IndexUnavailableException(entry.definition.name(),
                    "Source location " + source + " is unreachable", e);
        }
        if (current > entry.indexedVersion
                && entry.lifecycle.transitionIf(EIndexState.READY, EIndexState.STALE)) {
            log.info("Index {} is stale: built from version {}, source is at {}",
                    entry.definition.name(), entry.indexedVersion, current);
        }
    }

    private IndexEntry require(final String indexName) {
        final IndexEntry entry = indexes.get(indexName);
        if (entry == null) {
            throw new IndexUnavailableException(indexName, "Index does not exist: " + indexName);
        }
        return entry;
    }

    /**
     * Drops an index whose build failed. It must be created again before the next attempt.
     */
    private void abandon(final IndexEntry entry) {
        indexes.remove(entry.definition.name());
        drop(entry);
        log.warn("Build of index {} failed, index dropped", entry.definition.name());
    }

    private void drop(final IndexEntry entry) {
        entry.lifecycle.transition(EIndexState.ABSENT);
        closeQuietly(entry);

        if (root != null) {
            final Path dir = root.resolve(entry.definition.name());
            try (Stream<Path> files = Files.walk(dir)) {
                for (final Path p : files.sorted(Comparator.reverseOrder()).toList()) {
                    Files.deleteIfExists(p);
                }
            }
            catch (final IOException e) {
                log.warn("Failed to delete index files under {}", dir, e);
            }
        }
    }

    private void closeQuietly(final IndexEntry entry) {
        try {
            if (entry.searcherManager != null) {
                entry.searcherManager.close();
            }
        }
        catch (final IOException e) {
            log.error("Unable to close SearcherManager of {}", entry.definition.name(), e);
        }

        try {
            entry.directory.close();
        }
        catch (final IOException e) {
            log.error("Unable to close Directory of {}", entry.definition.name(), e);
        }
    }

    private Directory openDirectory(final String name) {
        if (root == null) {
            return new ByteBuffersDirectory();
        }
        try {
            final Path dir = root.resolve(name);
            Files.createDirectories(dir);
            return FSDirectory.open(dir);
        }
        catch (final IOException e) {
            throw new IndexUnavailableException(name, "Cannot open index directory for " + name, e);
        }
    }

    private static IndexStatus status(final IndexEntry entry) {
        return new IndexStatus(
                entry.definition.name(),
                entry.definition.sourceLocation(),
                entry.lifecycle.state(),
                entry.indexedVersion,
                entry.documentCount);
    }

    private static void validate(final IndexDefinition definition) {
        if (definition == null) {
            throw new IllegalArgumentException("definition must not be null");
        }
        if (definition.name() == null || definition.name().isBlank()) {
            throw new IllegalArgumentException("index name must not be blank");
        }
        if (definition.sourceLocation() == null || definition.sourceLocation().isBlank()) {
            throw new IllegalArgumentException("source location must not be blank");
        }
        if (!SegmentRow.COLUMNS.contains(definition.embeddingField())) {
            throw new IllegalArgumentException("Unknown embedding field: " + definition.embeddingField());
        }
        if (!SegmentRow.COLUMNS.contains(definition.primaryKey())) {
            throw new IllegalArgumentException("Unknown primary key: " + definition.primaryKey());
        }
        if (definition.syncMode() != ESyncMode.TRIGGERED) {
            throw new IllegalArgumentException("Only TRIGGERED sync is supported, got " + definition.syncMode());
        }
        if (definition.embedding() == null) {
            throw new IllegalArgumentException("embedding capability must not be null");
        }
    }

    private static void requireKnownColumns(final Set<String> fields) {
        if (fields == null || fields.isEmpty()) {
            throw new IllegalArgumentException("at least one field must be requested");
        }
        for (final String field : fields) {
            if (!SegmentRow.COLUMNS.contains(field)) {
                throw new IllegalArgumentException("Unknown field: " + field);
            }
        }
    }

    /**
     * Lucene enforces a single dimension per vector field, so every vector of a build must agree.
     */
    private static void ensureConsistentDimension(final List<float[]> vectors) {
        if (vectors.isEmpty()) {
            return;
        }
        final int dim = vectors.get(0) == null ? 0 : vectors.get(0).length;
        if (dim <= 0) {
            throw new IllegalArgumentException("Vector dimension must be > 0");
        }
        for (final float[] v : vectors) {
            if (v == null || v.length != dim) {
                throw new IllegalArgumentException("All vectors must be non-null and of length " + dim);
            }
        }
    }

    /**
     * Mutable fields are written under the write lock and read under the read lock.
     */
    private static final class IndexEntry {
        private final IndexDefinition definition;
        private final Directory directory;
        private final IndexLifecycle lifecycle;
        private SearcherManager searcherManager;
        private long indexedVersion = -1;
        private int documentCount;

        private IndexEntry(final IndexDefinition definition, final Directory directory) {
            this.definition = definition;
            this.directory = directory;
            this.lifecycle = new IndexLifecycle(definition.name());
        }
    }
}
