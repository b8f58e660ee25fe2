package eu.virtualparadox.docrag.exception;

/**
 * Thrown when a vector index is missing, not yet built, or when the storage or embedding
 * endpoint behind it cannot be reached. Callers may retry after a backoff.
 */
public class IndexUnavailableException extends RuntimeException {

    private final String indexName;

    public IndexUnavailableException(final String indexName, final String message) {
        super(message);
        this.indexName = indexName;
    }

    public IndexUnavailableException(final String indexName, final String message, final Throwable cause) {
        super(message, cause);
        this.indexName = indexName;
    }

    public String getIndexName() {
        return indexName;
    }
}
