package eu.virtualparadox.docrag.rag.embed;

/**
 * Maps text into a fixed-length dense vector.
 * <p>
 * The same instance must be used when indexing content and when embedding queries against
 * that index, otherwise scores compare vectors from different spaces.
 */
public interface EmbeddingCapability {

    /**
     * @param text text to embed (non-null)
     * @return dense vector; every call of one capability returns the same dimension
     * @throws RuntimeException if the underlying model or endpoint fails
     */
    float[] embed(final String text);

    /**
     * @return identifier of the embedding model, recorded with every ingestion run
     */
    String modelId();
}
