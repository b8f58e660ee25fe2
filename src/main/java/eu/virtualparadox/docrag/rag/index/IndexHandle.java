package eu.virtualparadox.docrag.rag.index;

import eu.virtualparadox.docrag.rag.embed.EmbeddingCapability;

/**
 * Returned by a successful sync and passed to the retriever.
 * <p>
 * Carries the embedding capability the index was built with, so queries are embedded into
 * the same vector space.
 *
 * @param indexName      index to query
 * @param sourceLocation store location backing the index
 * @param embedding      capability used to build the index
 * @param storeVersion   store change version the index was built from
 */
public record IndexHandle(String indexName,
                          String sourceLocation,
                          EmbeddingCapability embedding,
                          long storeVersion) {
}
