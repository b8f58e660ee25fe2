package eu.virtualparadox.docrag.rag.index;

import eu.virtualparadox.docrag.rag.embed.EmbeddingCapability;

/**
 * Everything needed to create a similarity-search index over a store location.
 *
 * @param name           index name, unique per client
 * @param sourceLocation store location the index reads its rows from
 * @param embeddingField column whose text is embedded
 * @param primaryKey     column identifying a row
 * @param syncMode       how the index converges with its source
 * @param embedding      capability used for both index-time and query-time embedding
 */
public record IndexDefinition(String name,
                              String sourceLocation,
                              String embeddingField,
                              String primaryKey,
                              ESyncMode syncMode,
                              EmbeddingCapability embedding) {
}
