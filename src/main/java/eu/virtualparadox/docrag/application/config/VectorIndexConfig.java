package eu.virtualparadox.docrag.application.config;

import eu.virtualparadox.docrag.rag.embed.EmbeddingCapability;
import eu.virtualparadox.docrag.rag.index.LuceneVectorIndexClient;
import eu.virtualparadox.docrag.store.TabularStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Creates the Lucene index client over the on-disk index root {@code docrag.index}.
 * <p>Indexes committed by a previous run are reopened at startup and closed (not deleted) on shutdown.</p>
 */
@Configuration
public class VectorIndexConfig {

    /**
     * @param props     application properties
     * @param store     tabular store the indexes are built from
     * @param embedding capability attached to indexes recovered from a previous run
     * @return index client bound to {@code docrag.index}
     */
    @Bean(destroyMethod = "close")
    public LuceneVectorIndexClient vectorIndexClient(final ApplicationConfig props,
                                                     final TabularStore store,
                                                     final EmbeddingCapability embedding) {
        return new LuceneVectorIndexClient(props.getIndex(), store, embedding);
    }
}
