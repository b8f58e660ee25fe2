package eu.virtualparadox.docrag.query;

import eu.virtualparadox.docrag.application.config.ApplicationConfig;
import eu.virtualparadox.docrag.exception.IndexUnavailableException;
import eu.virtualparadox.docrag.rag.answer.AnswerService;
import eu.virtualparadox.docrag.rag.answer.GenerationCapability;
import eu.virtualparadox.docrag.rag.answer.GenerationParams;
import eu.virtualparadox.docrag.rag.embed.EmbeddingCapability;
import eu.virtualparadox.docrag.rag.index.IndexHandle;
import eu.virtualparadox.docrag.rag.index.IndexStatus;
import eu.virtualparadox.docrag.rag.index.VectorIndexClient;
import eu.virtualparadox.docrag.rag.retriever.model.RetrievalResult;
import eu.virtualparadox.docrag.rag.retriever.model.RetrievedSegment;
import eu.virtualparadox.docrag.rag.retriever.service.RetrieverService;
import eu.virtualparadox.docrag.store.SegmentRow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class QueryManager {

    private final VectorIndexClient indexClient;
    private final RetrieverService retrieverService;
    private final AnswerService answerService;
    private final EmbeddingCapability embedding;
    private final GenerationCapability generation;
    private final ApplicationConfig config;

    /**
     * Retrieves the top-k segments of the configured index and answers the question from them.
     *
     * @param question user question
     * @return the answer with the context it was grounded on
     */
    public QueryAnswer ask(final String question) {
        final IndexHandle handle = handle();

        final RetrievalResult retrieved = retrieverService.search(
                handle, question, config.getRetrieval().getTopK(), SegmentRow.COLUMNS);
        printDebugRetrieved(retrieved);

        final GenerationParams params = new GenerationParams(
                config.getGeneration().getTemperature(),
                config.getGeneration().getMaxTokens());
        final String answer = answerService.answer(question, retrieved, generation, params);
        log.info("Answered '{}' from {} segments", question, retrieved.size());

        return new QueryAnswer(question, answer, retrieved);
    }

    /**
     * Resolves the handle of the configured index.
     *
     * @throws IndexUnavailableException if the index was never built or was not recovered at startup
     */
    public IndexHandle handle() {
        final String indexName = config.getIndexName();
        final IndexStatus status = indexClient.describe(indexName)
                .orElseThrow(() -> new IndexUnavailableException(indexName, "Nothing has been ingested into " + indexName));
        return new IndexHandle(indexName, status.sourceLocation(), embedding, status.indexedVersion());
    }

    private void printDebugRetrieved(final RetrievalResult retrieved) {
        final StringBuilder sb = new StringBuilder();
        for (final RetrievedSegment r : retrieved.segments()) {
            sb.append(" - ").append("[").append(r.id()).append(" / ").append(r.score()).append("] ")
                    .append(r.content()).append("\n");
        }
        log.debug("Retrieved segments:\n{}", sb);
    }
}
