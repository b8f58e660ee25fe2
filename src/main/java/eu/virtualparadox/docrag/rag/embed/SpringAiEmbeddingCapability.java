package eu.virtualparadox.docrag.rag.embed;

import lombok.RequiredArgsConstructor;
import org.springframework.ai.embedding.EmbeddingModel;

/**
 * Adapts a Spring AI {@link EmbeddingModel} (e.g. an Ollama endpoint).
 */
@RequiredArgsConstructor
public final class SpringAiEmbeddingCapability implements EmbeddingCapability {

    private final EmbeddingModel embeddingModel;
    private final String modelId;

    @Override
    public float[] embed(final String text) {
        return embeddingModel.embed(text);
    }

    @Override
    public String modelId() {
        return modelId;
    }
}
