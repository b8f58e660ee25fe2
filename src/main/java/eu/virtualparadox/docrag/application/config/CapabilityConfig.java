package eu.virtualparadox.docrag.application.config;

import ai.onnxruntime.OrtException;
import eu.virtualparadox.docrag.exception.ConfigurationException;
import eu.virtualparadox.docrag.rag.answer.ChatModelGenerationCapability;
import eu.virtualparadox.docrag.rag.answer.GenerationCapability;
import eu.virtualparadox.docrag.rag.embed.EmbeddingCapability;
import eu.virtualparadox.docrag.rag.embed.OnnxEmbeddingCapability;
import eu.virtualparadox.docrag.rag.embed.SpringAiEmbeddingCapability;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;

/**
 * Wires the external embedding and generation capabilities.
 */
@Slf4j
@Configuration
public class CapabilityConfig {

    private static final String PROVIDER_ONNX = "onnx";
    private static final String PROVIDER_SPRING_AI = "spring-ai";

    /**
     * One embedding capability for the whole application, shared by indexing and querying.
     *
     * @param props          application properties
     * @param embeddingModel Spring AI embedding model, only resolved for the {@code spring-ai} provider
     * @return the configured capability
     */
    @Bean
    public EmbeddingCapability embeddingCapability(final ApplicationConfig props,
                                                   final ObjectProvider<EmbeddingModel> embeddingModel)
            throws IOException, OrtException {
        final String provider = props.getEmbedding().getProvider();
        if (PROVIDER_ONNX.equalsIgnoreCase(provider)) {
            final OnnxEmbeddingCapability onnx = new OnnxEmbeddingCapability(props.getModels().resolve("retriever"));
            onnx.init();
            return onnx;
        }
        if (!PROVIDER_SPRING_AI.equalsIgnoreCase(provider)) {
            throw new ConfigurationException("Unknown embedding provider: " + provider);
        }

        log.info("Using Spring AI embedding model {}", props.getEmbedding().getModelId());
        return new SpringAiEmbeddingCapability(embeddingModel.getObject(), props.getEmbedding().getModelId());
    }

    @Bean
    public GenerationCapability generationCapability(final ChatModel chatModel) {
        return new ChatModelGenerationCapability(chatModel);
    }
}
