package eu.virtualparadox.docrag.rag.answer;

/**
 * Large-language-model completion: one prompt in, one text out.
 */
public interface GenerationCapability {

    /**
     * @param prompt full prompt text
     * @param params generation settings
     * @return generated text, {@code null} or blank when the model produced nothing
     * @throws RuntimeException if the model endpoint fails
     */
    String generate(final String prompt, final GenerationParams params);
}
