package eu.virtualparadox.docrag.rag.answer;

/**
 * Generation settings forwarded with every request.
 *
 * @param temperature response randomness in {@code [0, 1]}
 * @param maxTokens   output length cap, {@code > 0}
 */
public record GenerationParams(double temperature, int maxTokens) {

    public GenerationParams {
        if (temperature < 0.0 || temperature > 1.0) {
            throw new IllegalArgumentException("temperature must be within [0, 1], got " + temperature);
        }
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive, got " + maxTokens);
        }
    }
}
