package eu.virtualparadox.docrag.rag.answer;

import eu.virtualparadox.docrag.exception.GenerationException;
import eu.virtualparadox.docrag.rag.retriever.model.RetrievalResult;
import eu.virtualparadox.docrag.rag.retriever.model.RetrievedSegment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Grounds a question in retrieved segments and asks the generation capability for an answer.
 * <p>
 * The prompt is the content of every retrieved segment in retrieval order, each followed by a
 * blank line, then the question verbatim. One request per call; the answer is returned as is.
 */
@Slf4j
@Service
public class AnswerService {

    private static final String SEGMENT_SEPARATOR = "\n\n";

    /**
     * @param question   the user question
     * @param retrieved  segments returned by the retriever, possibly empty
     * @param generation completion capability
     * @param params     generation settings
     * @return the model's raw answer
     * @throws GenerationException if the call fails or yields no content
     */
    public String answer(final String question,
                         final RetrievalResult retrieved,
                         final GenerationCapability generation,
                         final GenerationParams params) {
        if (question == null || question.isBlank()) {
            throw new IllegalArgumentException("question must not be blank");
        }
        if (generation == null || params == null) {
            throw new IllegalArgumentException("generation capability and params are required");
        }

        final RetrievalResult context = retrieved == null ? RetrievalResult.empty() : retrieved;
        final boolean contextPresent = !context.isEmpty();
        final String prompt = buildPrompt(question, context);

        log.debug("Prompt ({} segments):\n{}", context.size(), prompt);

        final String answer;
        try {
            answer = generation.generate(prompt, params);
        }
        catch (final RuntimeException e) {
            throw new GenerationException("Generation failed for question: " + question, question, contextPresent, e);
        }

        if (answer == null || answer.isBlank()) {
            throw new GenerationException("Generation returned no content for question: " + question,
                    question, contextPresent);
        }
        return answer;
    }

    /**
     * Serializes segments and question into the grounding prompt. Deterministic.
     *
     * @param question  the user question
     * @param retrieved retrieved segments in retrieval order
     * @return prompt text
     */
    public String buildPrompt(final String question, final RetrievalResult retrieved) {
        final StringBuilder prompt = new StringBuilder();
        for (final RetrievedSegment segment : retrieved.segments()) {
            if (segment.content() != null) {
                prompt.append(segment.content()).append(SEGMENT_SEPARATOR);
            }
        }
        return prompt.append(question).toString();
    }
}
