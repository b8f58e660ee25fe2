package eu.virtualparadox.docrag.exception;

/**
 * Thrown when the generation capability fails or returns no content.
 * <p>
 * Carries the original question and whether any retrieved context was part of the prompt,
 * so "nothing relevant was found" can be told apart from a plain model failure.
 */
public class GenerationException extends RuntimeException {

    private final String question;
    private final boolean contextPresent;

    public GenerationException(final String message,
                               final String question,
                               final boolean contextPresent) {
        super(message);
        this.question = question;
        this.contextPresent = contextPresent;
    }

    public GenerationException(final String message,
                               final String question,
                               final boolean contextPresent,
                               final Throwable cause) {
        super(message, cause);
        this.question = question;
        this.contextPresent = contextPresent;
    }

    public String getQuestion() {
        return question;
    }

    public boolean isContextPresent() {
        return contextPresent;
    }
}
