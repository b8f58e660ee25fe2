package eu.virtualparadox.docrag.exception;

/**
 * Thrown when chunking parameters are invalid. Fatal for the run, never retried.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(final String message) {
        super(message);
    }
}
