package eu.virtualparadox.laysum.error;

/**
 * Invalid chunker parameters. Raised at construction time; a programming or
 * configuration error, never something a caller can recover from per document.
 */
public class ChunkerConfigException extends IllegalArgumentException {

    public ChunkerConfigException(final String message) {
        super(message);
    }
}
