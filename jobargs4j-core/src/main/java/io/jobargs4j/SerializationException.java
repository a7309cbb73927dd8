package io.jobargs4j;

/**
 * Raised when typed arguments cannot be turned into a wire payload, or a wire payload
 * cannot be coerced back into typed arguments.
 */
public class SerializationException extends JobArgsException {

    public SerializationException(String message) {
        super(message);
    }

    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
