package io.jobargs4j;

/**
 * Raised when a worker declares an {@code Args} type that is not a usable argument schema.
 */
public class SchemaNotDefinedException extends JobArgsException {

    public SchemaNotDefinedException(String message) {
        super(message);
    }

    public SchemaNotDefinedException(String message, Throwable cause) {
        super(message, cause);
    }
}
