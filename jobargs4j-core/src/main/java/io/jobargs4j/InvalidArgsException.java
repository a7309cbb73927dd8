package io.jobargs4j;

/**
 * Raised when arguments fail strict validation at submission time.
 */
public class InvalidArgsException extends JobArgsException {

    public InvalidArgsException(String message) {
        super(message);
    }

    public InvalidArgsException(String message, Throwable cause) {
        super(message, cause);
    }
}
