package io.jobargs4j;

/**
 * Base type for every failure raised by jobargs4j.
 *
 * <p>Also used directly as the generic error that wraps failures thrown from a worker's
 * {@code run} method. Subtypes are surfaced to callers unmodified.
 */
public class JobArgsException extends RuntimeException {

    public JobArgsException(String message) {
        super(message);
    }

    public JobArgsException(String message, Throwable cause) {
        super(message, cause);
    }
}
