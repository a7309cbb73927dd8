package io.jobargs4j;

import io.jobargs4j.core.ArgumentSchema;
import io.jobargs4j.core.WirePayload;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Typed entry point for a single worker.
 *
 * <p>Submission operations validate arguments strictly, serialize them into a
 * {@link WirePayload} and hand the payload to the broker. {@link #dispatch(WirePayload)} is
 * the reverse path used by the broker when it executes a job.
 */
public interface TypedJob<A> {

    String name();

    JobWorker<A> worker();

    /**
     * The worker's argument schema, or empty when it declares none.
     */
    Optional<ArgumentSchema> schema();

    /**
     * Validate raw arguments strictly and build the typed {@code Args} instance.
     * Returns {@code null} for workers without arguments.
     */
    A buildArguments(Map<String, ?> arguments);

    /**
     * Enqueue for execution as soon as possible.
     *
     * @return broker job id
     */
    String submit(Map<String, ?> arguments);

    String submit();

    /**
     * Enqueue for execution at an absolute time.
     */
    String scheduleAt(Instant time, Map<String, ?> arguments);

    /**
     * Enqueue for execution at a Unix timestamp in seconds (fractions allowed).
     */
    String scheduleAt(Number epochSeconds, Map<String, ?> arguments);

    /**
     * Enqueue for execution after a delay.
     */
    String scheduleIn(Duration delay, Map<String, ?> arguments);

    /**
     * Enqueue for execution after a delay in seconds (fractions allowed).
     */
    String scheduleIn(Number delaySeconds, Map<String, ?> arguments);

    /**
     * Enqueue for execution after a human-readable delay such as "5 minutes" or "90s".
     */
    String scheduleIn(String interval, Map<String, ?> arguments);

    /**
     * Execute immediately in the caller's thread. Arguments never touch the wire.
     *
     * @return whatever the worker returns
     */
    Object runSynchronously(Map<String, ?> arguments);

    Object runSynchronously();

    /**
     * Execute a previously submitted payload. Called by brokers.
     */
    Object dispatch(WirePayload payload);
}
