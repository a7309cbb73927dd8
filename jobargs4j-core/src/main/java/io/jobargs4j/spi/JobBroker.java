package io.jobargs4j.spi;

import io.jobargs4j.core.WirePayload;

import java.time.Duration;
import java.time.Instant;

/**
 * Submission side of an external job queue.
 *
 * <p>Implementations own delivery, retries, ordering and persistence. Each method accepts the
 * payload as-is and returns the broker's job id.
 */
public interface JobBroker {

    String submit(String jobName, WirePayload payload);

    String scheduleAt(String jobName, Instant time, WirePayload payload);

    String scheduleIn(String jobName, Duration delay, WirePayload payload);
}
