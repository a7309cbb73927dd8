package io.jobargs4j.spi;

import io.jobargs4j.core.WirePayload;

/**
 * Execution side of the broker contract: invoked exactly when the broker decides to run a job,
 * with the payload that was originally submitted.
 */
@FunctionalInterface
public interface JobDispatcher {

    Object dispatch(String jobName, WirePayload payload);
}
