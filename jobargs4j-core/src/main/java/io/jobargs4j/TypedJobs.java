package io.jobargs4j;

import io.jobargs4j.core.WirePayload;
import io.jobargs4j.internal.DefaultTypedJobs;
import io.jobargs4j.spi.JobDispatcher;

import java.util.Collection;

/**
 * Registry-level API: looks up typed jobs and routes broker dispatches to them.
 *
 * <pre>{@code
 * TypedJobs jobs = TypedJobs.builder()
 *         .worker(new ResizeImageWorker())
 *         .broker(broker)
 *         .build();
 *
 * jobs.job(ResizeImageWorker.class).submit(Map.of("attachmentId", 42L));
 * }</pre>
 */
public interface TypedJobs extends JobDispatcher {

    <A> TypedJob<A> job(Class<? extends JobWorker<A>> workerType);

    TypedJob<?> job(String name);

    Collection<TypedJob<?>> jobs();

    /**
     * Route a payload to the named worker's dispatch pipeline.
     */
    @Override
    Object dispatch(String jobName, WirePayload payload);

    static DefaultTypedJobs.Builder builder() {
        return DefaultTypedJobs.builder();
    }
}
