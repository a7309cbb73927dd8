package io.jobargs4j.internal.mongo;

import io.jobargs4j.core.ArgumentCodec;
import io.jobargs4j.core.WirePayload;
import io.jobargs4j.spi.JobBroker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * {@link JobBroker} that persists jobs to the {@code queued_jobs} collection.
 * Jobs are executed by a {@link MongoJobRunner}.
 */
public class MongoJobBroker implements JobBroker {
    private static final Logger log = LoggerFactory.getLogger(MongoJobBroker.class);

    private final MongoJobStore jobStore;
    private final ArgumentCodec codec;

    public MongoJobBroker(MongoJobStore jobStore, ArgumentCodec codec) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
    }

    @Override
    public String submit(String jobName, WirePayload payload) {
        Instant now = nowInstant();
        return enqueue(jobName, payload, now, now);
    }

    @Override
    public String scheduleAt(String jobName, Instant time, WirePayload payload) {
        Objects.requireNonNull(time, "time must not be null");
        return enqueue(jobName, payload, nowInstant(), time);
    }

    @Override
    public String scheduleIn(String jobName, Duration delay, WirePayload payload) {
        Objects.requireNonNull(delay, "delay must not be null");
        Instant now = nowInstant();
        return enqueue(jobName, payload, now, now.plus(delay));
    }

    private String enqueue(String jobName, WirePayload payload, Instant enqueuedAt, Instant runAt) {
        String json = codec.toJson(payload == null ? WirePayload.empty() : payload);
        String id = jobStore.insert(jobName, json, enqueuedAt, runAt);
        log.debug("Mongo job enqueued name={} id={} runAt={}", jobName, id, runAt);
        return id;
    }

    /**
     * Current time source (overridable in tests).
     */
    protected Instant nowInstant() {
        return Instant.now();
    }
}
