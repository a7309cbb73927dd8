package io.jobargs4j.internal.memory;

import io.jobargs4j.core.WirePayload;
import io.jobargs4j.spi.JobBroker;
import io.jobargs4j.spi.JobDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedList;
import java.util.List;
import java.util.Objects;

/**
 * Broker for tests and single-process use.
 *
 * <p>In {@link Mode#FAKE} submitted jobs are queued until {@link #drain()} is called; in
 * {@link Mode#INLINE} they are dispatched on the submitting thread before the call returns.
 * Schedule times are recorded, not honoured.
 */
public class InMemoryJobBroker implements JobBroker {

    private static final Logger log = LoggerFactory.getLogger(InMemoryJobBroker.class);
    private static final SecureRandom RANDOM = new SecureRandom();

    public enum Mode {
        FAKE,
        INLINE
    }

    public record QueuedJob(String jobId, String jobName, WirePayload payload, Instant runAt) {
    }

    private final Mode mode;
    private final Clock clock;
    private final LinkedList<QueuedJob> queue = new LinkedList<>();
    private volatile JobDispatcher dispatcher;

    public InMemoryJobBroker() {
        this(Mode.FAKE);
    }

    public InMemoryJobBroker(Mode mode) {
        this(mode, Clock.systemUTC());
    }

    public InMemoryJobBroker(Mode mode, Clock clock) {
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public InMemoryJobBroker attach(JobDispatcher dispatcher) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        return this;
    }

    public boolean hasDispatcher() {
        return dispatcher != null;
    }

    public Mode mode() {
        return mode;
    }

    @Override
    public String submit(String jobName, WirePayload payload) {
        return enqueue(jobName, clock.instant(), payload);
    }

    @Override
    public String scheduleAt(String jobName, Instant time, WirePayload payload) {
        Objects.requireNonNull(time, "time must not be null");
        return enqueue(jobName, time, payload);
    }

    @Override
    public String scheduleIn(String jobName, Duration delay, WirePayload payload) {
        Objects.requireNonNull(delay, "delay must not be null");
        return enqueue(jobName, clock.instant().plus(delay), payload);
    }

    private String enqueue(String jobName, Instant runAt, WirePayload payload) {
        Objects.requireNonNull(jobName, "jobName must not be null");
        Objects.requireNonNull(payload, "payload must not be null");

        QueuedJob job = new QueuedJob(newJobId(), jobName, payload, runAt);
        if (mode == Mode.INLINE) {
            log.debug("Dispatching inline name={} jobId={}", jobName, job.jobId());
            requireDispatcher().dispatch(jobName, payload);
            return job.jobId();
        }
        synchronized (queue) {
            queue.addLast(job);
        }
        log.debug("Job queued name={} jobId={} runAt={}", jobName, job.jobId(), runAt);
        return job.jobId();
    }

    public List<QueuedJob> jobs() {
        synchronized (queue) {
            return List.copyOf(queue);
        }
    }

    public List<QueuedJob> jobs(String jobName) {
        return jobs().stream().filter(job -> job.jobName().equals(jobName)).toList();
    }

    public int size() {
        synchronized (queue) {
            return queue.size();
        }
    }

    public void clear() {
        synchronized (queue) {
            queue.clear();
        }
    }

    /**
     * Dispatch queued jobs in submission order until the queue is empty, including jobs
     * submitted by the jobs being drained. A failing job is removed before its exception
     * propagates; the rest stay queued.
     *
     * @return the worker results, in dispatch order
     */
    public List<Object> drain() {
        JobDispatcher target = requireDispatcher();
        List<Object> results = new ArrayList<>();
        QueuedJob job;
        while ((job = poll()) != null) {
            results.add(target.dispatch(job.jobName(), job.payload()));
        }
        return results;
    }

    private QueuedJob poll() {
        synchronized (queue) {
            return queue.pollFirst();
        }
    }

    private JobDispatcher requireDispatcher() {
        JobDispatcher target = dispatcher;
        if (target == null) {
            throw new IllegalStateException("No JobDispatcher attached to InMemoryJobBroker");
        }
        return target;
    }

    private static String newJobId() {
        byte[] bytes = new byte[12];
        RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}
