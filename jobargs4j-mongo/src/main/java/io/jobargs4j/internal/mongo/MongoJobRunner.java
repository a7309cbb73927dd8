package io.jobargs4j.internal.mongo;

import io.jobargs4j.config.JobArgsProperties;
import io.jobargs4j.core.ArgumentCodec;
import io.jobargs4j.core.WirePayload;
import io.jobargs4j.spi.JobDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Execution side of {@link MongoJobBroker}: claims due jobs and hands them to a {@link JobDispatcher}.
 *
 * <p>Retries are owned here. A failed job is rescheduled after 10s, 20s, 40s... (capped at 10 minutes)
 * until {@code maxRetryCount} attempts have failed, after which it stays in the collection with no
 * {@code runAt}.
 *
 * <pre>{@code
 * MongoJobRunner runner = new MongoJobRunner(props, jobStore, typedJobs, codec);
 * runner.start();
 * ...
 * runner.stop();
 * }</pre>
 */
public class MongoJobRunner {
    private static final Logger log = LoggerFactory.getLogger(MongoJobRunner.class);

    static final int MAX_SYSTEM_ERRORS = 30;
    private static final Duration POLLER_JOIN_TIMEOUT = Duration.ofSeconds(5);

    private final JobArgsProperties props;
    private final MongoJobStore jobStore;
    private final JobDispatcher dispatcher;
    private final ArgumentCodec codec;
    private final String workerId;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final Semaphore slots;
    private final Semaphore refillSignal = new Semaphore(0);

    private ExecutorService workerPool;
    private Thread pollerThread;
    private int systemErrorCount = 0;

    public MongoJobRunner(JobArgsProperties props, MongoJobStore jobStore, JobDispatcher dispatcher, ArgumentCodec codec) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        if (props.getMaxConcurrency() <= 0) {
            throw new IllegalArgumentException("jobargs.maxConcurrency must be a positive number");
        }
        this.slots = new Semaphore(props.getMaxConcurrency());
        this.workerId = resolveWorkerId(props.getWorkerId());
    }

    /**
     * Start polling and executing due jobs. Idempotent.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        Duration interval = Objects.requireNonNull(props.getPollInterval(), "jobargs.pollInterval must not be null");
        if (interval.isZero() || interval.isNegative()) {
            started.set(false);
            throw new IllegalArgumentException("jobargs.pollInterval must be a positive duration");
        }
        Duration lockLifetime = Objects.requireNonNull(props.getLockLifetime(), "jobargs.lockLifetime must not be null");
        if (lockLifetime.isZero() || lockLifetime.isNegative()) {
            started.set(false);
            throw new IllegalArgumentException("jobargs.lockLifetime must be a positive duration");
        }

        log.info("Job runner starting with pollInterval={}, lockLifetime={}, workerId={}, maxConcurrency={}, batchSize={}",
                interval, lockLifetime, workerId, props.getMaxConcurrency(), props.getBatchSize());

        if (workerPool == null) {
            workerPool = Executors.newFixedThreadPool(props.getMaxConcurrency(), r -> {
                Thread t = new Thread(r);
                t.setName("jobargs.worker");
                t.setDaemon(true);
                return t;
            });
        }

        if (pollerThread == null) {
            pollerThread = new Thread(this::pollerLoop);
            pollerThread.setName("jobargs.poller");
            pollerThread.setDaemon(true);
            pollerThread.start();
        }
        log.info("Job runner started.");
    }

    /**
     * Stop polling and wait up to one lock lifetime for running jobs. Idempotent.
     */
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("Job runner stopping...");

        Thread poller = pollerThread;
        pollerThread = null;
        if (poller != null && poller != Thread.currentThread()) {
            poller.interrupt();
            try {
                poller.join(POLLER_JOIN_TIMEOUT.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (poller.isAlive()) {
                log.warn("Job runner poller did not exit within {}", POLLER_JOIN_TIMEOUT);
            }
        }

        if (workerPool != null) {
            workerPool.shutdown();
            try {
                if (!workerPool.awaitTermination(props.getLockLifetime().toSeconds(), TimeUnit.SECONDS)) {
                    workerPool.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                workerPool.shutdownNow();
            } finally {
                workerPool = null;
            }
        }

        refillSignal.drainPermits();
        log.info("Job runner stopped.");
    }

    public boolean isRunning() {
        return started.get();
    }

    public String workerId() {
        return workerId;
    }

    /**
     * Current time source (overridable in tests).
     */
    protected Instant nowInstant() {
        return Instant.now();
    }

    private void pollerLoop() {
        while (started.get()) {
            boolean backlog;
            try {
                backlog = pollOnce();
                systemErrorCount = 0;
            } catch (Exception e) {
                systemErrorCount++;
                log.error("job runner poll failed attempt={} msg={}", systemErrorCount, e.getMessage(), e);
                if (systemErrorCount >= MAX_SYSTEM_ERRORS) {
                    log.error("Job runner stopped after {} consecutive poll failures", systemErrorCount);
                    stop();
                    break;
                }
                try {
                    Thread.sleep(backoff(systemErrorCount).toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
                continue;
            }

            if (!started.get()) {
                break;
            }

            try {
                if (backlog) {
                    // woken early when a worker slot frees up
                    refillSignal.tryAcquire(200, TimeUnit.MILLISECONDS);
                } else {
                    Thread.sleep(props.getPollInterval().toMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    /**
     * Claim due jobs up to the number of free worker slots and submit them.
     *
     * @return true when more due jobs may be waiting
     */
    boolean pollOnce() {
        int free = slots.availablePermits();
        if (free == 0) {
            return true;
        }

        int take = Math.min(Math.max(1, props.getBatchSize()), free);
        List<QueuedJobDocument> jobs = jobStore.claimDueJobs(nowInstant(), take, props.getLockLifetime(), workerId);
        log.debug("Job runner claimed count={} requested={}", jobs.size(), take);

        for (QueuedJobDocument job : jobs) {
            submitToWorker(job);
        }
        return jobs.size() == take;
    }

    private void submitToWorker(QueuedJobDocument job) {
        slots.acquireUninterruptibly();
        try {
            workerPool.submit(() -> {
                try {
                    runJob(job);
                } finally {
                    slots.release();
                    refillSignal.release();
                }
            });
        } catch (RuntimeException e) {
            slots.release();
            throw e;
        }
    }

    /**
     * Run one claimed job on the calling thread and record the outcome.
     */
    void runJob(QueuedJobDocument job) {
        final String name = job.getName();
        Instant startedAt = nowInstant();
        try {
            log.debug("Job started name={} id={}", name, job.getId());
            WirePayload payload = codec.fromJson(job.getPayload());
            dispatcher.dispatch(name, payload);
            Instant finishedAt = nowInstant();
            log.debug("Job succeeded name={} id={}", name, job.getId());

            if (props.isCleanupFinishedJobs()) {
                jobStore.deleteById(job.getId());
            } else {
                jobStore.markSuccess(job.getId(), workerId, startedAt, finishedAt);
            }
        } catch (Exception e) {
            log.error("job failed name={} id={} msg={}", name, job.getId(), e.getMessage(), e);

            Instant failedAt = nowInstant();
            int attempt = job.getFailCount() + 1;
            int maxRetry = props.getMaxRetryCount();

            Instant nextRunAt;
            if (maxRetry > 0 && attempt >= maxRetry) {
                nextRunAt = null;
                log.warn("job reached max retries and was parked name={} id={} attempts={} maxRetry={}",
                        name, job.getId(), attempt, maxRetry);
            } else {
                nextRunAt = failedAt.plus(retryDelay(attempt));
            }

            try {
                jobStore.markFailure(job.getId(), workerId, failedAt, describe(e), nextRunAt);
            } catch (Exception storeEx) {
                log.error("job markFailure failed name={} id={} msg={}", name, job.getId(), storeEx.getMessage(), storeEx);
            }
        }
    }

    // Exponential backoff for repeated poll failures, capped at a minute.
    static Duration backoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount, 15));
        long ms = Math.min(1000L * (1L << exp), 60_000L);
        return Duration.ofMillis(ms);
    }

    /**
     * Delay before the next attempt of a failed job; attempt starts at 1.
     * 10s, 20s, 40s, 80s... capped at 10 minutes.
     */
    static Duration retryDelay(int attempt) {
        int exp = Math.max(0, attempt - 1);
        exp = Math.min(exp, 20);
        long ms = Math.min(10_000L * (1L << exp), 600_000L);
        return Duration.ofMillis(ms);
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message == null ? e.getClass().getName() : e.getClass().getSimpleName() + ": " + message;
    }

    private static String resolveWorkerId(String configuredWorkerId) {
        if (configuredWorkerId != null && !configuredWorkerId.isBlank()) {
            return configuredWorkerId;
        }

        String host = "jobargs4j";
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.debug("Could not resolve local host name, using default msg={}", e.getMessage());
        }

        String pid = String.valueOf(ManagementFactory.getRuntimeMXBean().getPid());

        String generated = host + "-" + pid + "-" + UUID.randomUUID();
        if (generated.length() > 128) {
            return generated.substring(0, 128);
        }
        return generated;
    }
}
