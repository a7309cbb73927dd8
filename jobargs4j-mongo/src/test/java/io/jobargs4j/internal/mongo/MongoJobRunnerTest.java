package io.jobargs4j.internal.mongo;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobargs4j.config.JobArgsProperties;
import io.jobargs4j.core.ArgumentCodec;
import io.jobargs4j.core.SchemaRegistry;
import io.jobargs4j.core.WirePayload;
import io.jobargs4j.spi.JobDispatcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class MongoJobRunnerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final ArgumentCodec codec = new ArgumentCodec(new ObjectMapper(), new SchemaRegistry());
    private MongoJobStore jobStore;
    private JobArgsProperties props;

    @BeforeEach
    void setUp() {
        jobStore = mock(MongoJobStore.class);
        props = new JobArgsProperties();
        props.setWorkerId("worker-1");
    }

    @Test
    void successfulJobIsDispatchedWithDecodedPayloadAndDeleted() {
        AtomicReference<WirePayload> seen = new AtomicReference<>();
        MongoJobRunner runner = runner((name, payload) -> {
            seen.set(payload);
            return null;
        });

        runner.runJob(job("j1", "SimpleWorker", "{\"value\":5}", 0));

        assertThat(seen.get().values()).isEqualTo(Map.of("value", 5));
        verify(jobStore).deleteById("j1");
        verify(jobStore, never()).markSuccess(anyString(), anyString(), any(), any());
    }

    @Test
    void finishedJobsAreKeptWhenCleanupIsDisabled() {
        props.setCleanupFinishedJobs(false);
        MongoJobRunner runner = runner((name, payload) -> "ok");

        runner.runJob(job("j1", "SimpleWorker", "{}", 0));

        verify(jobStore).markSuccess("j1", "worker-1", NOW, NOW);
        verify(jobStore, never()).deleteById(anyString());
    }

    @Test
    void failedJobIsRescheduledWithBackoffAndError() {
        MongoJobRunner runner = runner((name, payload) -> {
            throw new IllegalStateException("boom");
        });

        runner.runJob(job("j1", "Flaky", "{}", 1));

        verify(jobStore).markFailure("j1", "worker-1", NOW, "IllegalStateException: boom", NOW.plusSeconds(20));
        verify(jobStore, never()).deleteById(anyString());
    }

    @Test
    void jobIsParkedOnceRetriesAreExhausted() {
        props.setMaxRetryCount(3);
        MongoJobRunner runner = runner((name, payload) -> {
            throw new IllegalStateException("still broken");
        });

        runner.runJob(job("j1", "Flaky", "{}", 2));

        verify(jobStore).markFailure(eq("j1"), eq("worker-1"), eq(NOW), eq("IllegalStateException: still broken"), isNull());
    }

    @Test
    void unreadablePayloadCountsAsFailure() {
        MongoJobRunner runner = runner((name, payload) -> {
            throw new AssertionError("must not dispatch");
        });

        runner.runJob(job("j1", "SimpleWorker", "{broken", 0));

        verify(jobStore).markFailure(eq("j1"), eq("worker-1"), eq(NOW), anyString(), eq(NOW.plusSeconds(10)));
    }

    @Test
    void retryDelayDoublesUpToTenMinutes() {
        assertThat(MongoJobRunner.retryDelay(1)).isEqualTo(Duration.ofSeconds(10));
        assertThat(MongoJobRunner.retryDelay(2)).isEqualTo(Duration.ofSeconds(20));
        assertThat(MongoJobRunner.retryDelay(4)).isEqualTo(Duration.ofSeconds(80));
        assertThat(MongoJobRunner.retryDelay(50)).isEqualTo(Duration.ofMinutes(10));
        assertThat(MongoJobRunner.backoff(100)).isEqualTo(Duration.ofMinutes(1));
    }

    @Test
    void startAndStopAreIdempotent() {
        props.setPollInterval(Duration.ofMinutes(1));
        props.setLockLifetime(Duration.ofSeconds(1));
        MongoJobRunner runner = runner((name, payload) -> null);

        runner.start();
        runner.start();
        assertThat(runner.isRunning()).isTrue();

        runner.stop();
        runner.stop();
        assertThat(runner.isRunning()).isFalse();
    }

    @Test
    void restartLeavesASinglePoller() {
        props.setPollInterval(Duration.ofMinutes(1));
        props.setLockLifetime(Duration.ofSeconds(1));
        MongoJobRunner runner = runner((name, payload) -> null);

        runner.start();
        runner.stop();
        assertThat(livePollers()).isZero();

        runner.start();
        assertThat(livePollers()).isEqualTo(1);
        runner.stop();
        assertThat(livePollers()).isZero();
    }

    private static long livePollers() {
        return Thread.getAllStackTraces().keySet().stream()
                .filter(t -> t.isAlive() && "jobargs.poller".equals(t.getName()))
                .count();
    }

    @Test
    void rejectsNonPositiveIntervals() {
        props.setPollInterval(Duration.ZERO);
        MongoJobRunner runner = runner((name, payload) -> null);

        assertThatThrownBy(runner::start)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("pollInterval");
        assertThat(runner.isRunning()).isFalse();
    }

    @Test
    void generatesWorkerIdWhenNotConfigured() {
        props.setWorkerId(" ");

        assertThat(runner((name, payload) -> null).workerId()).isNotBlank().hasSizeLessThanOrEqualTo(128);
    }

    private MongoJobRunner runner(JobDispatcher dispatcher) {
        return new MongoJobRunner(props, jobStore, dispatcher, codec) {
            @Override
            protected Instant nowInstant() {
                return NOW;
            }
        };
    }

    private static QueuedJobDocument job(String id, String name, String payload, int failCount) {
        QueuedJobDocument doc = new QueuedJobDocument();
        doc.setId(id);
        doc.setName(name);
        doc.setPayload(payload);
        doc.setRunAt(NOW.minusSeconds(1));
        doc.setFailCount(failCount);
        doc.setLockedBy("worker-1");
        return doc;
    }
}
