package io.jobargs4j;

import io.jobargs4j.core.WirePayload;
import io.jobargs4j.fixtures.BasicWorkers.SimpleWorker;
import io.jobargs4j.fixtures.BasicWorkers.WorkerWithDefaults;
import io.jobargs4j.fixtures.ComplexWorkers.WorkerWithNestedStruct;
import io.jobargs4j.fixtures.EdgeCaseWorkers.WorkerWithoutArgs;
import io.jobargs4j.fixtures.ErrorWorkers.WorkerWithSerializationError;
import io.jobargs4j.spi.JobBroker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class TypedJobSubmitTest {

    private JobBroker broker;
    private TypedJobs jobs;

    @BeforeEach
    void setUp() {
        broker = mock(JobBroker.class);
        when(broker.submit(anyString(), any())).thenReturn("jid-1");
        when(broker.scheduleAt(anyString(), any(), any())).thenReturn("jid-2");
        when(broker.scheduleIn(anyString(), any(), any())).thenReturn("jid-3");

        jobs = TypedJobs.builder()
                .worker(new SimpleWorker())
                .worker(new WorkerWithDefaults())
                .worker(new WorkerWithNestedStruct())
                .worker(new WorkerWithoutArgs())
                .worker(new WorkerWithSerializationError())
                .broker(broker)
                .build();
    }

    @Test
    void submitForwardsSerializedPayloadAndReturnsBrokerId() {
        String jobId = jobs.job(WorkerWithDefaults.class).submit(Map.of("requiredField", "hello"));

        assertThat(jobId).isEqualTo("jid-1");
        ArgumentCaptor<WirePayload> payload = ArgumentCaptor.forClass(WirePayload.class);
        verify(broker).submit(eq("WorkerWithDefaults"), payload.capture());
        assertThat(payload.getValue().values()).isEqualTo(Map.of("requiredField", "hello", "optionalField", false));
    }

    @Test
    void nestedRecordsTravelAsMaps() {
        jobs.job(WorkerWithNestedStruct.class).submit(Map.of(
                "name", "Alice",
                "address", new WorkerWithNestedStruct.Address("Main St", "Springfield")));

        ArgumentCaptor<WirePayload> payload = ArgumentCaptor.forClass(WirePayload.class);
        verify(broker).submit(eq("WorkerWithNestedStruct"), payload.capture());
        assertThat(payload.getValue().get("address")).isEqualTo(Map.of("street", "Main St", "city", "Springfield"));
    }

    @Test
    void invalidArgumentsNeverReachTheBroker() {
        assertThatThrownBy(() -> jobs.job(WorkerWithDefaults.class).submit(Map.of("optionalField", true)))
                .isInstanceOf(InvalidArgsException.class)
                .hasMessageContaining("requiredField");

        assertThatThrownBy(() -> jobs.job(SimpleWorker.class).submit(Map.of("value", "not an integer")))
                .isInstanceOf(InvalidArgsException.class)
                .hasMessageContaining("Invalid arguments for SimpleWorker");

        verifyNoInteractions(broker);
    }

    @Test
    void serializationFailuresPropagateUnwrapped() {
        assertThatThrownBy(() -> jobs.job(WorkerWithSerializationError.class).submit(Map.of("value", 1)))
                .isExactlyInstanceOf(SerializationException.class)
                .hasMessageContaining("Failed to serialize args for WorkerWithSerializationError");

        verifyNoInteractions(broker);
    }

    @Test
    void scheduleAtAcceptsInstantsAndEpochSeconds() {
        Instant runAt = Instant.parse("2026-01-01T00:00:00Z");

        assertThat(jobs.job(SimpleWorker.class).scheduleAt(runAt, Map.of("value", 1))).isEqualTo("jid-2");
        jobs.job(SimpleWorker.class).scheduleAt(1767225600.5, Map.of("value", 2));

        verify(broker).scheduleAt(eq("SimpleWorker"), eq(runAt), eq(WirePayload.of(Map.of("value", 1))));
        verify(broker).scheduleAt(eq("SimpleWorker"), eq(runAt.plusMillis(500)), eq(WirePayload.of(Map.of("value", 2))));
    }

    @Test
    void scheduleInAcceptsDurationsSecondsAndHumanIntervals() {
        TypedJob<SimpleWorker.Args> job = jobs.job(SimpleWorker.class);

        assertThat(job.scheduleIn(Duration.ofMinutes(1), Map.of("value", 1))).isEqualTo("jid-3");
        job.scheduleIn(90, Map.of("value", 2));
        job.scheduleIn("5 minutes", Map.of("value", 3));
        job.scheduleIn(0.25, Map.of("value", 4));

        verify(broker).scheduleIn("SimpleWorker", Duration.ofMinutes(1), WirePayload.of(Map.of("value", 1)));
        verify(broker).scheduleIn("SimpleWorker", Duration.ofSeconds(90), WirePayload.of(Map.of("value", 2)));
        verify(broker).scheduleIn("SimpleWorker", Duration.ofMinutes(5), WirePayload.of(Map.of("value", 3)));
        verify(broker).scheduleIn("SimpleWorker", Duration.ofMillis(250), WirePayload.of(Map.of("value", 4)));
    }

    @Test
    void workersWithoutArgsSubmitEmptyPayloadAndIgnoreArguments() {
        jobs.job(WorkerWithoutArgs.class).submit();
        jobs.job(WorkerWithoutArgs.class).submit(Map.of("foo", "bar"));

        verify(broker, times(2)).submit("WorkerWithoutArgs", WirePayload.empty());
    }

    @Test
    void buildArgumentsReturnsTheTypedRecord() {
        SimpleWorker.Args args = jobs.job(SimpleWorker.class).buildArguments(Map.of("value", 5));

        assertThat(args.value()).isEqualTo(5);
        assertThat(jobs.job(WorkerWithoutArgs.class).buildArguments(Map.of())).isNull();
    }

    @Test
    void lookupByNameAndTypeAgree() {
        assertThat(jobs.job("SimpleWorker")).isSameAs(jobs.job(SimpleWorker.class));
        assertThat(jobs.jobs()).extracting(TypedJob::name)
                .containsExactly("SimpleWorker", "WorkerWithDefaults", "WorkerWithNestedStruct",
                        "WorkerWithoutArgs", "WorkerWithSerializationError");

        assertThatThrownBy(() -> jobs.job("Missing"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("No JobWorker registered for name: Missing");
    }
}
