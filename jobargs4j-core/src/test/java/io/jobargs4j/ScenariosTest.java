package io.jobargs4j;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobargs4j.core.ArgumentCodec;
import io.jobargs4j.core.SchemaRegistry;
import io.jobargs4j.core.WirePayload;
import io.jobargs4j.fixtures.BasicWorkers.SimpleWorker;
import io.jobargs4j.fixtures.BasicWorkers.WorkerWithDefaults;
import io.jobargs4j.fixtures.ComplexWorkers.WorkerWithCoercibleTypes;
import io.jobargs4j.fixtures.ComplexWorkers.WorkerWithComplexTypes;
import io.jobargs4j.fixtures.ComplexWorkers.WorkerWithNestedStruct;
import io.jobargs4j.fixtures.ErrorWorkers.WorkerThatRaisesError;
import io.jobargs4j.internal.memory.InMemoryJobBroker;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end flows: submit, carry the payload through JSON text, dispatch.
 */
class ScenariosTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final SchemaRegistry schemaRegistry = new SchemaRegistry(objectMapper);
    private final ArgumentCodec codec = new ArgumentCodec(objectMapper, schemaRegistry);
    private final InMemoryJobBroker broker = new InMemoryJobBroker();

    private final TypedJobs jobs = TypedJobs.builder()
            .worker(new SimpleWorker())
            .worker(new WorkerWithDefaults())
            .worker(new WorkerWithComplexTypes())
            .worker(new WorkerWithNestedStruct())
            .worker(new WorkerWithCoercibleTypes())
            .worker(new WorkerThatRaisesError())
            .objectMapper(objectMapper)
            .schemaRegistry(schemaRegistry)
            .broker(broker)
            .build();

    @Test
    void synchronousRunDoublesTheValue() {
        assertThat(jobs.job(SimpleWorker.class).runSynchronously(Map.of("value", 5))).isEqualTo(10);
    }

    @Test
    void booleanTextFromTheWireIsCoerced() {
        Map<String, Object> values = Map.of(
                "boolField", "true",
                "intField", 1,
                "floatField", 1.0,
                "stringField", "test",
                "symbolField", "test");
        WorkerWithCoercibleTypes.Args args =
                (WorkerWithCoercibleTypes.Args) jobs.dispatch("WorkerWithCoercibleTypes", WirePayload.of(values));
        assertThat(args.boolField()).isTrue();

        Map<String, Object> broken = new HashMap<>(values);
        broken.put("boolField", "not_a_boolean");
        assertThatThrownBy(() -> jobs.dispatch("WorkerWithCoercibleTypes", WirePayload.of(broken)))
                .isInstanceOf(SerializationException.class)
                .hasMessageContaining("Failed to deserialize");
    }

    @Test
    void submittingWithoutRequiredFieldIsRejected() {
        assertThatThrownBy(() -> jobs.job(WorkerWithDefaults.class).submit(Map.of("optionalField", true)))
                .isInstanceOf(InvalidArgsException.class);
        assertThat(broker.size()).isZero();
    }

    @Test
    void failureInRunNamesTheWorkerAndTheCause() {
        jobs.job(WorkerThatRaisesError.class).submit(Map.of("message", "boom"));

        assertThatThrownBy(broker::drain)
                .isExactlyInstanceOf(JobArgsException.class)
                .hasMessageContaining("boom")
                .hasMessageContaining("WorkerThatRaisesError");
    }

    @Test
    void payloadsSurviveAJsonTransport() {
        jobs.job(WorkerWithComplexTypes.class).submit(Map.of(
                "userId", 42,
                "tags", List.of("a", "b"),
                "metadata", Map.of("source", "api", "attempt", 2),
                "priority", 3));
        jobs.job(WorkerWithNestedStruct.class).submit(Map.of(
                "name", "Alice",
                "address", new WorkerWithNestedStruct.Address("Main St", "Springfield")));

        List<Object> results = broker.jobs().stream()
                .map(job -> jobs.dispatch(job.jobName(), codec.fromJson(codec.toJson(job.payload()))))
                .toList();

        assertThat(results.get(0)).isEqualTo(Map.of(
                "userId", 42L,
                "tags", List.of("a", "b"),
                "metadata", Map.of("source", "api", "attempt", 2),
                "priority", 3));
        assertThat(results.get(1)).isEqualTo("Alice lives at Main St, Springfield");
    }

    @Test
    void inlineBrokerDispatchesOnSubmit() {
        InMemoryJobBroker inline = new InMemoryJobBroker(InMemoryJobBroker.Mode.INLINE);
        TypedJobs inlineJobs = TypedJobs.builder()
                .worker(new WorkerThatRaisesError())
                .broker(inline)
                .build();

        assertThatThrownBy(() -> inlineJobs.job(WorkerThatRaisesError.class).submit(Map.of("message", "inline boom")))
                .isExactlyInstanceOf(JobArgsException.class)
                .hasMessageContaining("inline boom");
    }
}
