package io.jobargs4j.core;

import io.jobargs4j.fixtures.BasicWorkers.SimpleWorker;
import io.jobargs4j.fixtures.EdgeCaseWorkers.NamedWorker;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkerRegistryTest {

    @Test
    void findsWorkersByNameAndType() {
        SimpleWorker simple = new SimpleWorker();
        WorkerRegistry registry = new WorkerRegistry(List.of(simple, new NamedWorker()));

        assertThat(registry.getRequired("SimpleWorker")).isSameAs(simple);
        assertThat(registry.find("reports.nightly")).isPresent();
        assertThat(registry.findByType(SimpleWorker.class)).containsSame(simple);
        assertThat(registry.size()).isEqualTo(2);
    }

    @Test
    void duplicateNamesAreRejected() {
        assertThatThrownBy(() -> new WorkerRegistry(List.of(new SimpleWorker(), new SimpleWorker())))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Duplicate JobWorker name: SimpleWorker");
    }

    @Test
    void unknownNameFailsLoudly() {
        WorkerRegistry registry = new WorkerRegistry(List.of());

        assertThatThrownBy(() -> registry.getRequired("Nope"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("No JobWorker registered for name: Nope");
    }
}
