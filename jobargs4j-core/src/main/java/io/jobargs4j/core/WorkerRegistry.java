package io.jobargs4j.core;

import io.jobargs4j.JobWorker;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public class WorkerRegistry {

    private final Map<String, JobWorker<?>> workersByName;

    public WorkerRegistry(List<? extends JobWorker<?>> workers) {
        Objects.requireNonNull(workers, "workers must not be null");
        Map<String, JobWorker<?>> byName = new LinkedHashMap<>();
        for (JobWorker<?> worker : workers) {
            Objects.requireNonNull(worker, "worker must not be null");
            if (byName.putIfAbsent(worker.name(), worker) != null) {
                throw new IllegalStateException("Duplicate JobWorker name: " + worker.name());
            }
        }
        this.workersByName = Collections.unmodifiableMap(byName);
    }

    public JobWorker<?> getRequired(String name) {
        JobWorker<?> worker = workersByName.get(name);
        if (worker == null) {
            throw new IllegalStateException("No JobWorker registered for name: " + name);
        }
        return worker;
    }

    public Optional<JobWorker<?>> find(String name) {
        return Optional.ofNullable(workersByName.get(name));
    }

    /**
     * Worker whose concrete class is exactly {@code workerType}.
     */
    public Optional<JobWorker<?>> findByType(Class<?> workerType) {
        return workersByName.values().stream()
                .filter(worker -> worker.getClass() == workerType)
                .findFirst();
    }

    public Collection<JobWorker<?>> workers() {
        return workersByName.values();
    }

    public int size() {
        return workersByName.size();
    }
}
