package io.jobargs4j.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobargs4j.JobWorker;
import io.jobargs4j.TypedJob;
import io.jobargs4j.TypedJobs;
import io.jobargs4j.core.ArgumentCodec;
import io.jobargs4j.core.SchemaRegistry;
import io.jobargs4j.core.WirePayload;
import io.jobargs4j.core.WorkerRegistry;
import io.jobargs4j.internal.memory.InMemoryJobBroker;
import io.jobargs4j.spi.JobBroker;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public class DefaultTypedJobs implements TypedJobs {

    private final WorkerRegistry workerRegistry;
    private final Map<String, TypedJob<?>> jobsByName;

    public DefaultTypedJobs(
            WorkerRegistry workerRegistry,
            JobBroker broker,
            SchemaRegistry schemaRegistry,
            ArgumentCodec codec
    ) {
        this.workerRegistry = Objects.requireNonNull(workerRegistry, "workerRegistry must not be null");
        Objects.requireNonNull(broker, "broker must not be null");
        Objects.requireNonNull(schemaRegistry, "schemaRegistry must not be null");
        Objects.requireNonNull(codec, "codec must not be null");

        ArgumentBinder binder = new ArgumentBinder(schemaRegistry);
        Map<String, TypedJob<?>> byName = new LinkedHashMap<>();
        for (JobWorker<?> worker : workerRegistry.workers()) {
            byName.put(worker.name(), newJob(worker, broker, schemaRegistry, binder, codec));
        }
        this.jobsByName = Collections.unmodifiableMap(byName);
    }

    private static <A> TypedJob<A> newJob(
            JobWorker<A> worker,
            JobBroker broker,
            SchemaRegistry schemaRegistry,
            ArgumentBinder binder,
            ArgumentCodec codec
    ) {
        return new DefaultTypedJob<>(worker, broker, schemaRegistry, binder, codec);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <A> TypedJob<A> job(Class<? extends JobWorker<A>> workerType) {
        Objects.requireNonNull(workerType, "workerType must not be null");
        JobWorker<?> worker = workerRegistry.findByType(workerType)
                .orElseThrow(() -> new IllegalStateException("No JobWorker registered for type: " + workerType.getName()));
        return (TypedJob<A>) jobsByName.get(worker.name());
    }

    @Override
    public TypedJob<?> job(String name) {
        JobWorker<?> worker = workerRegistry.getRequired(name);
        return jobsByName.get(worker.name());
    }

    @Override
    public Collection<TypedJob<?>> jobs() {
        return jobsByName.values();
    }

    @Override
    public Object dispatch(String jobName, WirePayload payload) {
        return job(jobName).dispatch(payload);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private final List<JobWorker<?>> workers = new ArrayList<>();
        private JobBroker broker;
        private ObjectMapper objectMapper;
        private SchemaRegistry schemaRegistry;

        private Builder() {
        }

        public Builder worker(JobWorker<?> worker) {
            workers.add(Objects.requireNonNull(worker, "worker must not be null"));
            return this;
        }

        public Builder workers(Collection<? extends JobWorker<?>> workers) {
            Objects.requireNonNull(workers, "workers must not be null").forEach(this::worker);
            return this;
        }

        public Builder broker(JobBroker broker) {
            this.broker = broker;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public Builder schemaRegistry(SchemaRegistry schemaRegistry) {
            this.schemaRegistry = schemaRegistry;
            return this;
        }

        /**
         * An {@link InMemoryJobBroker} without a dispatcher, including the default one, is
         * attached to the built instance.
         */
        public DefaultTypedJobs build() {
            ObjectMapper mapper = objectMapper != null ? objectMapper : new ObjectMapper();
            SchemaRegistry registry = schemaRegistry != null ? schemaRegistry : new SchemaRegistry(mapper);
            JobBroker target = broker != null ? broker : new InMemoryJobBroker();

            DefaultTypedJobs jobs = new DefaultTypedJobs(
                    new WorkerRegistry(workers),
                    target,
                    registry,
                    new ArgumentCodec(mapper, registry)
            );
            if (target instanceof InMemoryJobBroker memory && !memory.hasDispatcher()) {
                memory.attach(jobs);
            }
            return jobs;
        }
    }
}
