package io.jobargs4j.internal;

import io.jobargs4j.JobArgsException;
import io.jobargs4j.JobContext;
import io.jobargs4j.JobWorker;
import io.jobargs4j.TypedJob;
import io.jobargs4j.core.ArgumentCodec;
import io.jobargs4j.core.ArgumentSchema;
import io.jobargs4j.core.ExecutionMode;
import io.jobargs4j.core.SchemaRegistry;
import io.jobargs4j.core.WirePayload;
import io.jobargs4j.spi.JobBroker;
import io.jobargs4j.utils.IntervalParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public class DefaultTypedJob<A> implements TypedJob<A> {

    private static final Logger log = LoggerFactory.getLogger(DefaultTypedJob.class);

    private final JobWorker<A> worker;
    private final JobBroker broker;
    private final SchemaRegistry schemaRegistry;
    private final ArgumentBinder binder;
    private final ArgumentCodec codec;

    public DefaultTypedJob(
            JobWorker<A> worker,
            JobBroker broker,
            SchemaRegistry schemaRegistry,
            ArgumentBinder binder,
            ArgumentCodec codec
    ) {
        this.worker = Objects.requireNonNull(worker, "worker must not be null");
        this.broker = Objects.requireNonNull(broker, "broker must not be null");
        this.schemaRegistry = Objects.requireNonNull(schemaRegistry, "schemaRegistry must not be null");
        this.binder = Objects.requireNonNull(binder, "binder must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
    }

    @Override
    public String name() {
        return worker.name();
    }

    @Override
    public JobWorker<A> worker() {
        return worker;
    }

    @Override
    public Optional<ArgumentSchema> schema() {
        return schemaRegistry.resolve(worker);
    }

    @Override
    @SuppressWarnings("unchecked")
    public A buildArguments(Map<String, ?> arguments) {
        return (A) binder.bind(name(), schema().orElse(null), arguments);
    }

    @Override
    public String submit(Map<String, ?> arguments) {
        WirePayload payload = prepare(arguments);
        String jobId = broker.submit(name(), payload);
        log.debug("Job submitted name={} jobId={}", name(), jobId);
        return jobId;
    }

    @Override
    public String submit() {
        return submit(Map.of());
    }

    @Override
    public String scheduleAt(Instant time, Map<String, ?> arguments) {
        Objects.requireNonNull(time, "time must not be null");
        WirePayload payload = prepare(arguments);
        String jobId = broker.scheduleAt(name(), time, payload);
        log.debug("Job scheduled name={} jobId={} runAt={}", name(), jobId, time);
        return jobId;
    }

    @Override
    public String scheduleAt(Number epochSeconds, Map<String, ?> arguments) {
        return scheduleAt(IntervalParser.instantOfEpochSeconds(epochSeconds), arguments);
    }

    @Override
    public String scheduleIn(Duration delay, Map<String, ?> arguments) {
        Objects.requireNonNull(delay, "delay must not be null");
        WirePayload payload = prepare(arguments);
        String jobId = broker.scheduleIn(name(), delay, payload);
        log.debug("Job scheduled name={} jobId={} delay={}", name(), jobId, delay);
        return jobId;
    }

    @Override
    public String scheduleIn(Number delaySeconds, Map<String, ?> arguments) {
        return scheduleIn(IntervalParser.ofSeconds(delaySeconds), arguments);
    }

    @Override
    public String scheduleIn(String interval, Map<String, ?> arguments) {
        return scheduleIn(IntervalParser.parseDuration(interval), arguments);
    }

    @Override
    public Object runSynchronously(Map<String, ?> arguments) {
        A args = buildArguments(arguments);
        return execute(args, ExecutionMode.SYNCHRONOUS);
    }

    @Override
    public Object runSynchronously() {
        return runSynchronously(Map.of());
    }

    @Override
    @SuppressWarnings("unchecked")
    public Object dispatch(WirePayload payload) {
        log.debug("Dispatching job name={}", name());
        A args = (A) codec.deserialize(name(), schema().orElse(null), payload);
        return execute(args, ExecutionMode.DISPATCHED);
    }

    private WirePayload prepare(Map<String, ?> arguments) {
        A args = buildArguments(arguments);
        return codec.serialize(name(), args);
    }

    private Object execute(A args, ExecutionMode mode) {
        JobContext<A> context = args == null
                ? JobContext.withoutArgs(name(), mode)
                : new JobContext<>(name(), schema().orElse(null), args, mode);
        try {
            return worker.run(context);
        } catch (JobArgsException e) {
            throw e;
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw new JobArgsException("Error in " + name() + "#run: " + e.getMessage() + "\n" + stackTraceOf(e), e);
        }
    }

    private static String stackTraceOf(Throwable e) {
        StringWriter trace = new StringWriter();
        e.printStackTrace(new PrintWriter(trace));
        return trace.toString();
    }

    @Override
    public String toString() {
        return "TypedJob{" + name() + "}";
    }
}
