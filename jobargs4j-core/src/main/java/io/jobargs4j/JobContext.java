package io.jobargs4j;

import io.jobargs4j.core.ArgumentField;
import io.jobargs4j.core.ArgumentSchema;
import io.jobargs4j.core.ExecutionMode;
import io.jobargs4j.utils.Primitives;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Runtime state of a single worker invocation.
 *
 * <p>Exposes each declared argument by name through {@link #get(String)}, and the whole
 * typed instance through {@link #args()}.
 */
public final class JobContext<A> {

    private final String workerName;
    private final ArgumentSchema schema;
    private final A args;
    private final ExecutionMode mode;

    public JobContext(String workerName, ArgumentSchema schema, A args, ExecutionMode mode) {
        this.workerName = Objects.requireNonNull(workerName, "workerName must not be null");
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
        if (args != null) {
            if (schema == null) {
                throw new IllegalArgumentException("args given without a schema for " + workerName);
            }
            if (!schema.recordType().isInstance(args)) {
                throw new IllegalArgumentException("args for " + workerName + " must be an instance of "
                        + schema.recordType().getName() + ", got " + args.getClass().getName());
            }
        }
        this.schema = schema;
        this.args = args;
    }

    public static <A> JobContext<A> withoutArgs(String workerName, ExecutionMode mode) {
        return new JobContext<>(workerName, null, null, mode);
    }

    public String workerName() {
        return workerName;
    }

    public ExecutionMode mode() {
        return mode;
    }

    /**
     * The bundled typed arguments, or {@code null} when the worker declares none.
     */
    public A args() {
        return args;
    }

    public boolean hasArgs() {
        return args != null;
    }

    public Set<String> fieldNames() {
        if (schema == null) {
            return Set.of();
        }
        return new LinkedHashSet<>(schema.fieldNames());
    }

    /**
     * Reads a single argument by its declared name.
     *
     * @throws IllegalStateException    if the worker declares no arguments
     * @throws IllegalArgumentException if no argument has that name
     */
    @SuppressWarnings("unchecked")
    public <T> T get(String field) {
        Objects.requireNonNull(field, "field must not be null");
        if (schema == null || args == null) {
            throw new IllegalStateException(workerName + " declares no arguments");
        }
        ArgumentField argument = schema.field(field)
                .orElseThrow(() -> new IllegalArgumentException(workerName + " has no argument '" + field + "'"));
        return (T) argument.read(args);
    }

    public <T> T get(String field, Class<T> type) {
        Objects.requireNonNull(type, "type must not be null");
        Object value = get(field);
        if (value == null) {
            return null;
        }
        Class<?> expected = Primitives.wrap(type);
        if (!expected.isInstance(value)) {
            throw new ClassCastException("argument '" + field + "' of " + workerName + " is a "
                    + value.getClass().getName() + ", not " + type.getName());
        }
        @SuppressWarnings("unchecked")
        T typed = (T) value;
        return typed;
    }

    @Override
    public String toString() {
        return "JobContext{worker=" + workerName + ", mode=" + mode + ", args=" + args + "}";
    }
}
