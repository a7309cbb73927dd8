package io.jobargs4j.core;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * One declared field of an {@link ArgumentSchema}.
 *
 * @param name            component name, unique within the schema
 * @param type            semantic type
 * @param nullable        whether {@code null} is an accepted value
 * @param defaultSupplier produces a fresh default per use; null when the field has no default
 * @param accessor        record accessor method
 */
public record ArgumentField(
        String name,
        TypeDescriptor type,
        boolean nullable,
        Supplier<?> defaultSupplier,
        Method accessor
) {

    public ArgumentField {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(accessor, "accessor must not be null");
    }

    /**
     * Required fields have neither a default nor a nullable declaration.
     */
    public boolean required() {
        return defaultSupplier == null && !nullable;
    }

    public boolean hasDefault() {
        return defaultSupplier != null;
    }

    /**
     * Value used when the field is omitted: the declared default, or {@code null} for a nullable
     * field without one.
     */
    public Object defaultValue() {
        if (defaultSupplier != null) {
            return defaultSupplier.get();
        }
        if (nullable) {
            return null;
        }
        throw new IllegalStateException("argument '" + name + "' is required and has no default");
    }

    public Object read(Object instance) {
        try {
            return accessor.invoke(instance);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new IllegalStateException("Failed to read argument '" + name + "'", cause);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot access argument '" + name + "'", e);
        }
    }
}
