package io.jobargs4j.internal;

import io.jobargs4j.InvalidArgsException;
import io.jobargs4j.core.ArgumentField;
import io.jobargs4j.core.ArgumentSchema;
import io.jobargs4j.core.SchemaRegistry;
import io.jobargs4j.core.TypeDescriptor;
import io.jobargs4j.utils.Primitives;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Strict binding of caller-supplied arguments to an {@code Args} record.
 *
 * <p>No coercion happens here: a {@code "42"} for an integer field is a caller bug and is
 * rejected. The only conversions are lossless widenings between integer boxes.
 */
public class ArgumentBinder {

    private static final Logger log = LoggerFactory.getLogger(ArgumentBinder.class);

    private static final int MAX_VALUE_TEXT = 50;

    private final SchemaRegistry schemaRegistry;

    public ArgumentBinder(SchemaRegistry schemaRegistry) {
        this.schemaRegistry = Objects.requireNonNull(schemaRegistry, "schemaRegistry must not be null");
    }

    /**
     * @param schema    null for workers without arguments, in which case {@code arguments} are ignored
     * @param arguments raw keyword arguments; null is treated as empty
     * @return the record instance, or {@code null} when {@code schema} is null
     * @throws InvalidArgsException if the arguments do not satisfy the schema
     */
    public Object bind(String workerName, ArgumentSchema schema, Map<String, ?> arguments) {
        Map<String, ?> given = arguments == null ? Map.of() : arguments;
        if (schema == null) {
            if (!given.isEmpty()) {
                log.debug("Ignoring arguments for worker without Args name={} keys={}", workerName, given.keySet());
            }
            return null;
        }
        try {
            return bindRecord(schema, given, "");
        } catch (IllegalArgumentException e) {
            throw new InvalidArgsException("Invalid arguments for " + workerName + ": " + e.getMessage(), e);
        }
    }

    private Record bindRecord(ArgumentSchema schema, Map<?, ?> given, String path) {
        List<String> unknown = new ArrayList<>();
        for (Object key : given.keySet()) {
            if (!(key instanceof String name) || !schema.hasField(name)) {
                unknown.add("'" + qualify(path, key) + "'");
            }
        }
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException((unknown.size() == 1 ? "unknown argument " : "unknown arguments ")
                    + String.join(", ", unknown));
        }

        List<ArgumentField> fields = schema.fields();
        Object[] values = new Object[fields.size()];
        for (int i = 0; i < fields.size(); i++) {
            ArgumentField field = fields.get(i);
            String fieldPath = qualify(path, field.name());

            if (!given.containsKey(field.name())) {
                if (field.required()) {
                    throw new IllegalArgumentException("missing required argument '" + fieldPath + "'");
                }
                values[i] = field.defaultValue();
                continue;
            }

            Object value = given.get(field.name());
            if (value == null) {
                if (!field.nullable()) {
                    throw new IllegalArgumentException("argument '" + fieldPath + "' must not be null");
                }
                values[i] = null;
                continue;
            }
            values[i] = check(field.type(), value, fieldPath);
        }

        try {
            return schema.instantiate(values);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new IllegalArgumentException(schema.recordType().getSimpleName() + " rejected the arguments: "
                    + cause.getMessage(), cause);
        }
    }

    private Object check(TypeDescriptor type, Object value, String path) {
        switch (type.kind()) {
            case STRING -> {
                if (value instanceof String) {
                    return value;
                }
            }
            case BOOLEAN -> {
                if (value instanceof Boolean) {
                    return value;
                }
            }
            case INTEGER -> {
                boolean intLike = value instanceof Integer || value instanceof Short || value instanceof Byte;
                if (Primitives.wrap(type.rawType()) == Long.class) {
                    if (intLike || value instanceof Long) {
                        return ((Number) value).longValue();
                    }
                } else if (intLike) {
                    return ((Number) value).intValue();
                }
            }
            case FLOAT -> {
                if (Primitives.wrap(type.rawType()) == Double.class) {
                    if (value instanceof Double || value instanceof Float) {
                        return ((Number) value).doubleValue();
                    }
                } else if (value instanceof Float) {
                    return value;
                }
            }
            case ENUM, RECORD -> {
                if (type.rawType().isInstance(value)) {
                    if (type.kind() == TypeDescriptor.Kind.RECORD) {
                        checkRecordInstance(type, value, path);
                    }
                    return value;
                }
            }
            case ARRAY -> {
                if (value instanceof List<?> items) {
                    List<Object> out = new ArrayList<>(items.size());
                    for (int i = 0; i < items.size(); i++) {
                        out.add(checkElement(type.elementType(), items.get(i), path + "[" + i + "]"));
                    }
                    return Collections.unmodifiableList(out);
                }
            }
            case MAP -> {
                if (value instanceof Map<?, ?> entries) {
                    Map<Object, Object> out = new LinkedHashMap<>();
                    for (Map.Entry<?, ?> e : entries.entrySet()) {
                        String entryPath = qualify(path, e.getKey());
                        if (e.getKey() == null) {
                            throw new IllegalArgumentException("argument '" + path + "' contains a null key");
                        }
                        Object key = check(type.keyType(), e.getKey(), entryPath);
                        out.put(key, checkElement(type.valueType(), e.getValue(), entryPath));
                    }
                    return Collections.unmodifiableMap(out);
                }
            }
            case ANY -> {
                return value;
            }
        }
        throw new IllegalArgumentException("argument '" + path + "' expected " + type.describe()
                + ", got " + describeValue(value));
    }

    private Object checkElement(TypeDescriptor type, Object value, String path) {
        if (value == null) {
            if (type.kind() == TypeDescriptor.Kind.ANY) {
                return null;
            }
            throw new IllegalArgumentException("argument '" + path + "' must not be null");
        }
        return check(type, value, path);
    }

    /**
     * Record instances are built by the caller, so their contents are checked the same way
     * serialized ones would be on the way back in.
     */
    private void checkRecordInstance(TypeDescriptor type, Object instance, String path) {
        @SuppressWarnings("unchecked")
        Class<? extends Record> recordType = (Class<? extends Record>) type.rawType();
        ArgumentSchema schema = schemaRegistry.schemaOf(recordType);
        for (ArgumentField field : schema.fields()) {
            String fieldPath = qualify(path, field.name());
            Object value = field.read(instance);
            if (value == null) {
                if (!field.nullable()) {
                    throw new IllegalArgumentException("argument '" + fieldPath + "' must not be null");
                }
                continue;
            }
            check(field.type(), value, fieldPath);
        }
    }

    private static String qualify(String path, Object name) {
        return path.isEmpty() ? String.valueOf(name) : path + "." + name;
    }

    private static String describeValue(Object value) {
        String text = value instanceof String ? "\"" + value + "\"" : String.valueOf(value);
        if (text.length() > MAX_VALUE_TEXT) {
            text = text.substring(0, MAX_VALUE_TEXT) + "...";
        }
        return value.getClass().getSimpleName() + " " + text;
    }
}
