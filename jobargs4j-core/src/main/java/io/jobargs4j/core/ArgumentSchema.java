package io.jobargs4j.core;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered, immutable description of a worker's {@code Args} record.
 */
public final class ArgumentSchema {

    private final Class<? extends Record> recordType;
    private final List<ArgumentField> fields;
    private final Map<String, ArgumentField> fieldsByName;
    private final Constructor<?> constructor;

    public ArgumentSchema(Class<? extends Record> recordType, List<ArgumentField> fields, Constructor<?> constructor) {
        this.recordType = Objects.requireNonNull(recordType, "recordType must not be null");
        this.fields = List.copyOf(Objects.requireNonNull(fields, "fields must not be null"));
        this.constructor = Objects.requireNonNull(constructor, "constructor must not be null");

        Map<String, ArgumentField> byName = new LinkedHashMap<>();
        for (ArgumentField field : this.fields) {
            if (byName.putIfAbsent(field.name(), field) != null) {
                throw new IllegalArgumentException("Duplicate argument name: " + field.name());
            }
        }
        this.fieldsByName = Collections.unmodifiableMap(byName);
    }

    public Class<? extends Record> recordType() {
        return recordType;
    }

    public List<ArgumentField> fields() {
        return fields;
    }

    public Optional<ArgumentField> field(String name) {
        return Optional.ofNullable(fieldsByName.get(name));
    }

    public boolean hasField(String name) {
        return fieldsByName.containsKey(name);
    }

    public List<String> fieldNames() {
        return List.copyOf(fieldsByName.keySet());
    }

    public List<ArgumentField> requiredFields() {
        return fields.stream().filter(ArgumentField::required).toList();
    }

    /**
     * Invoke the canonical constructor with values in declaration order.
     *
     * @throws InvocationTargetException if the record's constructor rejects the values
     */
    public Record instantiate(Object[] values) throws InvocationTargetException {
        if (values.length != fields.size()) {
            throw new IllegalArgumentException("Expected " + fields.size() + " values for "
                    + recordType.getSimpleName() + ", got " + values.length);
        }
        try {
            return recordType.cast(constructor.newInstance(values));
        } catch (InstantiationException | IllegalAccessException e) {
            throw new IllegalStateException("Cannot instantiate " + recordType.getName(), e);
        }
    }

    @Override
    public String toString() {
        return recordType.getSimpleName() + fields.stream()
                .map(f -> f.name() + ": " + f.type().describe())
                .toList();
    }
}
