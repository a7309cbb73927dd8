package io.jobargs4j.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.type.LogicalType;
import io.jobargs4j.SerializationException;
import io.jobargs4j.utils.Primitives;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.InvocationTargetException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Converts typed arguments to {@link WirePayload}s and back.
 *
 * <p>The two directions are deliberately asymmetric:
 * <ul>
 *   <li>Outbound ({@link #serialize}) never coerces; arguments are already strictly typed.</li>
 *   <li>Inbound ({@link #deserialize}) always coerces, because JSON transports lose type
 *       fidelity: {@code "42"} becomes {@code 42}, {@code "true"} becomes {@code true},
 *       {@code 123} becomes {@code "123"} for string fields, and so on.</li>
 * </ul>
 * Scalar coercion is delegated to Jackson.
 */
public class ArgumentCodec {

    private static final Logger log = LoggerFactory.getLogger(ArgumentCodec.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final SchemaRegistry schemaRegistry;

    public ArgumentCodec(ObjectMapper objectMapper, SchemaRegistry schemaRegistry) {
        Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.objectMapper = configure(objectMapper.copy());
        this.schemaRegistry = Objects.requireNonNull(schemaRegistry, "schemaRegistry must not be null");
    }

    @SuppressWarnings("deprecation")
    private static ObjectMapper configure(ObjectMapper mapper) {
        mapper.configure(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS, true);
        mapper.disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT);
        mapper.enable(DeserializationFeature.FAIL_ON_NUMBERS_FOR_ENUMS);
        // "" is not an empty value and 1 is not true
        mapper.coercionConfigDefaults().setCoercion(CoercionInputShape.EmptyString, CoercionAction.Fail);
        mapper.coercionConfigFor(LogicalType.Boolean).setCoercion(CoercionInputShape.Integer, CoercionAction.Fail);
        return mapper;
    }

    /**
     * Serialize an {@code Args} record into a string-keyed, JSON-compatible payload.
     *
     * @param workerName used in error messages
     * @param args       record instance; {@code null} yields an empty payload
     * @throws SerializationException on any failure, whatever its origin
     */
    public WirePayload serialize(String workerName, Object args) {
        if (args == null) {
            return WirePayload.empty();
        }
        try {
            if (!(args instanceof Record record)) {
                throw new IllegalArgumentException(args.getClass().getName() + " is not a record");
            }
            ArgumentSchema schema = schemaRegistry.schemaOf(record.getClass());
            return new WirePayload(serializeRecord(schema, record));
        } catch (RuntimeException e) {
            throw new SerializationException("Failed to serialize args for " + workerName + ": " + messageOf(e), e);
        }
    }

    /**
     * Rebuild typed arguments from a payload, coercing values to the declared types.
     *
     * @param workerName used in error messages
     * @param schema     target schema; {@code null} for workers without arguments
     * @return the {@code Args} record, or {@code null} when {@code schema} is null
     * @throws SerializationException if a value cannot be coerced or a required field is missing
     */
    public Object deserialize(String workerName, ArgumentSchema schema, WirePayload payload) {
        if (schema == null) {
            return null;
        }
        Map<String, Object> values = payload == null ? Map.of() : payload.values();
        try {
            return deserializeRecord(schema, values, "");
        } catch (RuntimeException e) {
            throw new SerializationException("Failed to deserialize args for " + workerName + ": " + messageOf(e), e);
        }
    }

    public String toJson(WirePayload payload) {
        Objects.requireNonNull(payload, "payload must not be null");
        try {
            return objectMapper.writeValueAsString(payload.values());
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to write payload as JSON: " + e.getOriginalMessage(), e);
        }
    }

    public WirePayload fromJson(String json) {
        if (json == null || json.isBlank()) {
            return WirePayload.empty();
        }
        try {
            return new WirePayload(objectMapper.readValue(json, MAP_TYPE));
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to read payload JSON: " + e.getOriginalMessage(), e);
        }
    }

    /* ================= outbound ================= */

    private Map<String, Object> serializeRecord(ArgumentSchema schema, Object instance) {
        if (!schema.recordType().isInstance(instance)) {
            throw new IllegalArgumentException("expected " + schema.recordType().getName()
                    + ", got " + instance.getClass().getName());
        }
        Map<String, Object> out = new LinkedHashMap<>();
        for (ArgumentField field : schema.fields()) {
            out.put(field.name(), serializeValue(field.type(), field.read(instance)));
        }
        return out;
    }

    private Object serializeValue(TypeDescriptor type, Object value) {
        if (value == null) {
            return null;
        }
        return switch (type.kind()) {
            case STRING, INTEGER, FLOAT, BOOLEAN -> value;
            case ENUM -> objectMapper.convertValue(value, String.class);
            case ARRAY -> {
                if (!(value instanceof Collection<?> items)) {
                    throw new IllegalArgumentException("expected a list, got " + value.getClass().getName());
                }
                List<Object> out = new ArrayList<>(items.size());
                for (Object item : items) {
                    out.add(serializeValue(type.elementType(), item));
                }
                yield out;
            }
            case MAP -> {
                if (!(value instanceof Map<?, ?> entries)) {
                    throw new IllegalArgumentException("expected a map, got " + value.getClass().getName());
                }
                Map<String, Object> out = new LinkedHashMap<>();
                for (Map.Entry<?, ?> e : entries.entrySet()) {
                    out.put(keyText(e.getKey()), serializeValue(type.valueType(), e.getValue()));
                }
                yield out;
            }
            case RECORD -> {
                @SuppressWarnings("unchecked")
                Class<? extends Record> recordType = (Class<? extends Record>) type.rawType();
                yield serializeRecord(schemaRegistry.schemaOf(recordType), value);
            }
            case ANY -> stringifyKeys(objectMapper.convertValue(value, Object.class));
        };
    }

    private String keyText(Object key) {
        if (key instanceof Enum<?>) {
            return objectMapper.convertValue(key, String.class);
        }
        return String.valueOf(key);
    }

    private static Object stringifyKeys(Object value) {
        if (value instanceof Map<?, ?> entries) {
            Map<String, Object> out = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : entries.entrySet()) {
                out.put(String.valueOf(e.getKey()), stringifyKeys(e.getValue()));
            }
            return out;
        }
        if (value instanceof Collection<?> items) {
            List<Object> out = new ArrayList<>(items.size());
            for (Object item : items) {
                out.add(stringifyKeys(item));
            }
            return out;
        }
        return value;
    }

    /* ================= inbound ================= */

    private Record deserializeRecord(ArgumentSchema schema, Map<?, ?> values, String path) {
        for (Object key : values.keySet()) {
            if (!schema.hasField(String.valueOf(key))) {
                log.debug("Ignoring undeclared payload key key={} record={}", qualify(path, key), schema.recordType().getSimpleName());
            }
        }

        List<ArgumentField> fields = schema.fields();
        Object[] arguments = new Object[fields.size()];
        for (int i = 0; i < fields.size(); i++) {
            ArgumentField field = fields.get(i);
            String fieldPath = qualify(path, field.name());
            Object raw = values.get(field.name());

            if (raw == null && !field.nullable()) {
                if (field.hasDefault()) {
                    arguments[i] = field.defaultValue();
                    continue;
                }
                if (!values.containsKey(field.name())) {
                    throw new IllegalArgumentException("missing required argument '" + fieldPath + "'");
                }
                throw new IllegalArgumentException("argument '" + fieldPath + "' must not be null");
            }
            if (!values.containsKey(field.name())) {
                arguments[i] = field.defaultValue();
                continue;
            }

            Object value = coerce(field.type(), raw, fieldPath);
            if (value == null && !field.nullable()) {
                throw new IllegalArgumentException("argument '" + fieldPath + "' must not be null");
            }
            arguments[i] = value;
        }

        try {
            return schema.instantiate(arguments);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new IllegalArgumentException(schema.recordType().getSimpleName() + " rejected the arguments: "
                    + cause.getMessage(), cause);
        }
    }

    private Object coerce(TypeDescriptor type, Object raw, String path) {
        if (raw == null) {
            return null;
        }
        return switch (type.kind()) {
            case STRING, INTEGER, FLOAT, BOOLEAN, ENUM -> coerceScalar(type, raw, path);
            case ARRAY -> {
                if (!(raw instanceof Collection<?> items)) {
                    throw new IllegalArgumentException("argument '" + path + "' expected a list, got " + typeName(raw));
                }
                List<Object> out = new ArrayList<>(items.size());
                int index = 0;
                for (Object item : items) {
                    out.add(coerceElement(type.elementType(), item, path + "[" + index++ + "]"));
                }
                yield Collections.unmodifiableList(out);
            }
            case MAP -> {
                if (!(raw instanceof Map<?, ?> entries)) {
                    throw new IllegalArgumentException("argument '" + path + "' expected a map, got " + typeName(raw));
                }
                Map<Object, Object> out = new LinkedHashMap<>();
                for (Map.Entry<?, ?> e : entries.entrySet()) {
                    String entryPath = qualify(path, e.getKey());
                    Object key = coerce(type.keyType(), e.getKey(), entryPath);
                    if (key == null) {
                        throw new IllegalArgumentException("argument '" + entryPath + "' has an empty key");
                    }
                    out.put(key, coerceElement(type.valueType(), e.getValue(), entryPath));
                }
                yield Collections.unmodifiableMap(out);
            }
            case RECORD -> {
                if (type.rawType().isInstance(raw)) {
                    yield raw;
                }
                if (!(raw instanceof Map<?, ?> entries)) {
                    throw new IllegalArgumentException("argument '" + path + "' expected an object, got " + typeName(raw));
                }
                @SuppressWarnings("unchecked")
                Class<? extends Record> recordType = (Class<? extends Record>) type.rawType();
                yield deserializeRecord(schemaRegistry.schemaOf(recordType), entries, path);
            }
            case ANY -> raw;
        };
    }

    private Object coerceElement(TypeDescriptor type, Object raw, String path) {
        if (raw == null && type.kind() != TypeDescriptor.Kind.ANY) {
            throw new IllegalArgumentException("argument '" + path + "' must not be null");
        }
        return coerce(type, raw, path);
    }

    private Object coerceScalar(TypeDescriptor type, Object raw, String path) {
        if (raw instanceof Map<?, ?> || raw instanceof Collection<?>) {
            throw new IllegalArgumentException("argument '" + path + "' expected " + type.describe()
                    + ", got " + typeName(raw));
        }
        if (type.kind() == TypeDescriptor.Kind.STRING && raw instanceof Number number) {
            return decimalText(number);
        }
        try {
            return objectMapper.convertValue(raw, Primitives.wrap(type.rawType()));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("argument '" + path + "': " + e.getMessage(), e);
        }
    }

    // 1.0E10 -> "10000000000", 1.0E-7 -> "0.0000001"; plain values keep their own text
    private static String decimalText(Number number) {
        String text = number.toString();
        if (text.indexOf('E') < 0 || !isFinite(number)) {
            return text;
        }
        return new BigDecimal(text).stripTrailingZeros().toPlainString();
    }

    private static boolean isFinite(Number number) {
        if (number instanceof Double d) {
            return Double.isFinite(d);
        }
        if (number instanceof Float f) {
            return Float.isFinite(f);
        }
        return true;
    }

    private static String qualify(String path, Object name) {
        return path.isEmpty() ? String.valueOf(name) : path + "." + name;
    }

    private static String typeName(Object value) {
        return value.getClass().getSimpleName();
    }

    private static String messageOf(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
