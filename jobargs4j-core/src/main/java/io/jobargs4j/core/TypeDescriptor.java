package io.jobargs4j.core;

import java.util.Objects;

/**
 * Semantic type of an argument field.
 *
 * @param kind        type family
 * @param rawType     declared Java type (for {@code RECORD}, the nested record class)
 * @param keyType     key type for {@code MAP}, otherwise null
 * @param elementType element type for {@code ARRAY}, value type for {@code MAP}, otherwise null
 */
public record TypeDescriptor(
        Kind kind,
        Class<?> rawType,
        TypeDescriptor keyType,
        TypeDescriptor elementType
) {

    public enum Kind {
        STRING,
        INTEGER,
        FLOAT,
        BOOLEAN,
        ENUM,
        ARRAY,
        MAP,
        RECORD,
        ANY
    }

    public TypeDescriptor {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(rawType, "rawType must not be null");
    }

    public static TypeDescriptor scalar(Kind kind, Class<?> rawType) {
        return new TypeDescriptor(kind, rawType, null, null);
    }

    public static TypeDescriptor any() {
        return new TypeDescriptor(Kind.ANY, Object.class, null, null);
    }

    public static TypeDescriptor array(TypeDescriptor elementType) {
        return new TypeDescriptor(Kind.ARRAY, java.util.List.class, null,
                Objects.requireNonNull(elementType, "elementType must not be null"));
    }

    public static TypeDescriptor map(TypeDescriptor keyType, TypeDescriptor valueType) {
        return new TypeDescriptor(Kind.MAP, java.util.Map.class,
                Objects.requireNonNull(keyType, "keyType must not be null"),
                Objects.requireNonNull(valueType, "valueType must not be null"));
    }

    public static TypeDescriptor record(Class<?> recordType) {
        if (!recordType.isRecord()) {
            throw new IllegalArgumentException(recordType.getName() + " is not a record");
        }
        return new TypeDescriptor(Kind.RECORD, recordType, null, null);
    }

    /**
     * Human-readable form used in error messages, e.g. {@code List<String>}.
     */
    public String describe() {
        return switch (kind) {
            case ARRAY -> "List<" + elementType.describe() + ">";
            case MAP -> "Map<" + keyType.describe() + ", " + valueType().describe() + ">";
            case ANY -> "Object";
            default -> rawType.getSimpleName();
        };
    }

    /**
     * Value type of a {@code MAP}. Alias of {@link #elementType()}.
     */
    public TypeDescriptor valueType() {
        return elementType;
    }

    @Override
    public String toString() {
        return describe();
    }
}
