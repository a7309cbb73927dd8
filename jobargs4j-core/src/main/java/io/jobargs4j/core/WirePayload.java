package io.jobargs4j.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * String-keyed, JSON-compatible representation of a job's arguments as carried by a broker.
 *
 * <p>Values are strings, numbers, booleans, {@code null}, lists or nested string-keyed maps.
 */
public record WirePayload(Map<String, Object> values) {

    private static final WirePayload EMPTY = new WirePayload(Map.of());

    public WirePayload {
        values = (values == null || values.isEmpty())
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static WirePayload empty() {
        return EMPTY;
    }

    public static WirePayload of(Map<String, ?> values) {
        return values == null ? EMPTY : new WirePayload(new LinkedHashMap<>(values));
    }

    public Object get(String key) {
        return values.get(key);
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }
}
