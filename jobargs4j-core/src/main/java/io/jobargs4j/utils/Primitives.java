package io.jobargs4j.utils;

import java.util.Map;

public final class Primitives {

    private static final Map<Class<?>, Class<?>> WRAPPERS = Map.of(
            boolean.class, Boolean.class,
            byte.class, Byte.class,
            short.class, Short.class,
            char.class, Character.class,
            int.class, Integer.class,
            long.class, Long.class,
            float.class, Float.class,
            double.class, Double.class,
            void.class, Void.class
    );

    private Primitives() {
    }

    /**
     * Boxed counterpart of a primitive type; other types are returned unchanged.
     */
    public static Class<?> wrap(Class<?> type) {
        Class<?> wrapper = WRAPPERS.get(type);
        return wrapper != null ? wrapper : type;
    }
}
