package io.github.flameyossnowy.linkage.api.utils;

import java.util.Map;

public final class Primitives {
    private Primitives() {}

    private static final Map<Class<?>, Class<?>> PRIMITIVE_TO_WRAPPER = Map.of(
            int.class, Integer.class,
            long.class, Long.class,
            short.class, Short.class,
            byte.class, Byte.class
    );

    public static Class<?> asWrapper(Class<?> type) {
        return PRIMITIVE_TO_WRAPPER.getOrDefault(type, type);
    }
}
