package io.github.flameyossnowy.linkage.api.utils;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Normalises user supplied identity keys: flattening, blank removal, conversion and de-duplication.
 */
public final class IdentityKeys {
    private static final Pattern INTEGRAL = Pattern.compile("[+-]?\\d+");
    private static final Pattern UUID_PATTERN = Pattern.compile("[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");

    private IdentityKeys() {}

    /**
     * Flattens nested collections and arrays.
     *
     * @param input a single value, a collection or an array, possibly nested
     * @return every leaf value, nulls included
     */
    public static @NotNull List<Object> flatten(@Nullable Object input) {
        List<Object> flat = new ArrayList<>();
        flattenInto(input, flat);
        return flat;
    }

    private static void flattenInto(Object input, List<Object> into) {
        if (input instanceof Collection<?> collection) {
            for (Object element : collection) flattenInto(element, into);
        } else if (input != null && input.getClass().isArray()) {
            int length = Array.getLength(input);
            for (int i = 0; i < length; i++) flattenInto(Array.get(input, i), into);
        } else {
            into.add(input);
        }
    }

    public static boolean isBlank(@Nullable Object value) {
        return value == null || value instanceof CharSequence sequence && sequence.toString().isBlank();
    }

    /**
     * Converts every non-blank key to {@code idType}, keeping the first occurrence of each.
     * Keys that cannot be converted are dropped like blank ones.
     *
     * @param input the keys, possibly nested
     * @param idType the identity key type of the repository
     * @return the converted keys in input order
     */
    public static @NotNull List<Object> normalize(@Nullable Object input, @NotNull Class<?> idType) {
        Set<Object> keys = new LinkedHashSet<>();
        for (Object raw : flatten(input)) {
            if (isBlank(raw)) continue;

            Object converted = convert(raw, idType);
            if (converted == null) {
                Logging.deepInfo(() -> "Dropping identity key " + raw + " that is not a " + idType.getSimpleName());
                continue;
            }
            keys.add(converted);
        }
        return new ArrayList<>(keys);
    }

    /**
     * @return the converted key, or null when {@code raw} has no representation in {@code idType}
     */
    public static @Nullable Object convert(@NotNull Object raw, @NotNull Class<?> idType) {
        Class<?> type = Primitives.asWrapper(idType);
        if (type.isInstance(raw)) return raw;

        String text = raw.toString().trim();
        if (type == String.class) return text;
        if (type == Long.class) {
            if (raw instanceof Number number) return isIntegral(number) ? number.longValue() : null;
            return parse(text, true);
        }
        if (type == Integer.class) {
            if (raw instanceof Number number) {
                if (!isIntegral(number)) return null;
                long value = number.longValue();
                return value == (int) value ? (int) value : null;
            }
            return parse(text, false);
        }
        if (type == UUID.class) {
            return UUID_PATTERN.matcher(text).matches() ? UUID.fromString(text) : null;
        }
        return null;
    }

    private static boolean isIntegral(Number number) {
        return number instanceof Long || number instanceof Integer || number instanceof Short || number instanceof Byte;
    }

    private static @Nullable Object parse(String text, boolean wide) {
        if (!INTEGRAL.matcher(text).matches()) return null;
        try {
            if (wide) return Long.parseLong(text);
            return Integer.parseInt(text);
        } catch (NumberFormatException overflow) {
            return null;
        }
    }
}
