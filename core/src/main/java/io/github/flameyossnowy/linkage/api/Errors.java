package io.github.flameyossnowy.linkage.api;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Unmodifiable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validation messages of a record, keyed by attribute.
 * Messages that concern the record as a whole are stored under {@link #BASE}.
 */
public final class Errors {
    public static final String BASE = "base";

    private final Map<String, List<String>> messages = new LinkedHashMap<>(4);

    public void add(@NotNull String attribute, @NotNull String message) {
        messages.computeIfAbsent(attribute, k -> new ArrayList<>(1)).add(message);
    }

    public @Unmodifiable @NotNull List<String> on(@NotNull String attribute) {
        List<String> list = messages.get(attribute);
        return list == null ? List.of() : Collections.unmodifiableList(list);
    }

    public boolean isEmpty() {
        return messages.isEmpty();
    }

    public int size() {
        int size = 0;
        for (List<String> list : messages.values()) size += list.size();
        return size;
    }

    public void clear() {
        messages.clear();
    }

    /**
     * @return every message, prefixed with its attribute unless it is a {@link #BASE} message
     */
    public @NotNull List<String> fullMessages() {
        List<String> full = new ArrayList<>(size());
        for (Map.Entry<String, List<String>> entry : messages.entrySet()) {
            for (String message : entry.getValue()) {
                full.add(BASE.equals(entry.getKey()) ? message : entry.getKey() + ' ' + message);
            }
        }
        return full;
    }

    @Override
    public String toString() {
        return "Errors" + messages;
    }
}
