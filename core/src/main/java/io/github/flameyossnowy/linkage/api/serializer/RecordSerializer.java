package io.github.flameyossnowy.linkage.api.serializer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.flameyossnowy.linkage.api.Record;
import io.github.flameyossnowy.linkage.api.associations.Association;
import io.github.flameyossnowy.linkage.api.associations.BelongsToAssociation;
import io.github.flameyossnowy.linkage.api.associations.CollectionAssociation;
import io.github.flameyossnowy.linkage.api.exceptions.SerializationException;
import io.github.flameyossnowy.linkage.api.reflect.Reflection;
import io.github.flameyossnowy.linkage.api.reflect.ReflectionRegistry;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renders a record and its declared associations as an ordered map or as JSON.
 * <p>
 * Subclasses can be named by the {@code serializer} and {@code eachSerializer} declaration
 * options, they need a public no-arg constructor. Records already being rendered higher up
 * are rendered as their identity key, which keeps inverse associations from recursing.
 *
 * @param <T> the record type
 */
public class RecordSerializer<T extends Record> {
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final Set<String> only;
    private final Set<String> except;

    public RecordSerializer() {
        this(Set.of(), Set.of());
    }

    public RecordSerializer(@NotNull Collection<String> only, @NotNull Collection<String> except) {
        this.only = Collections.unmodifiableSet(new LinkedHashSet<>(only));
        this.except = Collections.unmodifiableSet(new LinkedHashSet<>(except));
    }

    public @NotNull Map<String, Object> serialize(@NotNull T record) {
        return serialize(record, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    public @NotNull List<Map<String, Object>> serializeAll(@NotNull Collection<? extends T> records) {
        List<Map<String, Object>> rendered = new ArrayList<>(records.size());
        for (T record : records) rendered.add(serialize(record));
        return rendered;
    }

    public @NotNull String toJson(@NotNull T record) {
        try {
            return MAPPER.writeValueAsString(serialize(record));
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to render " + record + " as JSON", e);
        }
    }

    protected @NotNull Map<String, Object> serialize(@NotNull T record, @NotNull Set<Record> rendering) {
        rendering.add(record);
        try {
            Map<String, Object> output = new LinkedHashMap<>();
            Map<String, Reflection> reflections = ReflectionRegistry.reflections(record.getClass());

            for (Map.Entry<String, Object> attribute : record.attributes().entrySet()) {
                String key = attribute.getKey();
                if (reflections.containsKey(key) || !includes(key)) continue;
                output.put(key, attribute.getValue());
            }

            for (Reflection reflection : reflections.values()) {
                if (includes(reflection.name())) serializeAssociation(record, reflection, output, rendering);
            }
            return output;
        } finally {
            rendering.remove(record);
        }
    }

    protected boolean includes(@NotNull String key) {
        if (!only.isEmpty() && !only.contains(key)) return false;
        return !except.contains(key);
    }

    private void serializeAssociation(T record, Reflection reflection, Map<String, Object> output, Set<Record> rendering) {
        Map<String, Object> options = reflection.options();
        String name = reflection.name();

        if (options.containsKey("virtualValue")) {
            output.put(name, options.get("virtualValue"));
            return;
        }

        Association<?> association = reflection.kind().create(record, reflection);
        if ("ids".equals(options.get("embed"))) {
            if (association instanceof CollectionAssociation<?> collection) {
                output.put(singularize(name) + "Ids", collection.idsReader());
            } else {
                output.put(name + "Id", record.readAttribute(reflection.foreignKey()));
            }
            return;
        }

        if (association instanceof CollectionAssociation<?> collection) {
            RecordSerializer<Record> serializer = nestedSerializer(reflection, "eachSerializer");
            List<Object> members = new ArrayList<>();
            for (Record member : collection.loadTarget()) {
                members.add(serializer.serializeNested(member, rendering));
            }
            output.put(name, members);
        } else {
            Record target = ((BelongsToAssociation<?>) association).reader();
            output.put(name, target == null ? null : nestedSerializer(reflection, "serializer").serializeNested(target, rendering));
        }
    }

    private @Nullable Object serializeNested(@NotNull Record record, @NotNull Set<Record> rendering) {
        if (rendering.contains(record)) return record.getId();

        @SuppressWarnings("unchecked")
        T cast = (T) record;
        return serialize(cast, rendering);
    }

    @SuppressWarnings("unchecked")
    private static RecordSerializer<Record> nestedSerializer(Reflection reflection, String option) {
        Object declared = reflection.options().get(option);
        if (declared instanceof Class<?> type) {
            try {
                return (RecordSerializer<Record>) type.getDeclaredConstructor().newInstance();
            } catch (ReflectiveOperationException e) {
                throw new SerializationException("Unable to create serializer " + type.getName() + " for " + reflection, e);
            }
        }
        return new RecordSerializer<>(strings(reflection.options().get("only")), strings(reflection.options().get("except")));
    }

    private static Collection<String> strings(@Nullable Object value) {
        if (value == null) return List.of();
        if (value instanceof String text) return List.of(text);
        if (value instanceof String[] array) return Arrays.asList(array);

        List<String> strings = new ArrayList<>();
        for (Object element : (Collection<?>) value) strings.add((String) element);
        return strings;
    }

    static String singularize(String name) {
        if (name.endsWith("ies")) return name.substring(0, name.length() - 3) + 'y';
        if (name.endsWith("s") && !name.endsWith("ss")) return name.substring(0, name.length() - 1);
        return name;
    }
}
