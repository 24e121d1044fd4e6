package io.github.flameyossnowy.recordmapper.api.meta;

import io.github.flameyossnowy.recordmapper.api.exceptions.DescriptorException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered field metadata for one record type, plus the means to construct it.
 * <p>
 * Field order is declaration order and is also the argument order expected by
 * {@link #factory()}. External names are unique within one descriptor.
 */
public final class RecordTypeDescriptor {
    private final Class<?> type;
    private final List<FieldDescriptor> fields;
    private final InstanceFactory factory;

    private final Map<String, FieldDescriptor> byName;
    private final Map<String, FieldDescriptor> byExternalName;

    public RecordTypeDescriptor(@NotNull Class<?> type, @NotNull List<FieldDescriptor> fields, @NotNull InstanceFactory factory) {
        this.type = type;
        this.fields = List.copyOf(fields);
        this.factory = factory;

        Map<String, FieldDescriptor> names = new LinkedHashMap<>();
        Map<String, FieldDescriptor> externalNames = new LinkedHashMap<>();
        for (FieldDescriptor field : this.fields) {
            if (names.put(field.name(), field) != null) {
                throw new DescriptorException(type, "duplicate field name '" + field.name() + "'");
            }

            FieldDescriptor clash = externalNames.put(field.externalName(), field);
            if (clash != null) {
                throw new DescriptorException(type, "fields '" + clash.name() + "' and '" + field.name()
                    + "' both map to external name '" + field.externalName() + "'");
            }
        }

        this.byName = Collections.unmodifiableMap(names);
        this.byExternalName = Collections.unmodifiableMap(externalNames);
    }

    public @NotNull Class<?> type() {
        return type;
    }

    public @NotNull List<FieldDescriptor> fields() {
        return fields;
    }

    public @NotNull InstanceFactory factory() {
        return factory;
    }

    public @Nullable FieldDescriptor field(String name) {
        return byName.get(name);
    }

    public @Nullable FieldDescriptor fieldByExternalName(String externalName) {
        return byExternalName.get(externalName);
    }

    public int size() {
        return fields.size();
    }

    @Override
    public String toString() {
        return "RecordTypeDescriptor{" + type.getName() + ", fields=" + byName.keySet() + '}';
    }
}
