package io.github.flameyossnowy.recordmapper.api.factory;

import io.github.flameyossnowy.recordmapper.api.exceptions.build.FieldBuildException;
import io.github.flameyossnowy.recordmapper.api.exceptions.build.MissingFieldException;
import io.github.flameyossnowy.recordmapper.api.exceptions.build.NestedTypeException;
import io.github.flameyossnowy.recordmapper.api.exceptions.build.TypeCastException;
import io.github.flameyossnowy.recordmapper.api.exceptions.build.UnsupportedTypeException;
import io.github.flameyossnowy.recordmapper.api.meta.DescriptorRegistry;
import io.github.flameyossnowy.recordmapper.api.meta.FieldDescriptor;
import io.github.flameyossnowy.recordmapper.api.meta.FieldShape;
import io.github.flameyossnowy.recordmapper.api.meta.RecordTypeDescriptor;
import io.github.flameyossnowy.recordmapper.api.utils.Types;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds record instances from loosely typed maps.
 *
 * <h2>Per field, in declaration order</h2>
 * <ol>
 *   <li>Absent key: the declared default, else {@code Optional.empty()} for optional fields,
 *       else {@link MissingFieldException}.</li>
 *   <li>{@code null} value: {@code Optional.empty()} for optional fields, {@code null} for
 *       records, enums and other reference types, {@link TypeCastException} for primitives.</li>
 *   <li>Enums: by instance, name, ordinal or declared code ({@link EnumDecoder}).</li>
 *   <li>Records: nested maps are materialized recursively, instances pass through.</li>
 *   <li>Scalars: the runtime class must be accepted by the boxed declared type, no widening.</li>
 *   <li>Collections and maps of scalars: keys and elements checked, container passed through.
 *       Elements that are themselves collections or maps are rejected.</li>
 * </ol>
 *
 * The first failing field aborts the whole call; errors carry the dotted logical path
 * from the root record.
 */
public final class RecordMaterializer {
    private final DescriptorRegistry registry;
    private final EnumDecoder enumDecoder = new EnumDecoder();

    public RecordMaterializer(@NotNull DescriptorRegistry registry) {
        this.registry = registry;
    }

    public <T> @NotNull T materialize(@NotNull Class<T> type, @NotNull Map<String, ?> data) {
        return type.cast(build(type, data, ""));
    }

    private Object build(Class<?> type, Map<?, ?> data, String prefix) {
        RecordTypeDescriptor descriptor = registry.describe(type);
        List<FieldDescriptor> fields = descriptor.fields();
        Object[] arguments = new Object[fields.size()];

        for (int i = 0; i < arguments.length; i++) {
            FieldDescriptor field = fields.get(i);
            arguments[i] = readField(field, data, join(prefix, field.name()));
        }

        try {
            return descriptor.factory().newInstance(arguments);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new FieldBuildException(prefix, "Constructor of " + type.getName() + " rejected the values: "
                + cause.getMessage(), cause);
        } catch (ReflectiveOperationException | IllegalArgumentException e) {
            throw new FieldBuildException(prefix, "Cannot instantiate " + type.getName(), e);
        }
    }

    private Object readField(FieldDescriptor field, Map<?, ?> data, String path) {
        String key = field.externalName();

        if (!data.containsKey(key)) {
            if (field.hasDefault()) {
                Object value = field.defaultValue().get();
                return field.optional() ? Optional.ofNullable(value) : value;
            }
            if (field.optional()) {
                return Optional.empty();
            }
            throw new MissingFieldException(path, key);
        }

        Object raw = data.get(key);
        if (field.optional()) {
            return raw == null ? Optional.empty() : Optional.of(convert(field, raw, path));
        }

        if (raw == null) {
            if (field.rawType().isPrimitive()) {
                throw new TypeCastException(path, field.typeName(), "null");
            }
            return null;
        }

        return convert(field, raw, path);
    }

    private Object convert(FieldDescriptor field, Object raw, String path) {
        return switch (field.shape()) {
            case ENUM -> enumDecoder.decode(path, field.valueType(), raw, field.enumCodeAccessor());
            case RECORD -> nested(field.valueType(), raw, path);
            case SEQUENCE -> sequence(field, raw, path);
            case MAP -> map(field, raw, path);
            case SCALAR -> scalar(field.valueType(), field.typeName(), raw, path);
        };
    }

    private Object nested(Class<?> recordType, Object raw, String path) {
        if (recordType.isInstance(raw)) {
            return raw;
        }
        if (raw instanceof Map<?, ?> map) {
            return build(recordType, map, path);
        }
        throw new NestedTypeException(path, recordType, raw.getClass());
    }

    private static Object scalar(Class<?> declared, String typeName, Object raw, String path) {
        if (Types.box(declared).isInstance(raw)) {
            return raw;
        }
        throw new TypeCastException(path, typeName, raw.getClass().getName());
    }

    private Object sequence(FieldDescriptor field, Object raw, String path) {
        rejectRecordElements(field, path);

        if (!(raw instanceof Collection<?> collection)) {
            throw new TypeCastException(path, field.typeName(), raw.getClass().getName());
        }

        boolean decoded = field.elementShape() == FieldShape.ENUM;
        List<Object> elements = decoded ? new ArrayList<>(collection.size()) : null;

        int index = 0;
        for (Object element : collection) {
            Object value = element(field, element, path + '[' + index + ']');
            if (elements != null) {
                elements.add(value);
            }
            index++;
        }

        Collection<?> result = elements == null ? collection : elements;
        Class<?> container = field.valueType();
        if (container.isInstance(result)) {
            return result;
        }
        if (container.isAssignableFrom(ArrayList.class)) {
            return new ArrayList<>(result);
        }
        if (container.isAssignableFrom(LinkedHashSet.class)) {
            return new LinkedHashSet<>(result);
        }
        throw new TypeCastException(path, field.typeName(), raw.getClass().getName());
    }

    private Object map(FieldDescriptor field, Object raw, String path) {
        rejectRecordElements(field, path);

        Class<?> keyType = field.keyType();
        if (keyType != String.class && keyType != Object.class && keyType != CharSequence.class) {
            throw new UnsupportedTypeException(path, field.typeName(), "map keys must be strings");
        }

        if (!(raw instanceof Map<?, ?> entries)) {
            throw new TypeCastException(path, field.typeName(), raw.getClass().getName());
        }

        boolean decoded = field.elementShape() == FieldShape.ENUM;
        Map<Object, Object> values = decoded ? new LinkedHashMap<>() : null;

        for (Map.Entry<?, ?> entry : entries.entrySet()) {
            Object key = entry.getKey();
            if (!keyType.isInstance(key)) {
                throw new TypeCastException(path + '.' + key, keyType.getName(),
                    key == null ? "null" : key.getClass().getName());
            }
            Object value = element(field, entry.getValue(), path + '.' + key);
            if (values != null) {
                values.put(entry.getKey(), value);
            }
        }

        Map<?, ?> result = values == null ? entries : values;
        Class<?> container = field.valueType();
        if (container.isInstance(result)) {
            return result;
        }
        if (container.isAssignableFrom(LinkedHashMap.class)) {
            return new LinkedHashMap<>(result);
        }
        throw new TypeCastException(path, field.typeName(), raw.getClass().getName());
    }

    private Object element(FieldDescriptor field, @Nullable Object element, String path) {
        if (element == null) {
            return null;
        }

        Class<?> elementType = field.elementType();
        if (field.elementShape() == FieldShape.ENUM) {
            return enumDecoder.decode(path, elementType, element, field.enumCodeAccessor());
        }
        return scalar(elementType, elementType.getName(), element, path);
    }

    private static void rejectRecordElements(FieldDescriptor field, String path) {
        if (field.hasRecordElements()) {
            throw new UnsupportedTypeException(path, field.typeName(), "collections of records are not supported");
        }
        if (field.elementShape() == FieldShape.SEQUENCE || field.elementShape() == FieldShape.MAP) {
            throw new UnsupportedTypeException(path, field.typeName(), "nested collections are not supported");
        }
    }

    private static String join(String prefix, String name) {
        return prefix.isEmpty() ? name : prefix + '.' + name;
    }
}
