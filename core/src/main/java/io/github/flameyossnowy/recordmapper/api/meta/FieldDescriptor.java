package io.github.flameyossnowy.recordmapper.api.meta;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Method;
import java.lang.reflect.Type;
import java.util.List;
import java.util.function.Supplier;

/**
 * Metadata about a single field of a described record.
 *
 * @param name              the field name as declared
 * @param externalName      the name used in documents and paths
 * @param genericType       the declared type, generics included
 * @param rawType           the declared class
 * @param valueType         the declared class with any {@code Optional} wrapper removed
 * @param optional          whether the declared type is {@code Optional<valueType>}
 * @param shape             structural kind of {@code valueType}
 * @param elementType       element class for sequences, value class for maps, otherwise null
 * @param elementShape      structural kind of {@code elementType}, otherwise null
 * @param keyType           key class for maps, otherwise null
 * @param enumConstants     ordered case names when the field or its elements are enums
 * @param enumCodeAccessor  accessor used as an alternative enum encoding, or null
 * @param defaultValue      produces the value used when the key is absent, or null
 * @param accessor          reads the field from an instance
 */
public record FieldDescriptor(
    @NotNull String name,
    @NotNull String externalName,
    @NotNull Type genericType,
    @NotNull Class<?> rawType,
    @NotNull Class<?> valueType,
    boolean optional,
    @NotNull FieldShape shape,
    @Nullable Class<?> elementType,
    @Nullable FieldShape elementShape,
    @Nullable Class<?> keyType,
    @NotNull List<String> enumConstants,
    @Nullable String enumCodeAccessor,
    @Nullable Supplier<?> defaultValue,
    @Nullable Method accessor
) {
    public FieldDescriptor {
        enumConstants = List.copyOf(enumConstants);
    }

    public boolean isRecordValued() {
        return shape == FieldShape.RECORD;
    }

    public boolean isEnumValued() {
        return shape == FieldShape.ENUM;
    }

    public boolean isCollection() {
        return shape == FieldShape.SEQUENCE || shape == FieldShape.MAP;
    }

    /**
     * Whether this is a sequence or map whose elements are records.
     */
    public boolean hasRecordElements() {
        return isCollection() && elementShape == FieldShape.RECORD;
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }

    /**
     * The record type a path can descend into through this field: the value type for
     * record fields (optional or not), the element type for sequences of records.
     */
    @Nullable
    public Class<?> navigableType() {
        if (shape == FieldShape.RECORD) {
            return valueType;
        }
        if (shape == FieldShape.SEQUENCE && elementShape == FieldShape.RECORD) {
            return elementType;
        }
        return null;
    }

    /**
     * The enum class for enum fields and for collections of enums.
     */
    @Nullable
    public Class<?> enumType() {
        if (shape == FieldShape.ENUM) {
            return valueType;
        }
        if (elementShape == FieldShape.ENUM) {
            return elementType;
        }
        return null;
    }

    /**
     * Human readable declared type, e.g. {@code int} or {@code java.util.List<java.lang.String>}.
     */
    public String typeName() {
        return genericType.getTypeName();
    }
}
