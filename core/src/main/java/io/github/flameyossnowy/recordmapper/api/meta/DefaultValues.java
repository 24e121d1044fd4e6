package io.github.flameyossnowy.recordmapper.api.meta;

import io.github.flameyossnowy.recordmapper.api.annotations.DefaultValue;
import io.github.flameyossnowy.recordmapper.api.exceptions.DescriptorException;
import io.github.flameyossnowy.recordmapper.api.utils.Types;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Constructor;
import java.util.function.Supplier;

/**
 * Turns {@link DefaultValue} annotations into suppliers of typed values.
 */
final class DefaultValues {
    private DefaultValues() {}

    static @Nullable Supplier<?> of(@Nullable DefaultValue annotation, @NotNull Class<?> owner,
                                    @NotNull String fieldName, @NotNull Class<?> valueType) {
        if (annotation == null) {
            return null;
        }

        if (annotation.provider() != DefaultValue.NoProvider.class) {
            return instantiate(annotation.provider(), owner, fieldName);
        }

        Object parsed = parse(annotation.value(), owner, fieldName, valueType);
        return () -> parsed;
    }

    private static Supplier<?> instantiate(Class<? extends Supplier<?>> providerType, Class<?> owner, String fieldName) {
        try {
            Constructor<? extends Supplier<?>> constructor = providerType.getDeclaredConstructor();
            constructor.setAccessible(true);
            return constructor.newInstance();
        } catch (ReflectiveOperationException e) {
            throw new DescriptorException(owner, "cannot instantiate default provider "
                + providerType.getName() + " for field '" + fieldName + "'", e);
        }
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static Object parse(String literal, Class<?> owner, String fieldName, Class<?> valueType) {
        Class<?> type = Types.box(valueType);
        try {
            if (type == String.class || type == Object.class || type == CharSequence.class) return literal;
            if (type == Integer.class) return Integer.valueOf(literal.trim());
            if (type == Long.class) return Long.valueOf(literal.trim());
            if (type == Double.class) return Double.valueOf(literal.trim());
            if (type == Float.class) return Float.valueOf(literal.trim());
            if (type == Short.class) return Short.valueOf(literal.trim());
            if (type == Byte.class) return Byte.valueOf(literal.trim());
            if (type == Boolean.class) return parseBoolean(literal.trim());
            if (type == Character.class) {
                if (literal.length() != 1) {
                    throw new IllegalArgumentException("expected a single character");
                }
                return literal.charAt(0);
            }
            if (type.isEnum()) return Enum.valueOf((Class<? extends Enum>) type, literal.trim());
        } catch (IllegalArgumentException e) {
            throw new DescriptorException(owner, "default value '" + literal + "' for field '" + fieldName
                + "' is not a valid " + valueType.getName(), e);
        }

        throw new DescriptorException(owner, "field '" + fieldName + "' of type " + valueType.getName()
            + " needs a @DefaultValue provider, literals only cover strings, primitives and enums");
    }

    private static Boolean parseBoolean(String literal) {
        if ("true".equalsIgnoreCase(literal)) return Boolean.TRUE;
        if ("false".equalsIgnoreCase(literal)) return Boolean.FALSE;
        throw new IllegalArgumentException("not a boolean: " + literal);
    }
}
