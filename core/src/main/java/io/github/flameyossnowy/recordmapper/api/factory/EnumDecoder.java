package io.github.flameyossnowy.recordmapper.api.factory;

import io.github.flameyossnowy.recordmapper.api.exceptions.RecordMappingException;
import io.github.flameyossnowy.recordmapper.api.exceptions.build.EnumDecodeException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Decodes raw values into enum constants.
 * <p>
 * Accepted, in order: an instance of the enum itself, the exact constant name, a zero-based
 * {@link Integer} ordinal, and finally, when a code accessor is declared, any value equal to
 * the accessor's result for one of the constants.
 */
final class EnumDecoder {
    private final Map<CodeKey, Method> accessors = new ConcurrentHashMap<>();

    private record CodeKey(Class<?> enumType, String accessor) {}

    Object decode(@NotNull String fieldPath, @NotNull Class<?> enumType, @NotNull Object raw, @Nullable String codeAccessor) {
        if (enumType.isInstance(raw)) {
            return raw;
        }

        Object[] constants = enumType.getEnumConstants();

        if (raw instanceof String name) {
            for (Object constant : constants) {
                if (((Enum<?>) constant).name().equals(name)) {
                    return constant;
                }
            }
        } else if (raw instanceof Integer ordinal) {
            if (ordinal >= 0 && ordinal < constants.length) {
                return constants[ordinal];
            }
        }

        if (codeAccessor != null) {
            Method accessor = accessors.computeIfAbsent(new CodeKey(enumType, codeAccessor), EnumDecoder::lookup);
            for (Object constant : constants) {
                if (Objects.equals(invoke(accessor, constant, fieldPath), raw)) {
                    return constant;
                }
            }
        }

        throw new EnumDecodeException(fieldPath, enumType, raw);
    }

    private static Method lookup(CodeKey key) {
        try {
            Method method = key.enumType().getMethod(key.accessor());
            method.setAccessible(true);
            return method;
        } catch (NoSuchMethodException e) {
            throw new RecordMappingException("No accessor '" + key.accessor() + "' on " + key.enumType().getName(), e);
        }
    }

    private static Object invoke(Method accessor, Object constant, String fieldPath) {
        try {
            return accessor.invoke(constant);
        } catch (IllegalAccessException | InvocationTargetException e) {
            throw new RecordMappingException("Failed to read enum code '" + accessor.getName()
                + "' while decoding field '" + fieldPath + "'", e);
        }
    }
}
