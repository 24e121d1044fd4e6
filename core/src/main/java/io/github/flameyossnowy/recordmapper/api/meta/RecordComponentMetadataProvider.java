package io.github.flameyossnowy.recordmapper.api.meta;

import io.github.flameyossnowy.recordmapper.api.annotations.DefaultValue;
import io.github.flameyossnowy.recordmapper.api.annotations.EnumCode;
import io.github.flameyossnowy.recordmapper.api.exceptions.DescriptorException;
import io.github.flameyossnowy.recordmapper.api.utils.Types;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Constructor;
import java.lang.reflect.Method;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Describes Java records by reflecting over their components.
 * <ul>
 *   <li>Field order is component order; the canonical constructor is the instance factory.</li>
 *   <li>External names come from the configured {@link ExternalNameResolver}.</li>
 *   <li>{@code Optional<X>} is unwrapped once; the shape is derived from {@code X}.</li>
 *   <li>Any type this provider supports (i.e. any record) is classified as {@link FieldShape#RECORD}.</li>
 * </ul>
 * Nested types are only classified here, never described, so building one descriptor
 * never needs another.
 */
public final class RecordComponentMetadataProvider implements TypeMetadataProvider {
    private final ExternalNameResolver nameResolver;

    public RecordComponentMetadataProvider() {
        this(ExternalNameResolver.documentField());
    }

    public RecordComponentMetadataProvider(@NotNull ExternalNameResolver nameResolver) {
        this.nameResolver = nameResolver;
    }

    @Override
    public boolean supports(@NotNull Class<?> type) {
        return type.isRecord();
    }

    @Override
    public @NotNull RecordTypeDescriptor describe(@NotNull Class<?> type) {
        if (!supports(type)) {
            throw new DescriptorException(type, "not a record type");
        }

        RecordComponent[] components = type.getRecordComponents();
        List<FieldDescriptor> fields = new ArrayList<>(components.length);
        Class<?>[] parameterTypes = new Class<?>[components.length];

        for (int i = 0; i < components.length; i++) {
            RecordComponent component = components[i];
            parameterTypes[i] = component.getType();
            fields.add(describeComponent(type, component));
        }

        return new RecordTypeDescriptor(type, fields, canonicalConstructor(type, parameterTypes));
    }

    private FieldDescriptor describeComponent(Class<?> owner, RecordComponent component) {
        String name = component.getName();
        Type genericType = component.getGenericType();
        Class<?> rawType = component.getType();

        boolean optional = rawType == Optional.class;
        Type valueGenericType = optional ? Types.typeArgument(genericType, 0) : genericType;
        Class<?> valueType = Types.rawClass(valueGenericType);
        FieldShape shape = classify(valueType);

        Class<?> elementType = null;
        FieldShape elementShape = null;
        Class<?> keyType = null;
        if (shape == FieldShape.SEQUENCE) {
            elementType = Types.rawClass(Types.typeArgument(valueGenericType, 0));
            elementShape = classify(elementType);
        } else if (shape == FieldShape.MAP) {
            keyType = Types.rawClass(Types.typeArgument(valueGenericType, 0));
            elementType = Types.rawClass(Types.typeArgument(valueGenericType, 1));
            elementShape = classify(elementType);
        }

        Class<?> enumType = shape == FieldShape.ENUM ? valueType
            : elementShape == FieldShape.ENUM ? elementType
            : null;

        List<String> enumConstants = enumType == null ? List.of() : constantNames(enumType);
        String enumCodeAccessor = enumCodeAccessor(owner, component, enumType);

        Supplier<?> defaultValue = DefaultValues.of(component.getAnnotation(DefaultValue.class), owner, name, valueType);

        Method accessor = component.getAccessor();
        accessor.setAccessible(true);

        return new FieldDescriptor(
            name,
            externalName(owner, component),
            genericType,
            rawType,
            valueType,
            optional,
            shape,
            elementType,
            elementShape,
            keyType,
            enumConstants,
            enumCodeAccessor,
            defaultValue,
            accessor
        );
    }

    private String externalName(Class<?> owner, RecordComponent component) {
        String override = nameResolver.resolve(component);
        if (override == null) {
            return component.getName();
        }
        if (override.isBlank() || override.indexOf('.') >= 0) {
            throw new DescriptorException(owner, "invalid external name '" + override
                + "' for field '" + component.getName() + "'");
        }
        return override;
    }

    private FieldShape classify(Class<?> type) {
        if (type.isEnum()) return FieldShape.ENUM;
        if (Collection.class.isAssignableFrom(type)) return FieldShape.SEQUENCE;
        if (Map.class.isAssignableFrom(type)) return FieldShape.MAP;
        if (supports(type)) return FieldShape.RECORD;
        return FieldShape.SCALAR;
    }

    private static List<String> constantNames(Class<?> enumType) {
        Object[] constants = enumType.getEnumConstants();
        List<String> names = new ArrayList<>(constants.length);
        for (Object constant : constants) {
            names.add(((Enum<?>) constant).name());
        }
        return names;
    }

    private static @Nullable String enumCodeAccessor(Class<?> owner, RecordComponent component, @Nullable Class<?> enumType) {
        EnumCode code = component.getAnnotation(EnumCode.class);
        if (code == null) {
            return null;
        }
        if (enumType == null) {
            throw new DescriptorException(owner, "@EnumCode on non-enum field '" + component.getName() + "'");
        }
        try {
            Method method = enumType.getMethod(code.value());
            if (method.getParameterCount() != 0 || method.getReturnType() == void.class) {
                throw new DescriptorException(owner, "enum code accessor " + enumType.getName() + "#" + code.value()
                    + " must take no arguments and return a value");
            }
        } catch (NoSuchMethodException e) {
            throw new DescriptorException(owner, "enum " + enumType.getName() + " has no public accessor '"
                + code.value() + "' named by field '" + component.getName() + "'", e);
        }
        return code.value();
    }

    private static InstanceFactory canonicalConstructor(Class<?> type, Class<?>[] parameterTypes) {
        Constructor<?> constructor;
        try {
            constructor = type.getDeclaredConstructor(parameterTypes);
            constructor.setAccessible(true);
        } catch (NoSuchMethodException | RuntimeException e) {
            throw new DescriptorException(type, "canonical constructor is not accessible", e);
        }
        return constructor::newInstance;
    }
}
