package io.github.flameyossnowy.recordmapper.api.exceptions.build;

public class EnumDecodeException extends FieldBuildException {
    private final Class<?> enumType;
    private final Object value;

    public EnumDecodeException(String fieldPath, Class<?> enumType, Object value) {
        super(fieldPath, "Error decoding enum field as " + enumType.getName() + ": no constant matches "
            + describe(value));
        this.enumType = enumType;
        this.value = value;
    }

    private static String describe(Object value) {
        return value instanceof String ? "'" + value + "'" : value + " (" + value.getClass().getName() + ")";
    }

    public Class<?> getEnumType() {
        return enumType;
    }

    public Object getValue() {
        return value;
    }
}
