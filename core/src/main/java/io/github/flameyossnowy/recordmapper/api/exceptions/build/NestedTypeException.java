package io.github.flameyossnowy.recordmapper.api.exceptions.build;

public class NestedTypeException extends FieldBuildException {
    private final Class<?> expectedType;
    private final Class<?> actualType;

    public NestedTypeException(String fieldPath, Class<?> expectedType, Class<?> actualType) {
        super(fieldPath, "Unexpected type for nested record " + expectedType.getName()
            + ": expected a map or an instance, got " + actualType.getName());
        this.expectedType = expectedType;
        this.actualType = actualType;
    }

    public Class<?> getExpectedType() {
        return expectedType;
    }

    public Class<?> getActualType() {
        return actualType;
    }
}
