package io.github.flameyossnowy.recordmapper.api.exceptions.build;

public class TypeCastException extends FieldBuildException {
    private final String expectedType;
    private final String actualType;

    public TypeCastException(String fieldPath, String expectedType, String actualType) {
        super(fieldPath, "Error casting field " + fieldPath + ". Expected: " + expectedType + ", Actual: " + actualType);
        this.expectedType = expectedType;
        this.actualType = actualType;
    }

    public String getExpectedType() {
        return expectedType;
    }

    public String getActualType() {
        return actualType;
    }
}
