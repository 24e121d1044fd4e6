package io.github.flameyossnowy.recordmapper.api.exceptions.build;

/**
 * The declared field type is a combination the materializer does not build,
 * e.g. a collection of records or a map keyed by something other than strings.
 */
public class UnsupportedTypeException extends FieldBuildException {
    private final String declaredType;

    public UnsupportedTypeException(String fieldPath, String declaredType, String reason) {
        super(fieldPath, "Unsupported type " + declaredType + ": " + reason);
        this.declaredType = declaredType;
    }

    public String getDeclaredType() {
        return declaredType;
    }
}
