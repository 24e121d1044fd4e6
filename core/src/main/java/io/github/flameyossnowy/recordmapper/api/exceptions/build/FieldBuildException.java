package io.github.flameyossnowy.recordmapper.api.exceptions.build;

import io.github.flameyossnowy.recordmapper.api.exceptions.RecordMappingException;

/**
 * Raised when a record instance cannot be built from raw values.
 * <p>
 * {@link #getFieldPath()} is the dotted logical path from the root record to the
 * offending field, so nested failures point at the exact component.
 */
public class FieldBuildException extends RecordMappingException {
    private final String fieldPath;
    private final String reason;

    public FieldBuildException(String fieldPath, String reason) {
        super(format(fieldPath, reason));
        this.fieldPath = fieldPath;
        this.reason = reason;
    }

    public FieldBuildException(String fieldPath, String reason, Throwable cause) {
        super(format(fieldPath, reason), cause);
        this.fieldPath = fieldPath;
        this.reason = reason;
    }

    private static String format(String fieldPath, String reason) {
        return fieldPath.isEmpty() ? reason : "Field '" + fieldPath + "': " + reason;
    }

    public String getFieldPath() {
        return fieldPath;
    }

    public String getReason() {
        return reason;
    }
}
