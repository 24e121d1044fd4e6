package io.github.flameyossnowy.recordmapper.api.exceptions;

/**
 * Thrown when a type cannot be turned into a record descriptor
 * (not a record, duplicate external names, unusable default value...).
 */
public class DescriptorException extends RecordMappingException {
    private final Class<?> type;

    public DescriptorException(Class<?> type, String message) {
        super(type.getName() + ": " + message);
        this.type = type;
    }

    public DescriptorException(Class<?> type, String message, Throwable cause) {
        super(type.getName() + ": " + message, cause);
        this.type = type;
    }

    public Class<?> getType() {
        return type;
    }
}
