package io.github.flameyossnowy.recordmapper.api.exceptions;

/**
 * Root of every error raised while describing, resolving or materializing records.
 */
public class RecordMappingException extends RuntimeException {
    public RecordMappingException(String message) {
        super(message);
    }

    public RecordMappingException(String message, Throwable cause) {
        super(message, cause);
    }
}
