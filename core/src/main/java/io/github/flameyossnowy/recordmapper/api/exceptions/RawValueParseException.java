package io.github.flameyossnowy.recordmapper.api.exceptions;

public class RawValueParseException extends RecordMappingException {
    private final int lineNumber;
    private final int columnNumber;

    public RawValueParseException(String message, int lineNumber, int columnNumber, Throwable cause) {
        super(message, cause);
        this.lineNumber = lineNumber;
        this.columnNumber = columnNumber;
    }

    /**
     * @return 1-based line of the offending input, or -1 when unknown
     */
    public int getLineNumber() {
        return lineNumber;
    }

    /**
     * @return 1-based column of the offending input, or -1 when unknown
     */
    public int getColumnNumber() {
        return columnNumber;
    }
}
