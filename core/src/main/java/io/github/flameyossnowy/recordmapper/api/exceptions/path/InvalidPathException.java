package io.github.flameyossnowy.recordmapper.api.exceptions.path;

/**
 * Thrown when a path continues past a field that has no nested record to descend into.
 */
public class InvalidPathException extends PathResolutionException {
    private final String terminalField;

    public InvalidPathException(Class<?> rootType, String path, String terminalField) {
        super(rootType, path, "Cannot resolve '" + path + "' on " + rootType.getName()
            + ": field '" + terminalField + "' is not a record and must be the last hop");
        this.terminalField = terminalField;
    }

    public String getTerminalField() {
        return terminalField;
    }
}
