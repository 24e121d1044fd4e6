package io.github.flameyossnowy.recordmapper.api.exceptions.build;

public class MissingFieldException extends FieldBuildException {
    private final String key;

    public MissingFieldException(String fieldPath, String key) {
        super(fieldPath, "Missing field: " + key);
        this.key = key;
    }

    /**
     * The external key that was looked up in the raw map.
     */
    public String getKey() {
        return key;
    }
}
