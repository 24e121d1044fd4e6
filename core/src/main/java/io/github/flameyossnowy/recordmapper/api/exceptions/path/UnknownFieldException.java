package io.github.flameyossnowy.recordmapper.api.exceptions.path;

public class UnknownFieldException extends PathResolutionException {
    private final Class<?> ownerType;
    private final String fieldName;

    public UnknownFieldException(Class<?> rootType, String path, Class<?> ownerType, String fieldName) {
        super(rootType, path, "Unknown field '" + fieldName + "' on " + ownerType.getName()
            + " while resolving '" + path + "' from " + rootType.getName());
        this.ownerType = ownerType;
        this.fieldName = fieldName;
    }

    public Class<?> getOwnerType() {
        return ownerType;
    }

    public String getFieldName() {
        return fieldName;
    }
}
