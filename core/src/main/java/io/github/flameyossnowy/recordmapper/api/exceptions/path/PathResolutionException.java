package io.github.flameyossnowy.recordmapper.api.exceptions.path;

import io.github.flameyossnowy.recordmapper.api.exceptions.RecordMappingException;

/**
 * Base type for failures while turning a path expression into a dotted document path.
 */
public class PathResolutionException extends RecordMappingException {
    private final Class<?> rootType;
    private final String path;

    public PathResolutionException(Class<?> rootType, String path, String message) {
        super(message);
        this.rootType = rootType;
        this.path = path;
    }

    public Class<?> getRootType() {
        return rootType;
    }

    /**
     * The logical path that was being resolved, dot separated.
     */
    public String getPath() {
        return path;
    }
}
