package io.github.flameyossnowy.recordmapper.api.exceptions.path;

public class EmptyPathException extends PathResolutionException {
    public EmptyPathException(Class<?> rootType) {
        super(rootType, "", "Path expression on " + rootType.getName() + " has no hops");
    }
}
