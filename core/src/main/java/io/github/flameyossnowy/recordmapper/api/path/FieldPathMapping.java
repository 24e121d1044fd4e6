package io.github.flameyossnowy.recordmapper.api.path;

/**
 * One extracted field path, as a (source, target) pair.
 * <p>
 * Both sides are currently the same external path; the pair lets the extraction
 * result double as a rename table.
 */
public record FieldPathMapping(String source, String target) {
    public static FieldPathMapping identity(String path) {
        return new FieldPathMapping(path, path);
    }
}
