package io.github.flameyossnowy.recordmapper.api.meta;

/**
 * Structural kind of a field once any {@code Optional} wrapper has been removed.
 */
public enum FieldShape {
    SCALAR,
    RECORD,
    ENUM,
    /** Any {@link java.util.Collection}: lists, sets, queues. */
    SEQUENCE,
    MAP
}
