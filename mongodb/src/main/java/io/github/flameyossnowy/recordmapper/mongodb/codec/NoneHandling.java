package io.github.flameyossnowy.recordmapper.mongodb.codec;

/**
 * What {@link RecordCodec} writes for an empty {@code Optional}.
 */
public enum NoneHandling {
    /**
     * Write the field with a BSON {@code null}.
     */
    ENCODE,

    /**
     * Leave the field out of the document.
     */
    IGNORE
}
