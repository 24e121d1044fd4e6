package io.github.flameyossnowy.recordmapper.api.meta;

import io.github.flameyossnowy.recordmapper.api.exceptions.DescriptorException;
import org.jetbrains.annotations.NotNull;

/**
 * Supplies the static shape of a type: its ordered fields, their declared types,
 * renames, defaults and enum cases.
 * <p>
 * Implementations must be pure functions of the type; results are memoized by
 * {@link DescriptorRegistry} for the lifetime of the process.
 */
public interface TypeMetadataProvider {
    /**
     * Whether {@link #describe(Class)} can handle the given type. Types that are supported
     * are treated as nested records when they appear as field types.
     */
    boolean supports(@NotNull Class<?> type);

    /**
     * Builds the descriptor for a supported type.
     *
     * @throws DescriptorException if the type is unsupported or malformed
     */
    @NotNull
    RecordTypeDescriptor describe(@NotNull Class<?> type);
}
