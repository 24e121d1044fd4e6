package io.github.flameyossnowy.recordmapper.api;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * Behaviour switches for a {@link RecordMapper}.
 *
 * @param optionalScalarValueSegment whether path extraction reports {@code Optional} scalar
 *                                   fields as {@code <name>.value} (legacy) instead of {@code <name>}
 */
public record MapperSettings(boolean optionalScalarValueSegment) {
    private static final MapperSettings DEFAULTS = new MapperSettings(true);

    @Contract(pure = true)
    public static @NotNull MapperSettings defaults() {
        return DEFAULTS;
    }

    @Contract(pure = true)
    public @NotNull MapperSettings withOptionalScalarValueSegment(boolean enabled) {
        return new MapperSettings(enabled);
    }

    @Contract(pure = true)
    public @NotNull MapperSettings withoutOptionalScalarValueSegment() {
        return withOptionalScalarValueSegment(false);
    }
}
