package io.github.flameyossnowy.recordmapper.mongodb.codec;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * Encoding options for {@link RecordCodec}.
 *
 * @param noneHandling how empty {@code Optional} fields are written
 */
public record MongoCodecConfig(@NotNull NoneHandling noneHandling) {
    private static final MongoCodecConfig DEFAULTS = new MongoCodecConfig(NoneHandling.ENCODE);

    @Contract(pure = true)
    public static @NotNull MongoCodecConfig defaults() {
        return DEFAULTS;
    }

    @Contract(value = " -> new", pure = true)
    public @NotNull MongoCodecConfig withIgnoreNone() {
        return new MongoCodecConfig(NoneHandling.IGNORE);
    }

    @Contract(value = " -> new", pure = true)
    public @NotNull MongoCodecConfig withEncodeNone() {
        return new MongoCodecConfig(NoneHandling.ENCODE);
    }
}
