package io.github.flameyossnowy.recordmapper.mongodb.codec;

import io.github.flameyossnowy.recordmapper.api.RecordMapper;
import org.bson.codecs.Codec;
import org.bson.codecs.configuration.CodecProvider;
import org.bson.codecs.configuration.CodecRegistry;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A CodecProvider that provides {@link RecordCodec}s for every type the mapper can describe.
 */
public record RecordCodecProvider(RecordMapper mapper, MongoCodecConfig config) implements CodecProvider {
    private static final Logger logger = LoggerFactory.getLogger(RecordCodecProvider.class);

    @Override
    public <T> @Nullable Codec<T> get(Class<T> clazz, CodecRegistry registry) {
        if (mapper.registry().isDescribable(clazz)) {
            logger.debug("Providing record codec for {}", clazz.getName());
            return new RecordCodec<>(clazz, mapper, config, registry);
        }
        return null;
    }

    /**
     * Create a new instance with the given mapper and encoding options.
     *
     * @param mapper the mapper that describes and materializes records
     * @param config the encoding options
     * @return a new instance
     */
    @Contract("_, _ -> new")
    public static @NotNull RecordCodecProvider create(RecordMapper mapper, MongoCodecConfig config) {
        return new RecordCodecProvider(mapper, config);
    }
}
