package io.github.flameyossnowy.recordmapper.mongodb;

import com.mongodb.MongoClientSettings;
import io.github.flameyossnowy.recordmapper.api.MapperSettings;
import io.github.flameyossnowy.recordmapper.api.RecordMapper;
import io.github.flameyossnowy.recordmapper.api.meta.ExternalNameResolver;
import io.github.flameyossnowy.recordmapper.mongodb.codec.MongoCodecConfig;
import io.github.flameyossnowy.recordmapper.mongodb.codec.MongoDocumentBridge;
import io.github.flameyossnowy.recordmapper.mongodb.codec.RecordCodecProvider;
import org.bson.BsonDocument;
import org.bson.Document;
import org.bson.codecs.configuration.CodecRegistries;
import org.bson.codecs.configuration.CodecRegistry;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Record mapping wired for MongoDB.
 * <p>
 * External names come from {@code @BsonProperty} first, then {@code @DocumentField}.
 * The {@link #codecRegistry()} puts record codecs in front of the driver defaults and can
 * be handed to {@code MongoClientSettings.Builder#codecRegistry} or
 * {@code MongoCollection#withCodecRegistry}.
 */
public final class MongoRecordMapping {
    private static final Logger logger = LoggerFactory.getLogger(MongoRecordMapping.class);

    private final RecordMapper mapper;
    private final MongoCodecConfig config;
    private final MongoPaths paths;
    private final RecordCodecProvider codecProvider;
    private final CodecRegistry codecRegistry;

    private MongoRecordMapping(RecordMapper mapper, MongoCodecConfig config) {
        this.mapper = mapper;
        this.config = config;
        this.paths = new MongoPaths(mapper);
        this.codecProvider = RecordCodecProvider.create(mapper, config);
        this.codecRegistry = CodecRegistries.fromRegistries(
            CodecRegistries.fromProviders(codecProvider),
            MongoClientSettings.getDefaultCodecRegistry()
        );
        logger.debug("Created Mongo record mapping with {} and {}", config, mapper.settings());
    }

    @Contract(" -> new")
    public static @NotNull MongoRecordMapping create() {
        return create(MongoCodecConfig.defaults(), MapperSettings.defaults());
    }

    @Contract("_ -> new")
    public static @NotNull MongoRecordMapping create(@NotNull MongoCodecConfig config) {
        return create(config, MapperSettings.defaults());
    }

    @Contract("_, _ -> new")
    public static @NotNull MongoRecordMapping create(@NotNull MongoCodecConfig config, @NotNull MapperSettings settings) {
        RecordMapper mapper = RecordMapper.builder()
            .nameResolver(ExternalNameResolver.firstOf(BsonPropertyNameResolver.INSTANCE, ExternalNameResolver.documentField()))
            .settings(settings)
            .build();
        return new MongoRecordMapping(mapper, config);
    }

    /**
     * Wraps an existing mapper, keeping its own rename rules.
     */
    @Contract("_, _ -> new")
    public static @NotNull MongoRecordMapping wrap(@NotNull RecordMapper mapper, @NotNull MongoCodecConfig config) {
        return new MongoRecordMapping(mapper, config);
    }

    public @NotNull String path(@NotNull Class<?> type, String @NotNull ... hops) {
        return mapper.resolvePath(type, hops);
    }

    public <T> @NotNull T decode(@NotNull Class<T> type, @NotNull Document document) {
        return mapper.materialize(type, MongoDocumentBridge.toRawMap(document));
    }

    public <T> @NotNull T decode(@NotNull Class<T> type, @NotNull BsonDocument document) {
        return mapper.materialize(type, MongoDocumentBridge.toRawMap(document));
    }

    public @NotNull RecordMapper mapper() {
        return mapper;
    }

    public @NotNull MongoCodecConfig config() {
        return config;
    }

    public @NotNull MongoPaths paths() {
        return paths;
    }

    public @NotNull RecordCodecProvider codecProvider() {
        return codecProvider;
    }

    public @NotNull CodecRegistry codecRegistry() {
        return codecRegistry;
    }
}
