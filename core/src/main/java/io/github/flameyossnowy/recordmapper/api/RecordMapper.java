package io.github.flameyossnowy.recordmapper.api;

import io.github.flameyossnowy.recordmapper.api.factory.RecordMaterializer;
import io.github.flameyossnowy.recordmapper.api.meta.DescriptorRegistry;
import io.github.flameyossnowy.recordmapper.api.meta.ExternalNameResolver;
import io.github.flameyossnowy.recordmapper.api.meta.RecordComponentMetadataProvider;
import io.github.flameyossnowy.recordmapper.api.meta.RecordTypeDescriptor;
import io.github.flameyossnowy.recordmapper.api.meta.TypeMetadataProvider;
import io.github.flameyossnowy.recordmapper.api.path.FieldPathMapping;
import io.github.flameyossnowy.recordmapper.api.path.PathExpression;
import io.github.flameyossnowy.recordmapper.api.path.PathExtractor;
import io.github.flameyossnowy.recordmapper.api.path.PathResolver;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point: field-path resolution, path extraction and record materialization over
 * one {@link DescriptorRegistry}.
 *
 * <pre>{@code
 * record Address(@DocumentField("c") String city, @DocumentField("zip") int zipCode) {}
 * record User(String name, Optional<Address> address) {}
 *
 * RecordMapper mapper = RecordMapper.defaults();
 * mapper.resolvePath(User.class, "address", "zipCode");   // "address.zip"
 * mapper.materialize(Address.class, Map.of("c", "NY", "zip", 10001));
 * }</pre>
 *
 * Instances are immutable and safe to share between threads.
 */
public final class RecordMapper {
    private static final RecordMapper DEFAULT = new RecordMapper(DescriptorRegistry.global(), MapperSettings.defaults());

    private final DescriptorRegistry registry;
    private final MapperSettings settings;
    private final PathResolver resolver;
    private final PathExtractor extractor;
    private final RecordMaterializer materializer;

    public RecordMapper(@NotNull DescriptorRegistry registry, @NotNull MapperSettings settings) {
        this.registry = registry;
        this.settings = settings;
        this.resolver = new PathResolver(registry);
        this.extractor = new PathExtractor(registry, settings);
        this.materializer = new RecordMaterializer(registry);
    }

    /**
     * A mapper over the {@linkplain DescriptorRegistry#global() global registry} with default settings.
     */
    @Contract(pure = true)
    public static @NotNull RecordMapper defaults() {
        return DEFAULT;
    }

    @Contract(value = " -> new", pure = true)
    public static @NotNull Builder builder() {
        return new Builder();
    }

    public @NotNull String resolvePath(@NotNull Class<?> type, @NotNull PathExpression expression) {
        return resolver.resolve(type, expression);
    }

    public @NotNull String resolvePath(@NotNull Class<?> type, String @NotNull ... hops) {
        return resolver.resolve(type, PathExpression.of(hops));
    }

    /**
     * @see PathExtractor
     */
    public @NotNull List<FieldPathMapping> extractPaths(@NotNull Class<?> type) {
        return extractor.extract(type);
    }

    /**
     * The extracted paths as an insertion-ordered {@code source -> target} map.
     */
    public @NotNull Map<String, String> fieldMap(@NotNull Class<?> type) {
        List<FieldPathMapping> mappings = extractor.extract(type);
        Map<String, String> map = new LinkedHashMap<>(mappings.size() * 2);
        for (FieldPathMapping mapping : mappings) {
            map.put(mapping.source(), mapping.target());
        }
        return Collections.unmodifiableMap(map);
    }

    public <T> @NotNull T materialize(@NotNull Class<T> type, @NotNull Map<String, ?> data) {
        return materializer.materialize(type, data);
    }

    public @NotNull RecordTypeDescriptor descriptor(@NotNull Class<?> type) {
        return registry.describe(type);
    }

    public @NotNull DescriptorRegistry registry() {
        return registry;
    }

    public @NotNull MapperSettings settings() {
        return settings;
    }

    public static final class Builder {
        private TypeMetadataProvider provider;
        private ExternalNameResolver nameResolver;
        private DescriptorRegistry registry;
        private MapperSettings settings = MapperSettings.defaults();

        private Builder() {}

        /**
         * Uses a custom metadata provider. Mutually exclusive with {@link #nameResolver}.
         */
        public Builder provider(@NotNull TypeMetadataProvider provider) {
            this.provider = provider;
            return this;
        }

        /**
         * Uses a {@link RecordComponentMetadataProvider} with the given rename source.
         */
        public Builder nameResolver(@NotNull ExternalNameResolver nameResolver) {
            this.nameResolver = nameResolver;
            return this;
        }

        /**
         * Shares an existing registry (and its cache). Overrides provider and name resolver.
         */
        public Builder registry(@NotNull DescriptorRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder settings(@NotNull MapperSettings settings) {
            this.settings = settings;
            return this;
        }

        public RecordMapper build() {
            if (registry != null) {
                return new RecordMapper(registry, settings);
            }
            if (provider != null && nameResolver != null) {
                throw new IllegalStateException("Set either a metadata provider or a name resolver, not both");
            }

            if (provider != null) {
                return new RecordMapper(new DescriptorRegistry(provider), settings);
            }
            if (nameResolver != null) {
                return new RecordMapper(new DescriptorRegistry(new RecordComponentMetadataProvider(nameResolver)), settings);
            }
            return new RecordMapper(DescriptorRegistry.global(), settings);
        }
    }
}
