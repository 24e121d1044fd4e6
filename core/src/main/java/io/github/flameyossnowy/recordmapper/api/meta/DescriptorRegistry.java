package io.github.flameyossnowy.recordmapper.api.meta;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide memoization of {@link RecordTypeDescriptor}s, keyed by type.
 * <p>
 * Entries are computed at most once per key through {@link ConcurrentHashMap#computeIfAbsent}
 * and never invalidated: type shapes do not change while the process runs.
 */
public final class DescriptorRegistry {
    private static final DescriptorRegistry GLOBAL = new DescriptorRegistry(new RecordComponentMetadataProvider());

    private final Logger logger = LoggerFactory.getLogger(DescriptorRegistry.class);

    private final Map<Class<?>, RecordTypeDescriptor> descriptors = new ConcurrentHashMap<>();
    private final TypeMetadataProvider provider;

    public DescriptorRegistry(@NotNull TypeMetadataProvider provider) {
        this.provider = provider;
    }

    /**
     * The shared registry backed by a {@link RecordComponentMetadataProvider} reading {@code @DocumentField}.
     */
    @Contract(pure = true)
    public static @NotNull DescriptorRegistry global() {
        return GLOBAL;
    }

    public @NotNull RecordTypeDescriptor describe(@NotNull Class<?> type) {
        return descriptors.computeIfAbsent(type, this::build);
    }

    public boolean isDescribable(@NotNull Class<?> type) {
        return descriptors.containsKey(type) || provider.supports(type);
    }

    public boolean isCached(@NotNull Class<?> type) {
        return descriptors.containsKey(type);
    }

    public @NotNull TypeMetadataProvider provider() {
        return provider;
    }

    private RecordTypeDescriptor build(Class<?> type) {
        RecordTypeDescriptor descriptor = provider.describe(type);
        logger.debug("Described {} with {} field(s)", type.getName(), descriptor.size());
        return descriptor;
    }
}
