package io.github.flameyossnowy.recordmapper.api.path;

import io.github.flameyossnowy.recordmapper.api.MapperSettings;
import io.github.flameyossnowy.recordmapper.api.meta.DescriptorRegistry;
import io.github.flameyossnowy.recordmapper.api.meta.FieldDescriptor;
import io.github.flameyossnowy.recordmapper.api.meta.RecordTypeDescriptor;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Enumerates every leaf-reachable field path of a record type, depth-first in declaration order.
 *
 * <table>
 *   <caption>Extraction policy</caption>
 *   <tr><th>Field</th><th>Result</th></tr>
 *   <tr><td>scalar, enum</td><td>one pair</td></tr>
 *   <tr><td>record</td><td>children, prefixed with the field's external name</td></tr>
 *   <tr><td>{@code Optional} scalar</td><td>{@code <name>.value}, unless disabled in {@link MapperSettings}</td></tr>
 *   <tr><td>{@code Optional} record</td><td>children, no segment for the wrapper</td></tr>
 *   <tr><td>collection or map of scalars</td><td>one pair for the field</td></tr>
 *   <tr><td>collection or map of records</td><td>skipped</td></tr>
 * </table>
 *
 * Results are immutable and cached per type.
 */
public final class PathExtractor {
    private static final String OPTIONAL_VALUE_SEGMENT = "value";

    private final Logger logger = LoggerFactory.getLogger(PathExtractor.class);

    private final DescriptorRegistry registry;
    private final MapperSettings settings;
    private final Map<Class<?>, List<FieldPathMapping>> cache = new ConcurrentHashMap<>();

    public PathExtractor(@NotNull DescriptorRegistry registry, @NotNull MapperSettings settings) {
        this.registry = registry;
        this.settings = settings;
    }

    public @NotNull List<FieldPathMapping> extract(@NotNull Class<?> type) {
        return cache.computeIfAbsent(type, this::extractUncached);
    }

    private List<FieldPathMapping> extractUncached(Class<?> type) {
        List<FieldPathMapping> out = new ArrayList<>();
        Set<Class<?>> chain = new HashSet<>();
        chain.add(type);
        collect(registry.describe(type), "", chain, out);
        return List.copyOf(out);
    }

    private void collect(RecordTypeDescriptor descriptor, String prefix, Set<Class<?>> chain, List<FieldPathMapping> out) {
        for (FieldDescriptor field : descriptor.fields()) {
            String path = prefix.isEmpty() ? field.externalName() : prefix + '.' + field.externalName();

            if (field.hasRecordElements()) {
                logger.debug("Skipping {}#{}: collections of records have no extractable paths",
                    descriptor.type().getName(), field.name());
                continue;
            }

            if (field.isRecordValued()) {
                Class<?> nested = field.valueType();
                if (!chain.add(nested)) {
                    logger.debug("Not expanding {}#{}: {} is already on the extraction chain",
                        descriptor.type().getName(), field.name(), nested.getName());
                    out.add(FieldPathMapping.identity(path));
                    continue;
                }
                collect(registry.describe(nested), path, chain, out);
                chain.remove(nested);
                continue;
            }

            if (field.optional() && settings.optionalScalarValueSegment()) {
                out.add(FieldPathMapping.identity(path + '.' + OPTIONAL_VALUE_SEGMENT));
                continue;
            }

            out.add(FieldPathMapping.identity(path));
        }
    }
}
