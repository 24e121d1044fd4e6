package io.github.flameyossnowy.recordmapper.api.path;

import io.github.flameyossnowy.recordmapper.api.exceptions.path.EmptyPathException;
import io.github.flameyossnowy.recordmapper.api.exceptions.path.InvalidPathException;
import io.github.flameyossnowy.recordmapper.api.exceptions.path.UnknownFieldException;
import io.github.flameyossnowy.recordmapper.api.meta.DescriptorRegistry;
import io.github.flameyossnowy.recordmapper.api.meta.FieldDescriptor;
import io.github.flameyossnowy.recordmapper.api.meta.RecordTypeDescriptor;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Resolves logical field chains to dotted document paths.
 * <p>
 * Each hop emits the external name of the field it selects. Hops through an
 * {@code Optional} record contribute nothing for the wrapper, so
 * {@code address.zipCode} on {@code Optional<Address> address} resolves to {@code address.zip}
 * exactly like a plain {@code Address} would. A collection of records can also be walked
 * into, producing MongoDB's array-of-documents notation ({@code skills.name}).
 */
public final class PathResolver {
    private final DescriptorRegistry registry;

    public PathResolver(@NotNull DescriptorRegistry registry) {
        this.registry = registry;
    }

    public @NotNull String resolve(@NotNull Class<?> rootType, @NotNull PathExpression expression) {
        List<String> hops = expression.hops();
        if (hops.isEmpty()) {
            throw new EmptyPathException(rootType);
        }

        StringBuilder path = new StringBuilder();
        Class<?> currentType = rootType;
        String previousHop = null;

        for (String hop : hops) {
            if (currentType == null) {
                throw new InvalidPathException(rootType, expression.toString(), previousHop);
            }

            RecordTypeDescriptor descriptor = registry.describe(currentType);
            FieldDescriptor field = descriptor.field(hop);
            if (field == null) {
                throw new UnknownFieldException(rootType, expression.toString(), currentType, hop);
            }

            if (!path.isEmpty()) {
                path.append('.');
            }
            path.append(field.externalName());

            currentType = field.navigableType();
            previousHop = hop;
        }

        return path.toString();
    }
}
