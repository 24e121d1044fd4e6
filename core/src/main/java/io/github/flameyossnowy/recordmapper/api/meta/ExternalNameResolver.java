package io.github.flameyossnowy.recordmapper.api.meta;

import io.github.flameyossnowy.recordmapper.api.annotations.DocumentField;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.RecordComponent;
import java.util.List;

/**
 * Source of external-name overrides for record components.
 */
@FunctionalInterface
public interface ExternalNameResolver {
    /**
     * @return the override for this component, or {@code null} to keep the declared name
     */
    @Nullable
    String resolve(@NotNull RecordComponent component);

    /**
     * Reads {@link DocumentField}.
     */
    @Contract(pure = true)
    static @NotNull ExternalNameResolver documentField() {
        return component -> {
            DocumentField field = component.getAnnotation(DocumentField.class);
            return field == null ? null : field.value();
        };
    }

    /**
     * Never renames.
     */
    @Contract(pure = true)
    static @NotNull ExternalNameResolver none() {
        return component -> null;
    }

    /**
     * Asks each resolver in turn and returns the first override found.
     */
    static @NotNull ExternalNameResolver firstOf(ExternalNameResolver @NotNull ... resolvers) {
        List<ExternalNameResolver> chain = List.of(resolvers);
        return component -> {
            for (ExternalNameResolver resolver : chain) {
                String name = resolver.resolve(component);
                if (name != null) {
                    return name;
                }
            }
            return null;
        };
    }
}
