package io.github.flameyossnowy.recordmapper.mongodb;

import io.github.flameyossnowy.recordmapper.api.meta.ExternalNameResolver;
import org.bson.codecs.pojo.annotations.BsonProperty;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.RecordComponent;

/**
 * Reads renames from the driver's {@link BsonProperty}.
 * <p>
 * {@code BsonProperty} cannot target record components, so the annotation is looked up on
 * what the compiler propagates it to: the private field, then the accessor.
 */
public final class BsonPropertyNameResolver implements ExternalNameResolver {
    public static final BsonPropertyNameResolver INSTANCE = new BsonPropertyNameResolver();

    private BsonPropertyNameResolver() {}

    @Override
    public @Nullable String resolve(@NotNull RecordComponent component) {
        BsonProperty property = onField(component);
        if (property == null) {
            property = component.getAccessor().getAnnotation(BsonProperty.class);
        }
        if (property == null || property.value().isEmpty()) {
            return null;
        }
        return property.value();
    }

    private static @Nullable BsonProperty onField(RecordComponent component) {
        try {
            return component.getDeclaringRecord().getDeclaredField(component.getName()).getAnnotation(BsonProperty.class);
        } catch (NoSuchFieldException e) {
            return null;
        }
    }
}
