package io.github.flameyossnowy.recordmapper.api.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.util.function.Supplier;

/**
 * Value used when the component's key is absent from the raw map.
 * <p>
 * Either a literal parsed according to the component type (strings, primitives and their
 * wrappers, enum constant names), or a {@link Supplier} class with a no-arg constructor
 * for anything else.
 */
@Target({ElementType.RECORD_COMPONENT, ElementType.FIELD})
@Retention(RetentionPolicy.RUNTIME)
public @interface DefaultValue {
    String value() default "";

    Class<? extends Supplier<?>> provider() default NoProvider.class;

    final class NoProvider implements Supplier<Object> {
        private NoProvider() {}

        @Override
        public Object get() {
            throw new UnsupportedOperationException();
        }
    }
}
