package io.github.flameyossnowy.recordmapper.api.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Overrides the external (document) name of a record component.
 * <p>
 * {@code record Address(@DocumentField("c") String city, @DocumentField("zip") int zipCode) {}}
 * stores {@code city} under {@code "c"} and resolves {@code zipCode} to {@code "zip"}.
 */
@Target({ElementType.RECORD_COMPONENT, ElementType.FIELD})
@Retention(RetentionPolicy.RUNTIME)
public @interface DocumentField {
    String value();
}
