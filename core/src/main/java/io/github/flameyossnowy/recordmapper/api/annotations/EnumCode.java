package io.github.flameyossnowy.recordmapper.api.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Names a no-arg accessor on the enum whose result is accepted as an alternative encoding.
 * <pre>{@code
 * enum Status {
 *     OK(200), NOT_FOUND(404);
 *     private final int code;
 *     Status(int code) { this.code = code; }
 *     public int code() { return code; }
 * }
 *
 * record Response(@EnumCode("code") Status status) {}
 * }</pre>
 * With the above, {@code {"status": 404}} decodes to {@code NOT_FOUND}. Names and ordinals
 * are tried first.
 */
@Target({ElementType.RECORD_COMPONENT, ElementType.FIELD})
@Retention(RetentionPolicy.RUNTIME)
public @interface EnumCode {
    String value();
}
