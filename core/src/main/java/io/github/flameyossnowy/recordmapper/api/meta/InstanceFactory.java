package io.github.flameyossnowy.recordmapper.api.meta;

/**
 * Creates an instance of a described type from its field values, in descriptor order.
 */
@FunctionalInterface
public interface InstanceFactory {
    Object newInstance(Object[] arguments) throws ReflectiveOperationException;
}
