package com.tyron.keystone.api.container;

/**
 * Builds an instance from already-resolved dependency values, in the order the dependencies
 * were declared.
 */
@FunctionalInterface
public interface Instantiator<T> {

    T newInstance(Object[] arguments) throws Exception;
}
