package com.tyron.keystone.core.registry;

/**
 * Construction strategy used by the registry to build a component once its dependencies exist.
 */
@FunctionalInterface
public interface ComponentFactory {

    <T> T create(Class<T> type) throws Exception;

    /**
     * Forgets an instance returned by {@link #create} whose lifecycle hooks failed, so a later
     * {@code create} builds a fresh one.
     */
    default void discard(Class<?> type, Object instance) {
    }
}
