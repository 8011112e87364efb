package com.tyron.keystone.api.component;

/**
 * Receives component lifecycle callbacks from a {@link ComponentRegistry}.
 * <p>
 * Listener failures are logged and never affect the registry.
 */
public interface RegistryListener {

    default void componentRegistered(Class<?> type) {
    }

    default void componentInitialized(Class<?> type, Object instance) {
    }

    default void componentFailed(Class<?> type, Throwable error) {
    }

    default void componentDisposed(Class<?> type, Object instance) {
    }
}
