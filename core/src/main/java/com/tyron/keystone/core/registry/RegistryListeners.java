package com.tyron.keystone.core.registry;

import com.tyron.keystone.api.component.RegistryListener;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Listener list of a registry. A listener that throws is logged and the remaining listeners
 * are still notified.
 */
final class RegistryListeners {

    private static final Logger LOG = Logger.getLogger(RegistryListeners.class.getName());

    private final List<RegistryListener> listeners = new CopyOnWriteArrayList<>();

    void add(RegistryListener listener) {
        listeners.add(listener);
    }

    void remove(RegistryListener listener) {
        listeners.remove(listener);
    }

    void registered(Class<?> type) {
        fire(l -> l.componentRegistered(type));
    }

    void initialized(Class<?> type, Object instance) {
        fire(l -> l.componentInitialized(type, instance));
    }

    void failed(Class<?> type, Throwable error) {
        fire(l -> l.componentFailed(type, error));
    }

    void disposed(Class<?> type, Object instance) {
        fire(l -> l.componentDisposed(type, instance));
    }

    private void fire(Consumer<RegistryListener> event) {
        for (RegistryListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Registry listener " + listener.getClass().getName() + " failed", e);
            }
        }
    }
}
