package com.tyron.keystone.core.registry;

import com.tyron.keystone.api.component.DependenciesResolvedListener;
import com.tyron.keystone.api.component.Initializable;
import com.tyron.keystone.api.component.InitializationReport;
import com.tyron.keystone.api.error.CircularDependencyException;
import com.tyron.keystone.api.error.InstanceCreationException;
import com.tyron.keystone.api.error.MissingDependencyException;
import com.tyron.keystone.api.service.Disposable;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds components in a given order and runs their lifecycle hooks.
 * <p>
 * A component is only built after every declared dependency has an instance. A dependency that
 * failed, was skipped or is not registered blocks its dependents: they are not constructed and
 * their hooks never run. In strict mode the first construction failure aborts the run with an
 * {@link InstanceCreationException}; in lenient mode it is logged and independent components
 * continue. A throwing hook always aborts; the instance is then discarded and disposed, never
 * attached to its registration.
 * <p>
 * One instance per run; not reusable.
 */
final class ComponentInitializer {

    private static final Logger LOG = Logger.getLogger(ComponentInitializer.class.getName());

    private final RegistrationStore store;
    private final ComponentFactory factory;
    private final boolean strict;
    private final RegistryListeners listeners;
    private final Consumer<Class<?>> onInitialized;

    private final List<Class<?>> initialized = new ArrayList<>();
    private final Map<Class<?>, String> failed = new LinkedHashMap<>();
    private final Map<Class<?>, String> skipped = new LinkedHashMap<>();
    private final Deque<Class<?>> building = new ArrayDeque<>();

    ComponentInitializer(RegistrationStore store,
                         ComponentFactory factory,
                         boolean strict,
                         RegistryListeners listeners,
                         Consumer<Class<?>> onInitialized) {
        this.store = store;
        this.factory = factory;
        this.strict = strict;
        this.listeners = listeners;
        this.onInitialized = onInitialized;
    }

    InitializationReport initialize(List<Class<?>> order) {
        long started = System.nanoTime();
        for (Class<?> type : order) {
            ensureInitialized(type);
        }
        return new InitializationReport(initialized, failed, skipped, Duration.ofNanos(System.nanoTime() - started));
    }

    /**
     * @return true if the component has an instance afterwards
     */
    boolean ensureInitialized(Class<?> type) {
        Registration registration = store.get(type);
        if (registration == null) {
            return false;
        }
        if (registration.hasInstance()) {
            return true;
        }
        if (failed.containsKey(type) || skipped.containsKey(type)) {
            return false;
        }
        if (building.contains(type)) {
            List<Class<?>> cycle = new ArrayList<>(building);
            cycle.add(type);
            throw new CircularDependencyException(cycle.subList(cycle.indexOf(type), cycle.size()));
        }

        building.addLast(type);
        try {
            for (Class<?> dependency : registration.getDependencies()) {
                if (!store.contains(dependency)) {
                    String reason = type.getSimpleName() + " depends on " + dependency.getSimpleName()
                            + ", which is not registered";
                    if (strict) {
                        throw new MissingDependencyException(List.of(reason));
                    }
                    skip(type, reason);
                    return false;
                }
                if (!ensureInitialized(dependency)) {
                    skip(type, "Dependency failed: " + dependency.getSimpleName());
                    return false;
                }
            }

            Object instance;
            try {
                instance = factory.create(type);
            } catch (Exception e) {
                fail(type, e);
                return false;
            }

            runHooks(type, instance);
            registration.attachInstance(instance);

            initialized.add(type);
            onInitialized.accept(type);
            listeners.initialized(type, instance);
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine("Initialized " + type.getName());
            }
            return true;
        } finally {
            building.removeLast();
        }
    }

    private void runHooks(Class<?> type, Object instance) {
        try {
            if (instance instanceof Initializable initializable) {
                initializable.initialize();
            }
            if (instance instanceof DependenciesResolvedListener listener) {
                listener.onDependenciesResolved();
            }
        } catch (Exception e) {
            listeners.failed(type, e);
            LOG.log(Level.SEVERE, "Lifecycle hook of " + type.getName() + " failed", e);
            discard(type, instance);
            throw new InstanceCreationException(type, "Lifecycle hook of " + type.getName() + " failed.", e);
        }
    }

    private void discard(Class<?> type, Object instance) {
        factory.discard(type, instance);
        if (instance instanceof Disposable disposable) {
            try {
                disposable.dispose();
            } catch (Exception e) {
                LOG.log(Level.SEVERE, "Error disposing " + type.getName() + " after its lifecycle hook failed", e);
            }
        }
    }

    private void fail(Class<?> type, Exception error) {
        listeners.failed(type, error);
        if (strict) {
            LOG.log(Level.SEVERE, "Failed to initialize " + type.getName(), error);
            throw new InstanceCreationException(type, "Failed to initialize " + type.getName() + ": " + error.getMessage(), error);
        }
        LOG.log(Level.WARNING, "Failed to initialize " + type.getName() + ", skipping it and its dependents", error);
        failed.put(type, String.valueOf(error.getMessage()));
    }

    private void skip(Class<?> type, String reason) {
        LOG.warning("Skipping " + type.getName() + ": " + reason);
        skipped.put(type, reason);
    }
}
