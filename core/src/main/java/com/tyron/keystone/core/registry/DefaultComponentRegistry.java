package com.tyron.keystone.core.registry;

import com.tyron.keystone.api.component.ComponentRegistry;
import com.tyron.keystone.api.component.DependencyAnalysis;
import com.tyron.keystone.api.component.InitializationReport;
import com.tyron.keystone.api.component.RegistryListener;
import com.tyron.keystone.api.component.ValidationResult;
import com.tyron.keystone.api.container.ServiceContainer;
import com.tyron.keystone.api.error.CircularDependencyException;
import com.tyron.keystone.api.error.MissingDependencyException;
import com.tyron.keystone.api.service.Disposable;
import com.tyron.keystone.core.config.KeystoneConfig;
import org.jetbrains.annotations.Nullable;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Default {@link ComponentRegistry}.
 * <p>
 * Components are built through a {@link ComponentFactory}, by default backed by the given
 * {@link ServiceContainer}: each component type is registered there as a singleton, so
 * components can take each other, and any other service, as constructor parameters.
 * <p>
 * Each public operation holds one lock for its whole duration.
 */
public class DefaultComponentRegistry implements ComponentRegistry {

    private static final Logger LOG = Logger.getLogger(DefaultComponentRegistry.class.getName());

    private final ServiceContainer container;
    private final KeystoneConfig config;
    private final ComponentFactory factory;
    private final ReentrantLock lock = new ReentrantLock();

    private final RegistrationStore store;
    private final DependencyResolver resolver = new DependencyResolver();
    private final InitializationScheduler scheduler = new InitializationScheduler();
    private final DependencyAnalyzer analyzer = new DependencyAnalyzer();
    private final RegistryListeners listeners = new RegistryListeners();

    // Types this registry added to the container, removed again on dispose.
    private final Set<Class<?>> containerTypes = new HashSet<>();
    private final List<Class<?>> creationOrder = new ArrayList<>();

    private @Nullable InitializationReport report;

    public DefaultComponentRegistry(ServiceContainer container, KeystoneConfig config, Clock clock) {
        this(container, config, clock, new ContainerComponentFactory(container));
    }

    public DefaultComponentRegistry(ServiceContainer container, KeystoneConfig config, Clock clock, ComponentFactory factory) {
        this.container = Objects.requireNonNull(container, "container");
        this.config = Objects.requireNonNull(config, "config");
        this.factory = Objects.requireNonNull(factory, "factory");
        this.store = new RegistrationStore(clock);
    }

    // --- Registration ---

    @Override
    public <T> void register(Class<T> type, int priority, Class<?>... dependencies) {
        Objects.requireNonNull(type, "type");
        lock.lock();
        try {
            if (rejectLateRegistration(type)) {
                return;
            }
            Registration previous = store.add(type, priority, Arrays.asList(dependencies), null);
            if (previous != null) {
                LOG.warning("Replacing registration of " + type.getName());
                forgetInstance(type);
            }
            if (!container.isRegistered(type)) {
                container.registerSingleton(type);
                containerTypes.add(type);
            }
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine("Registered " + store.get(type));
            }
        } finally {
            lock.unlock();
        }
        listeners.registered(type);
    }

    @Override
    public <T> void registerInstance(Class<T> type, T instance, int priority) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(instance, "instance");
        lock.lock();
        try {
            if (rejectLateRegistration(type)) {
                return;
            }
            if (container.isRegistered(type) && !containerTypes.contains(type)) {
                throw new IllegalStateException("Cannot register an instance of " + type.getName()
                        + " because the container already has its own registration");
            }
            Registration previous = store.add(type, priority, List.of(), instance);
            if (previous != null) {
                LOG.warning("Replacing registration of " + type.getName());
                forgetInstance(type);
            }
            container.registerSingleton(type, instance);
            containerTypes.add(type);
            creationOrder.add(type);
        } finally {
            lock.unlock();
        }
        listeners.registered(type);
    }

    private boolean rejectLateRegistration(Class<?> type) {
        if (report != null) {
            LOG.warning("Cannot register " + type.getName() + " after initialization, ignoring it");
            return true;
        }
        return false;
    }

    private void forgetInstance(Class<?> type) {
        creationOrder.remove(type);
        if (containerTypes.remove(type)) {
            container.unregister(type);
        }
    }

    @Override
    public boolean unregister(Class<?> type) {
        lock.lock();
        try {
            if (report != null) {
                LOG.warning("Cannot unregister " + type.getName() + " after initialization");
                return false;
            }
            if (store.remove(type) == null) {
                return false;
            }
            forgetInstance(type);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isRegistered(Class<?> type) {
        lock.lock();
        try {
            return store.contains(type);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Class<?>> getRegisteredTypes() {
        lock.lock();
        try {
            return new ArrayList<>(store.edges().keySet());
        } finally {
            lock.unlock();
        }
    }

    // --- Lookup ---

    @Override
    public <T> @Nullable T getManager(Class<T> type) {
        if (type == null) {
            LOG.warning("Cannot get a manager for a null type");
            return null;
        }
        lock.lock();
        try {
            Registration registration = store.get(type);
            if (registration == null) {
                LOG.warning("Manager " + type.getName() + " is not registered");
                return null;
            }
            if (!registration.hasInstance()) {
                newInitializer(true).ensureInitialized(type);
            }
            return type.cast(registration.getInstance());
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Failed to get manager " + type.getName(), e);
            return null;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public <T> @Nullable T getManagerByInterface(Class<T> interfaceType) {
        if (interfaceType == null) {
            LOG.warning("Cannot get a manager for a null interface");
            return null;
        }
        List<Class<?>> candidates = new ArrayList<>();
        lock.lock();
        try {
            for (Registration registration : store.all()) {
                if (interfaceType.isAssignableFrom(registration.getType())
                        || interfaceType.isInstance(registration.getInstance())) {
                    candidates.add(registration.getType());
                }
            }
        } finally {
            lock.unlock();
        }

        for (Class<?> candidate : candidates) {
            Object manager = getManager(candidate);
            if (interfaceType.isInstance(manager)) {
                return interfaceType.cast(manager);
            }
        }
        return null;
    }

    @Override
    public <T> List<T> getManagersByInterface(Class<T> interfaceType) {
        lock.lock();
        try {
            List<T> result = new ArrayList<>();
            for (Registration registration : store.all()) {
                Object instance = registration.getInstance();
                if (interfaceType.isInstance(instance)) {
                    result.add(interfaceType.cast(instance));
                }
            }
            return Collections.unmodifiableList(result);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Set<Class<?>> getInstantiatedTypes() {
        lock.lock();
        try {
            Set<Class<?>> types = new LinkedHashSet<>();
            for (Registration registration : store.all()) {
                if (registration.hasInstance()) {
                    types.add(registration.getType());
                }
            }
            return Collections.unmodifiableSet(types);
        } finally {
            lock.unlock();
        }
    }

    // --- Graph ---

    @Override
    public ValidationResult validateDependencies() {
        lock.lock();
        try {
            return resolver.validate(store.all(), store.edges());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public DependencyAnalysis analyzeDependencies() {
        lock.lock();
        try {
            return analyzer.analyze(store.all(), store.edges());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Class<?>> getInitializationOrder() {
        lock.lock();
        try {
            return scheduler.computeOrder(store.all(), store.edges());
        } finally {
            lock.unlock();
        }
    }

    // --- Lifecycle ---

    @Override
    public InitializationReport initializeAll() {
        lock.lock();
        try {
            if (report != null) {
                LOG.warning("Components are already initialized");
                return report;
            }

            if (config.isValidateBeforeInitialization()) {
                checkGraph(resolver.validate(store.all(), store.edges()));
            }

            List<Class<?>> order = scheduler.computeOrder(store.all(), store.edges());
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine("Initialization order: " + CircularDependencyException.describe(order));
            }

            InitializationReport result = newInitializer(config.isStrictInitialization()).initialize(order);
            report = result;
            LOG.info("Initialized " + result.initialized().size() + " of " + order.size() + " components in "
                    + result.elapsed().toMillis() + "ms"
                    + (result.isComplete() ? "" : " (failed: " + result.failed().size()
                    + ", skipped: " + result.skipped().size() + ")"));
            return result;
        } finally {
            lock.unlock();
        }
    }

    private void checkGraph(ValidationResult validation) {
        for (String warning : validation.getWarnings()) {
            LOG.warning(warning);
        }
        if (validation.isValid()) {
            return;
        }

        LOG.severe(validation.getSummary());
        for (String missing : validation.getMissingDependencies()) {
            LOG.severe(missing);
        }
        if (validation.hasCircularDependencies()) {
            throw new CircularDependencyException(validation.getCycle().getPath());
        }
        if (config.isStrictInitialization()) {
            throw new MissingDependencyException(validation.getMissingDependencies());
        }
    }

    private ComponentInitializer newInitializer(boolean strict) {
        return new ComponentInitializer(store, factory, strict, listeners, creationOrder::add);
    }

    @Override
    public boolean isInitialized() {
        lock.lock();
        try {
            return report != null;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void dispose() {
        lock.lock();
        try {
            for (int i = creationOrder.size() - 1; i >= 0; i--) {
                Class<?> type = creationOrder.get(i);
                Registration registration = store.get(type);
                Object instance = registration == null ? null : registration.getInstance();
                if (instance == null) {
                    continue;
                }
                if (instance instanceof Disposable disposable) {
                    try {
                        disposable.dispose();
                    } catch (Exception e) {
                        LOG.log(Level.SEVERE, "Error disposing " + type.getName(), e);
                    }
                }
                listeners.disposed(type, instance);
            }

            for (Class<?> type : containerTypes) {
                container.unregister(type);
            }
            containerTypes.clear();
            creationOrder.clear();
            store.clear();
            report = null;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void addListener(RegistryListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    @Override
    public void removeListener(RegistryListener listener) {
        listeners.remove(listener);
    }
}
