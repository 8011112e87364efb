package com.tyron.keystone.api.component;

import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Set;

/**
 * Registry of managers: long-lived components declared with a priority and a dependency list,
 * initialized once in dependency order.
 * <p>
 * Typical use:
 * <pre>
 * registry.register(EventManager.class, 100);
 * registry.register(SaveManager.class, 50, EventManager.class);
 * registry.initializeAll();
 * SaveManager save = registry.getManager(SaveManager.class);
 * </pre>
 */
public interface ComponentRegistry {

    /**
     * Declares a component. Ignored, with a warning, once {@link #initializeAll()} has completed.
     *
     * @param priority     higher values are initialized earlier among ready components
     * @param dependencies types that must be initialized before this one
     */
    <T> void register(Class<T> type, int priority, Class<?>... dependencies);

    /**
     * Registers an already constructed component. It is never constructed again.
     *
     * @throws IllegalStateException if the container already holds a registration of the type
     *                               that this registry did not add
     */
    <T> void registerInstance(Class<T> type, T instance, int priority);

    /**
     * Removes a registration. Only allowed before initialization.
     *
     * @return true if a registration was removed
     */
    boolean unregister(Class<?> type);

    boolean isRegistered(Class<?> type);

    /**
     * @return registered types in registration order
     */
    List<Class<?>> getRegisteredTypes();

    /**
     * Returns the existing instance or constructs it lazily. Never throws.
     *
     * @return the component, or {@code null} if it is unknown or could not be constructed
     */
    <T> @Nullable T getManager(Class<T> type);

    /**
     * @return the first registered component assignable to the interface, or {@code null}
     */
    <T> @Nullable T getManagerByInterface(Class<T> interfaceType);

    /**
     * @return every constructed component assignable to the interface, in registration order
     */
    <T> List<T> getManagersByInterface(Class<T> interfaceType);

    /**
     * Read-only; may be called at any time.
     */
    ValidationResult validateDependencies();

    DependencyAnalysis analyzeDependencies();

    /**
     * @return the computed initialization order of the current registrations
     */
    List<Class<?>> getInitializationOrder();

    /**
     * Constructs every registered component in dependency order. One-shot: later calls log a
     * warning and return the first report.
     */
    InitializationReport initializeAll();

    boolean isInitialized();

    /**
     * Tears down all instances in reverse initialization order and clears the registry. Idempotent.
     */
    void dispose();

    void addListener(RegistryListener listener);

    void removeListener(RegistryListener listener);

    Set<Class<?>> getInstantiatedTypes();
}
