package com.tyron.keystone.api.container;

import com.tyron.keystone.api.error.CircularDependencyException;
import com.tyron.keystone.api.error.InstanceCreationException;
import com.tyron.keystone.api.error.UnregisteredServiceException;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Set;

/**
 * Type-keyed service container with constructor injection.
 * <p>
 * Registrations carry a {@link Lifetime}. Resolution checks the singleton store first, then the
 * resolution cache, factories and finally constructs the implementation, resolving its
 * constructor parameters recursively.
 */
public interface ServiceContainer {

    /**
     * General registration. {@code instance} is only meaningful for singletons, {@code factory}
     * only for {@link Lifetime#FACTORY}.
     */
    <T> void register(Class<T> serviceType,
                      Class<? extends T> implementationType,
                      Lifetime lifetime,
                      @Nullable T instance,
                      @Nullable ServiceFactory<? extends T> factory);

    default <T> void registerSingleton(Class<T> serviceType) {
        register(serviceType, serviceType, Lifetime.SINGLETON, null, null);
    }

    default <T> void registerSingleton(Class<T> serviceType, Class<? extends T> implementationType) {
        register(serviceType, implementationType, Lifetime.SINGLETON, null, null);
    }

    <T> void registerSingleton(Class<T> serviceType, T instance);

    default <T> void registerTransient(Class<T> serviceType) {
        register(serviceType, serviceType, Lifetime.TRANSIENT, null, null);
    }

    default <T> void registerTransient(Class<T> serviceType, Class<? extends T> implementationType) {
        register(serviceType, implementationType, Lifetime.TRANSIENT, null, null);
    }

    default <T> void registerCached(Class<T> serviceType, Class<? extends T> implementationType) {
        register(serviceType, implementationType, Lifetime.CACHED, null, null);
    }

    <T> void registerFactory(Class<T> serviceType, ServiceFactory<? extends T> factory);

    /**
     * Registers a service whose construction is declared up front: {@code dependencies} are
     * resolved in order and handed to {@code instantiator}. No reflection is involved.
     */
    <T> void registerConstructor(Class<T> serviceType,
                                 Lifetime lifetime,
                                 List<Class<?>> dependencies,
                                 Instantiator<? extends T> instantiator);

    /**
     * Resolves without throwing.
     */
    <T> Resolution<T> resolveResult(Class<T> serviceType);

    /**
     * @throws UnregisteredServiceException if nothing can provide the type
     * @throws CircularDependencyException  if the type is already being resolved on this thread
     * @throws InstanceCreationException    if every constructor failed
     */
    default <T> T resolve(Class<T> serviceType) {
        return resolveResult(serviceType).getOrThrow();
    }

    /**
     * @return the instance, or {@code null} if resolution failed for any reason.
     */
    default <T> @Nullable T tryResolve(Class<T> serviceType) {
        return resolveResult(serviceType).getOrNull();
    }

    /**
     * @return an instance for every registration whose implementation is assignable to the type.
     */
    <T> List<T> resolveAll(Class<T> serviceType);

    boolean isRegistered(Class<?> serviceType);

    boolean unregister(Class<?> serviceType);

    /**
     * Drops the stored singleton or cached instance of a type while keeping its registration,
     * so the next resolution builds a new one. The dropped instance is not disposed.
     *
     * @return true if an instance was dropped
     */
    boolean evict(Class<?> serviceType);

    Set<Class<?>> getRegisteredServiceTypes();

    int getServiceCount();

    int getSingletonCount();

    ContainerStatistics getStatistics();

    /**
     * Statically checks that every constructed registration has at least one constructor whose
     * dependencies are all registered.
     *
     * @return problems found, empty when the container is consistent.
     */
    List<String> verify();

    /**
     * Disposes every singleton in reverse creation order and clears all registrations.
     */
    void disposeAll();
}
