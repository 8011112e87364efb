package com.tyron.keystone.core.discovery;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Best-effort fallback that finds a concrete implementation for an unregistered type.
 * <p>
 * The first candidate from the {@link ImplementationCatalog} that is assignable, concrete and
 * has a public no-arg constructor is instantiated. Each requested type is attempted at most once
 * per discovery instance; both outcomes are remembered. Not finding anything is not an error.
 */
public final class ImplementationDiscovery {

    private static final Logger LOG = Logger.getLogger(ImplementationDiscovery.class.getName());

    private final ImplementationCatalog catalog;
    private final Map<Class<?>, Optional<Object>> attempts = new ConcurrentHashMap<>();

    public ImplementationDiscovery(ImplementationCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    public Optional<Object> tryDiscover(Class<?> requestedType) {
        Objects.requireNonNull(requestedType, "requestedType");
        return attempts.computeIfAbsent(requestedType, this::discover);
    }

    public boolean wasAttempted(Class<?> requestedType) {
        return attempts.containsKey(requestedType);
    }

    public int getAttemptCount() {
        return attempts.size();
    }

    public int getDiscoveredCount() {
        return (int) attempts.values().stream().filter(Optional::isPresent).count();
    }

    public void clear() {
        attempts.clear();
    }

    private Optional<Object> discover(Class<?> requestedType) {
        for (Class<?> candidate : catalog.candidatesFor(requestedType)) {
            if (!isEligible(requestedType, candidate)) {
                if (LOG.isLoggable(Level.FINE)) {
                    LOG.fine("Skipping " + candidate.getName() + " for " + requestedType.getName()
                            + ": not a concrete, assignable type");
                }
                continue;
            }

            Constructor<?> ctor;
            try {
                ctor = candidate.getConstructor();
            } catch (NoSuchMethodException e) {
                if (LOG.isLoggable(Level.FINE)) {
                    LOG.fine("Skipping " + candidate.getName() + ": no public no-arg constructor");
                }
                continue;
            }

            try {
                Object instance = ctor.newInstance();
                if (LOG.isLoggable(Level.FINE)) {
                    LOG.fine("Discovered " + candidate.getName() + " for " + requestedType.getName());
                }
                return Optional.of(instance);
            } catch (InvocationTargetException e) {
                LOG.log(Level.WARNING, "Discovered implementation " + candidate.getName()
                        + " threw during construction", e.getCause());
            } catch (ReflectiveOperationException e) {
                LOG.log(Level.WARNING, "Cannot instantiate discovered implementation " + candidate.getName(), e);
            }
        }
        return Optional.empty();
    }

    private static boolean isEligible(Class<?> requestedType, Class<?> candidate) {
        return requestedType.isAssignableFrom(candidate)
                && !candidate.isInterface()
                && !Modifier.isAbstract(candidate.getModifiers());
    }
}
