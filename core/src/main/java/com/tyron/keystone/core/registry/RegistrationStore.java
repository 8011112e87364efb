package com.tyron.keystone.core.registry;

import org.jetbrains.annotations.Nullable;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Registrations keyed by component type, in registration order. Not thread-safe; the owning
 * registry serializes access.
 */
public final class RegistrationStore {

    private final Clock clock;
    private final Map<Class<?>, Registration> registrations = new LinkedHashMap<>();
    private long nextSequence;

    public RegistrationStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Adds a registration, replacing any previous one for the same type. The replacement counts
     * as a new registration for ordering purposes.
     *
     * @return the previous registration, if any
     */
    public @Nullable Registration add(Class<?> type, int priority, List<Class<?>> dependencies, @Nullable Object instance) {
        Objects.requireNonNull(type, "type");
        for (Class<?> dependency : dependencies) {
            Objects.requireNonNull(dependency, "dependency of " + type.getName());
        }
        List<Class<?>> unique = new ArrayList<>(new LinkedHashSet<>(dependencies));
        Registration previous = registrations.remove(type);
        registrations.put(type, new Registration(type, priority, unique, nextSequence++, clock.instant(), instance));
        return previous;
    }

    public @Nullable Registration remove(Class<?> type) {
        return registrations.remove(type);
    }

    public @Nullable Registration get(Class<?> type) {
        return registrations.get(type);
    }

    public boolean contains(Class<?> type) {
        return registrations.containsKey(type);
    }

    public int size() {
        return registrations.size();
    }

    public boolean isEmpty() {
        return registrations.isEmpty();
    }

    /**
     * @return a snapshot in registration order
     */
    public List<Registration> all() {
        return List.copyOf(registrations.values());
    }

    /**
     * @return the derived dependency graph: each registered type to its declared dependencies,
     * in registration order
     */
    public Map<Class<?>, List<Class<?>>> edges() {
        Map<Class<?>, List<Class<?>>> edges = new LinkedHashMap<>();
        for (Registration registration : registrations.values()) {
            edges.put(registration.getType(), registration.getDependencies());
        }
        return Collections.unmodifiableMap(edges);
    }

    public void clear() {
        registrations.clear();
    }
}
