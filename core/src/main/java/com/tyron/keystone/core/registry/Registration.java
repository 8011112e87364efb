package com.tyron.keystone.core.registry;

import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.List;

/**
 * A declared component: its priority, its dependencies and, once built, its instance.
 * <p>
 * Only the instance is mutable. Ordering ties are broken by {@link #getSequence()}; the
 * timestamp is informational since two registrations may share it.
 */
public final class Registration {

    private final Class<?> type;
    private final int priority;
    private final List<Class<?>> dependencies;
    private final long sequence;
    private final Instant registeredAt;

    private volatile @Nullable Object instance;

    Registration(Class<?> type, int priority, List<Class<?>> dependencies, long sequence, Instant registeredAt,
                 @Nullable Object instance) {
        this.type = type;
        this.priority = priority;
        this.dependencies = List.copyOf(dependencies);
        this.sequence = sequence;
        this.registeredAt = registeredAt;
        this.instance = instance;
    }

    public Class<?> getType() {
        return type;
    }

    public int getPriority() {
        return priority;
    }

    /**
     * @return declared dependencies in declaration order, without duplicates
     */
    public List<Class<?>> getDependencies() {
        return dependencies;
    }

    public long getSequence() {
        return sequence;
    }

    public Instant getRegisteredAt() {
        return registeredAt;
    }

    public @Nullable Object getInstance() {
        return instance;
    }

    public boolean hasInstance() {
        return instance != null;
    }

    void attachInstance(Object instance) {
        if (this.instance != null && this.instance != instance) {
            throw new IllegalStateException(type.getName() + " already has an instance");
        }
        this.instance = instance;
    }

    @Override
    public String toString() {
        return "Registration{" + type.getSimpleName()
                + ", priority=" + priority
                + ", dependencies=" + dependencies.stream().map(Class::getSimpleName).toList()
                + ", sequence=" + sequence + "}";
    }
}
