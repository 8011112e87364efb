package com.tyron.keystone.core.registry;

import com.tyron.keystone.api.container.ServiceContainer;

import java.util.Objects;

/**
 * Builds components through a {@link ServiceContainer}, so their constructors receive other
 * components and services by injection.
 */
public final class ContainerComponentFactory implements ComponentFactory {

    private final ServiceContainer container;

    public ContainerComponentFactory(ServiceContainer container) {
        this.container = Objects.requireNonNull(container, "container");
    }

    @Override
    public <T> T create(Class<T> type) {
        if (!container.isRegistered(type)) {
            container.registerSingleton(type);
        }
        return container.resolve(type);
    }

    @Override
    public void discard(Class<?> type, Object instance) {
        container.evict(type);
    }
}
