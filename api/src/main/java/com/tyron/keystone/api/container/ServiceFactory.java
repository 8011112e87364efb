package com.tyron.keystone.api.container;

/**
 * Caller-supplied construction logic for {@link Lifetime#FACTORY} registrations.
 */
@FunctionalInterface
public interface ServiceFactory<T> {

    T create(ServiceContainer container);
}
