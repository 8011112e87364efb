package com.tyron.keystone.core.service;

import com.tyron.keystone.api.container.Lifetime;
import com.tyron.keystone.api.container.ServiceFactory;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * A container registration.
 *
 * @param plans declared constructor plans, or {@code null} to derive them from the public
 *              constructors of the implementation type
 * @param sequence monotonic registration number within the owning container
 */
record ServiceEntry(
        Class<?> serviceType,
        Class<?> implementationType,
        Lifetime lifetime,
        @Nullable ServiceFactory<?> factory,
        @Nullable List<ConstructorPlan> plans,
        long sequence
) {

    boolean isFactory() {
        return lifetime == Lifetime.FACTORY;
    }
}
