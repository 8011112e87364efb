package com.tyron.keystone.core.service;

import com.tyron.keystone.api.container.Instantiator;

import java.lang.reflect.Constructor;
import java.util.List;
import java.util.stream.Collectors;

/**
 * One way of building an implementation: the dependency types to resolve, in order, and the
 * function that receives the resolved arguments.
 */
public record ConstructorPlan(List<Class<?>> dependencies, Instantiator<?> instantiator, String description) {

    public ConstructorPlan {
        dependencies = List.copyOf(dependencies);
    }

    /**
     * A plan declared at registration time.
     */
    public static ConstructorPlan declared(Class<?> owner, List<Class<?>> dependencies, Instantiator<?> instantiator) {
        return new ConstructorPlan(dependencies, instantiator, signature(owner, dependencies));
    }

    /**
     * A plan backed by a public constructor. {@link java.lang.reflect.InvocationTargetException}
     * is left to the caller to unwrap.
     */
    public static ConstructorPlan of(Constructor<?> constructor) {
        List<Class<?>> parameters = List.of(constructor.getParameterTypes());
        return new ConstructorPlan(parameters, constructor::newInstance,
                signature(constructor.getDeclaringClass(), parameters));
    }

    public int arity() {
        return dependencies.size();
    }

    private static String signature(Class<?> owner, List<Class<?>> parameters) {
        return owner.getSimpleName() + parameters.stream()
                .map(Class::getSimpleName)
                .collect(Collectors.joining(", ", "(", ")"));
    }

    @Override
    public String toString() {
        return description;
    }
}
