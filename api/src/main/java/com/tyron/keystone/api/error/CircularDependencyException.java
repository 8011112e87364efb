package com.tyron.keystone.api.error;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A dependency cycle was found, either while validating the registration graph or on the
 * resolution stack of a running {@code resolve} call.
 */
public class CircularDependencyException extends KeystoneException {

    private final List<Class<?>> cycle;

    public CircularDependencyException(List<Class<?>> cycle) {
        this("Circular dependency detected: " + describe(cycle), cycle);
    }

    public CircularDependencyException(String message, List<Class<?>> cycle) {
        super(message);
        this.cycle = List.copyOf(cycle);
    }

    /**
     * @return the types of the cycle in traversal order. For a cycle found on a path the
     * first type is repeated at the end; for a stuck scheduling set it is the set itself.
     */
    public List<Class<?>> getCycle() {
        return cycle;
    }

    public static String describe(List<Class<?>> types) {
        return types.stream().map(Class::getSimpleName).collect(Collectors.joining(" -> "));
    }
}
