package com.tyron.keystone.core.service;

import java.lang.reflect.Constructor;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Constructor plan ranking and reflective derivation.
 * <p>
 * Plans are tried most dependencies first; equal arities keep their input order. Derived plans
 * are computed once per implementation type.
 */
public final class ConstructorPlans {

    private static final Comparator<ConstructorPlan> MOST_DEPENDENCIES_FIRST =
            Comparator.comparingInt(ConstructorPlan::arity).reversed();

    private final Map<Class<?>, List<ConstructorPlan>> derived = new ConcurrentHashMap<>();

    /**
     * @return a new list ordered by dependency count, descending. The sort is stable.
     */
    public static List<ConstructorPlan> rank(List<ConstructorPlan> plans) {
        List<ConstructorPlan> ranked = new ArrayList<>(plans);
        ranked.sort(MOST_DEPENDENCIES_FIRST);
        return List.copyOf(ranked);
    }

    /**
     * @return ranked plans for the public constructors of {@code implementationType}; empty for
     * interfaces, abstract classes and types without a public constructor.
     */
    public List<ConstructorPlan> plansFor(Class<?> implementationType) {
        return derived.computeIfAbsent(implementationType, ConstructorPlans::derive);
    }

    public void forget(Class<?> implementationType) {
        derived.remove(implementationType);
    }

    private static List<ConstructorPlan> derive(Class<?> type) {
        if (type.isInterface() || type.isPrimitive() || type.isArray() || Modifier.isAbstract(type.getModifiers())) {
            return List.of();
        }
        // getConstructors() has no defined order
        Constructor<?>[] constructors = type.getConstructors();
        Arrays.sort(constructors, Comparator.comparing(Constructor::toGenericString));

        List<ConstructorPlan> plans = new ArrayList<>(constructors.length);
        for (Constructor<?> constructor : constructors) {
            plans.add(ConstructorPlan.of(constructor));
        }
        return rank(plans);
    }
}
