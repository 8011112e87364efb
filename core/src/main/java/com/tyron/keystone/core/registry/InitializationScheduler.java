package com.tyron.keystone.core.registry;

import com.tyron.keystone.api.error.CircularDependencyException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes the initialization order: dependencies first, then higher priority, then earlier
 * registration.
 * <p>
 * Each step places the first ready candidate of the sorted remaining list. A candidate is ready
 * when every dependency is placed or not registered at all. The result is deterministic for a
 * fixed registration sequence.
 */
public final class InitializationScheduler {

    static final Comparator<Registration> PRIORITY_THEN_REGISTRATION =
            Comparator.comparingInt(Registration::getPriority).reversed()
                    .thenComparingLong(Registration::getSequence);

    /**
     * @throws CircularDependencyException if the remaining candidates cannot make progress. The
     *                                     exception carries the stuck types, not a closed path.
     */
    public List<Class<?>> computeOrder(List<Registration> registrations, Map<Class<?>, List<Class<?>>> edges) {
        List<Registration> remaining = new ArrayList<>(registrations);
        remaining.sort(PRIORITY_THEN_REGISTRATION);

        Set<Class<?>> registered = new HashSet<>();
        for (Registration registration : registrations) {
            registered.add(registration.getType());
        }

        List<Class<?>> order = new ArrayList<>(remaining.size());
        Set<Class<?>> placed = new HashSet<>();
        while (!remaining.isEmpty()) {
            boolean progressed = false;
            for (Iterator<Registration> it = remaining.iterator(); it.hasNext(); ) {
                Registration candidate = it.next();
                if (isReady(candidate, edges, registered, placed)) {
                    it.remove();
                    order.add(candidate.getType());
                    placed.add(candidate.getType());
                    progressed = true;
                    // restart so a newly unblocked higher priority candidate goes next
                    break;
                }
            }

            if (!progressed) {
                List<Class<?>> stuck = remaining.stream().<Class<?>>map(Registration::getType).toList();
                throw new CircularDependencyException(
                        "Cannot order components, the remaining ones form a cycle: "
                                + CircularDependencyException.describe(stuck), stuck);
            }
        }
        return order;
    }

    private static boolean isReady(Registration candidate,
                                   Map<Class<?>, List<Class<?>>> edges,
                                   Set<Class<?>> registered,
                                   Set<Class<?>> placed) {
        for (Class<?> dependency : edges.getOrDefault(candidate.getType(), List.of())) {
            if (registered.contains(dependency) && !placed.contains(dependency)) {
                return false;
            }
        }
        return true;
    }
}
