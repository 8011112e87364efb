package com.tyron.keystone.core.registry;

import com.tyron.keystone.api.component.DependencyAware;
import com.tyron.keystone.api.component.DependencyCycle;
import com.tyron.keystone.api.component.ValidationResult;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Validates a registration graph: every declared dependency must be registered and the
 * dependency relation must be acyclic.
 * <p>
 * All problems are collected; nothing is thrown. Duplicate priorities and dependents that do
 * not implement {@link DependencyAware} are reported as warnings and never invalidate the graph.
 */
public final class DependencyResolver {

    /**
     * @param registrations registrations in registration order
     * @param edges         declared dependencies per registered type
     */
    public ValidationResult validate(List<Registration> registrations, Map<Class<?>, List<Class<?>>> edges) {
        List<String> missing = findMissing(registrations, edges);
        List<DependencyCycle> cycles = findCycles(registrations, edges);
        List<String> warnings = new ArrayList<>();
        warnings.addAll(sharedPriorityWarnings(registrations));
        warnings.addAll(dependencyAwareWarnings(registrations, edges));
        return new ValidationResult(missing, cycles, warnings);
    }

    private static List<String> findMissing(List<Registration> registrations, Map<Class<?>, List<Class<?>>> edges) {
        List<String> missing = new ArrayList<>();
        for (Registration registration : registrations) {
            for (Class<?> dependency : edges.getOrDefault(registration.getType(), List.of())) {
                if (!edges.containsKey(dependency)) {
                    missing.add(registration.getType().getSimpleName() + " depends on "
                            + dependency.getSimpleName() + ", which is not registered");
                }
            }
        }
        return missing;
    }

    private static List<DependencyCycle> findCycles(List<Registration> registrations, Map<Class<?>, List<Class<?>>> edges) {
        CycleSearch search = new CycleSearch(edges);
        for (Registration registration : registrations) {
            search.visit(registration.getType());
        }
        return search.cycles;
    }

    private static final class CycleSearch {

        private final Map<Class<?>, List<Class<?>>> edges;
        private final Set<Class<?>> visited = new HashSet<>();
        private final Set<Class<?>> onStack = new HashSet<>();
        private final List<Class<?>> path = new ArrayList<>();

        private final List<DependencyCycle> cycles = new ArrayList<>();
        private final Set<DependencyCycle> seen = new HashSet<>();

        CycleSearch(Map<Class<?>, List<Class<?>>> edges) {
            this.edges = edges;
        }

        void visit(Class<?> node) {
            if (visited.contains(node)) {
                return;
            }
            visited.add(node);
            onStack.add(node);
            path.add(node);

            for (Class<?> next : edges.getOrDefault(node, List.of())) {
                if (!edges.containsKey(next)) {
                    continue; // reported as missing
                }
                if (onStack.contains(next)) {
                    List<Class<?>> closed = new ArrayList<>(path.subList(path.indexOf(next), path.size()));
                    closed.add(next);
                    DependencyCycle cycle = new DependencyCycle(closed);
                    if (seen.add(cycle.canonical())) {
                        cycles.add(cycle);
                    }
                } else {
                    visit(next);
                }
            }

            path.remove(path.size() - 1);
            onStack.remove(node);
        }
    }

    private static List<String> sharedPriorityWarnings(List<Registration> registrations) {
        Map<Integer, List<Class<?>>> byPriority = new LinkedHashMap<>();
        for (Registration registration : registrations) {
            byPriority.computeIfAbsent(registration.getPriority(), k -> new ArrayList<>()).add(registration.getType());
        }

        List<String> warnings = new ArrayList<>();
        byPriority.forEach((priority, types) -> {
            if (types.size() > 1) {
                warnings.add("Priority " + priority + " is shared by "
                        + types.stream().map(Class::getSimpleName).collect(Collectors.joining(", ")));
            }
        });
        return warnings;
    }

    private static List<String> dependencyAwareWarnings(List<Registration> registrations,
                                                        Map<Class<?>, List<Class<?>>> edges) {
        List<String> warnings = new ArrayList<>();
        for (Registration registration : registrations) {
            if (edges.getOrDefault(registration.getType(), List.of()).isEmpty()) {
                continue;
            }
            boolean aware = DependencyAware.class.isAssignableFrom(registration.getType())
                    || registration.getInstance() instanceof DependencyAware;
            if (!aware) {
                warnings.add(registration.getType().getSimpleName()
                        + " declares dependencies but does not implement DependencyAware");
            }
        }
        return warnings;
    }
}
