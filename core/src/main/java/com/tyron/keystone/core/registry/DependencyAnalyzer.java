package com.tyron.keystone.core.registry;

import com.tyron.keystone.api.component.DependencyAnalysis;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Diagnostic metrics over the declared dependency graph. Has no effect on behavior.
 */
public final class DependencyAnalyzer {

    public DependencyAnalysis analyze(List<Registration> registrations, Map<Class<?>, List<Class<?>>> edges) {
        int total = 0;
        int max = 0;
        for (Registration registration : registrations) {
            int count = edges.getOrDefault(registration.getType(), List.of()).size();
            total += count;
            max = Math.max(max, count);
        }
        double average = registrations.isEmpty() ? 0.0 : (double) total / registrations.size();

        Map<Class<?>, Integer> depth = new HashMap<>();
        int longest = 0;
        for (Registration registration : registrations) {
            longest = Math.max(longest, chainLength(registration.getType(), edges, depth, new HashSet<>()));
        }

        return new DependencyAnalysis(total, max, average, longest, DependencyAnalysis.rate(average, longest));
    }

    /**
     * Number of types on the longest path starting at {@code type}. Edges back onto the current
     * path and edges to unregistered types are not followed.
     */
    private static int chainLength(Class<?> type,
                                   Map<Class<?>, List<Class<?>>> edges,
                                   Map<Class<?>, Integer> depth,
                                   Set<Class<?>> path) {
        Integer known = depth.get(type);
        if (known != null) {
            return known;
        }

        path.add(type);
        int deepest = 0;
        for (Class<?> dependency : edges.getOrDefault(type, List.of())) {
            if (!edges.containsKey(dependency) || path.contains(dependency)) {
                continue;
            }
            deepest = Math.max(deepest, chainLength(dependency, edges, depth, path));
        }
        path.remove(type);

        int length = deepest + 1;
        depth.put(type, length);
        return length;
    }
}
