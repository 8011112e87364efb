package com.tyron.keystone.api.component;

import com.tyron.keystone.api.error.CircularDependencyException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * A closed dependency path: the first type is repeated as the last element ({@code [X, Y, X]}).
 */
public final class DependencyCycle {

    private static final Comparator<Class<?>> BY_NAME = Comparator.comparing(Class::getName);

    private final List<Class<?>> path;

    public DependencyCycle(List<Class<?>> path) {
        if (path.size() < 2 || path.get(0) != path.get(path.size() - 1)) {
            throw new IllegalArgumentException("Not a closed path: " + path);
        }
        this.path = List.copyOf(path);
    }

    public List<Class<?>> getPath() {
        return path;
    }

    /**
     * @return the number of distinct types in the cycle; a self-dependency has length 1.
     */
    public int length() {
        return path.size() - 1;
    }

    /**
     * Rotates the cycle to start at its minimum type (by class name), so the same cycle found
     * from different entry points compares equal.
     */
    public DependencyCycle canonical() {
        List<Class<?>> open = path.subList(0, path.size() - 1);
        int start = 0;
        for (int i = 1; i < open.size(); i++) {
            if (BY_NAME.compare(open.get(i), open.get(start)) < 0) {
                start = i;
            }
        }
        List<Class<?>> rotated = new ArrayList<>(path.size());
        for (int i = 0; i < open.size(); i++) {
            rotated.add(open.get((start + i) % open.size()));
        }
        rotated.add(rotated.get(0));
        return new DependencyCycle(rotated);
    }

    public String describe() {
        return CircularDependencyException.describe(path);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DependencyCycle other)) return false;
        return path.equals(other.path);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path);
    }

    @Override
    public String toString() {
        return describe();
    }
}
