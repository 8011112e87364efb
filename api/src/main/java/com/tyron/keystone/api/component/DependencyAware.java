package com.tyron.keystone.api.component;

/**
 * Marker for components that know they are wired through declared dependencies.
 * <p>
 * Purely informational: validation warns about components that declare dependencies without it.
 */
public interface DependencyAware {
}
