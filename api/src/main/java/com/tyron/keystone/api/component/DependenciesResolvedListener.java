package com.tyron.keystone.api.component;

/**
 * Notified after {@link Initializable#initialize()} once every declared dependency of the
 * component has an instance.
 */
public interface DependenciesResolvedListener {

    void onDependenciesResolved();
}
