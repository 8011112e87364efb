package com.tyron.keystone.api.error;

import java.util.List;

/**
 * A declared dependency type was never registered.
 * <p>
 * Validation collects these as messages; this exception is only raised when a caller decides
 * to abort on them (strict initialization).
 */
public class MissingDependencyException extends KeystoneException {

    private final List<String> missingDependencies;

    public MissingDependencyException(List<String> missingDependencies) {
        super("Missing dependencies: " + String.join("; ", missingDependencies));
        this.missingDependencies = List.copyOf(missingDependencies);
    }

    public List<String> getMissingDependencies() {
        return missingDependencies;
    }
}
