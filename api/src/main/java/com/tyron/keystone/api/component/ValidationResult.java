package com.tyron.keystone.api.component;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Aggregated outcome of validating a registration graph. Never thrown; callers decide whether to
 * abort.
 */
public final class ValidationResult {

    private final List<String> missingDependencies;
    private final List<DependencyCycle> cycles;
    private final List<String> warnings;

    public ValidationResult(List<String> missingDependencies, List<DependencyCycle> cycles, List<String> warnings) {
        this.missingDependencies = List.copyOf(missingDependencies);
        this.cycles = List.copyOf(cycles);
        this.warnings = List.copyOf(warnings);
    }

    public boolean isValid() {
        return missingDependencies.isEmpty() && cycles.isEmpty();
    }

    public List<String> getMissingDependencies() {
        return missingDependencies;
    }

    public boolean hasCircularDependencies() {
        return !cycles.isEmpty();
    }

    /**
     * @return the first cycle found in traversal order, or {@code null}.
     */
    public @Nullable DependencyCycle getCycle() {
        return cycles.isEmpty() ? null : cycles.get(0);
    }

    public List<DependencyCycle> getCycles() {
        return cycles;
    }

    public @Nullable String getCycleDescription() {
        DependencyCycle cycle = getCycle();
        return cycle == null ? null : cycle.describe();
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public String getSummary() {
        return "Validation: " + (isValid() ? "PASSED" : "FAILED")
                + " | Missing: " + missingDependencies.size()
                + " | Cycles: " + cycles.size()
                + " | Warnings: " + warnings.size();
    }

    @Override
    public String toString() {
        return getSummary();
    }
}
