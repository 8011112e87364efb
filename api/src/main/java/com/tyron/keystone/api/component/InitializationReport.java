package com.tyron.keystone.api.component;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Result of {@link ComponentRegistry#initializeAll()}.
 *
 * @param initialized types constructed during this run, in initialization order
 * @param failed      types whose construction failed, with the failure message (lenient mode only)
 * @param skipped     types not constructed because a dependency failed or is missing, with the reason
 * @param elapsed     wall time spent
 */
public record InitializationReport(
        List<Class<?>> initialized,
        Map<Class<?>, String> failed,
        Map<Class<?>, String> skipped,
        Duration elapsed
) {

    public InitializationReport {
        initialized = List.copyOf(initialized);
        failed = Map.copyOf(failed);
        skipped = Map.copyOf(skipped);
    }

    public boolean isComplete() {
        return failed.isEmpty() && skipped.isEmpty();
    }
}
