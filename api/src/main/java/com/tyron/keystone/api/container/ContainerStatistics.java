package com.tyron.keystone.api.container;

import java.util.Map;

/**
 * Snapshot of container usage counters. Observational only.
 */
public record ContainerStatistics(
        int totalServices,
        int singletonServices,
        int transientServices,
        int factoryServices,
        int cachedServices,
        long totalResolutions,
        long successfulResolutions,
        long failedResolutions,
        long cacheHits,
        long cacheMisses,
        Map<Class<?>, Integer> resolutionCounts
) {

    public ContainerStatistics {
        resolutionCounts = Map.copyOf(resolutionCounts);
    }

    public double successRate() {
        return totalResolutions == 0 ? 0.0 : (double) successfulResolutions / totalResolutions;
    }

    public String report() {
        return "Services: " + totalServices
                + " (S:" + singletonServices + ", T:" + transientServices
                + ", F:" + factoryServices + ", C:" + cachedServices + ")"
                + " | Resolutions: " + successfulResolutions + "/" + totalResolutions
                + String.format(" (%.1f%% success)", successRate() * 100)
                + " | Cache: " + cacheHits + " hits, " + cacheMisses + " misses";
    }
}
