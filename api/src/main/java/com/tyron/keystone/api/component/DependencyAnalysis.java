package com.tyron.keystone.api.component;

/**
 * Diagnostic summary of the declared dependency graph.
 *
 * @param totalDependencies number of declared edges
 * @param maxPerComponent   largest number of dependencies declared by a single component
 * @param avgPerComponent   mean number of dependencies per registered component
 * @param longestChain      number of types on the longest dependency path (a lone component is 1)
 * @param complexityRating  coarse rating derived from the average and the longest chain
 */
public record DependencyAnalysis(
        int totalDependencies,
        int maxPerComponent,
        double avgPerComponent,
        int longestChain,
        ComplexityRating complexityRating
) {

    public static ComplexityRating rate(double avgPerComponent, int longestChain) {
        if (avgPerComponent < 2 && longestChain <= 3) {
            return ComplexityRating.LOW;
        }
        if (avgPerComponent < 4 && longestChain <= 6) {
            return ComplexityRating.MEDIUM;
        }
        return ComplexityRating.HIGH;
    }
}
