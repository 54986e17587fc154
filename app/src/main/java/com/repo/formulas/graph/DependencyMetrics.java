package com.repo.formulas.graph;

import java.util.Map;

/**
 * Workbook-level aggregates over the dependency graph.
 */
public record DependencyMetrics(
        /** Nodes that own a formula */
        int totalFormulas,

        /** Distinct precedent to dependent edges */
        int totalDependencies,

        /** Longest precedent chain ending at any formula, capped at the depth limit */
        int maxChainLength,

        double avgChainLength,
        int circularReferenceCount,

        /** Cells referenced only through external-workbook references */
        int externalDependencyCount,

        /** Formulas with neither precedents nor dependents */
        int orphanedFormulaCount,

        /** Keys: simple, moderate, complex, critical */
        Map<String, Integer> complexityDistribution,

        /** Keys: 0, 1-5, 6-20, 21+ */
        Map<String, Integer> fanOutDistribution,

        /** Fraction of formulas calling a volatile function */
        double volatilityScore) {

    public DependencyMetrics {
        complexityDistribution = Map.copyOf(complexityDistribution);
        fanOutDistribution = Map.copyOf(fanOutDistribution);
    }
}
