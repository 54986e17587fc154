package com.repo.formulas.scoring;

/**
 * Per-factor breakdown of a complexity score. Every factor is in [0, 100].
 */
public record ComplexityFactors(
        /** Character length, 500 chars = 100 */
        double formulaLength,

        /** Deepest function nesting, 10 levels = 100 */
        double nestingDepth,

        /** Average per-call cost of the functions used */
        double functionComplexity,

        /** Precedent chain length, 20 hops = 100 */
        double dependencyComplexity,

        /** Count and kind of references, ranges and external workbooks */
        double referenceComplexity,

        /** Array formula, table references, volatile functions */
        double specialFeatures) {
}
