package com.repo.formulas.scoring;

/**
 * Factor weights for the weighted complexity total. The defaults sum to 1.0.
 */
public record ScoringWeights(
        double length,
        double nesting,
        double functions,
        double dependencies,
        double references,
        double specialFeatures) {

    public static final ScoringWeights DEFAULT = new ScoringWeights(0.15, 0.25, 0.30, 0.15, 0.10, 0.05);

    public ScoringWeights {
        if (length < 0 || nesting < 0 || functions < 0 || dependencies < 0 || references < 0
                || specialFeatures < 0) {
            throw new IllegalArgumentException("Scoring weights must not be negative");
        }
    }

    public double weightedTotal(ComplexityFactors factors) {
        return factors.formulaLength() * length
                + factors.nestingDepth() * nesting
                + factors.functionComplexity() * functions
                + factors.dependencyComplexity() * dependencies
                + factors.referenceComplexity() * references
                + factors.specialFeatures() * specialFeatures;
    }
}
