package com.repo.formulas.scoring;

import com.repo.formulas.parser.ComplexityLevel;

import java.util.List;

/**
 * Context-aware complexity result for one formula.
 */
public record ComplexityAnalysis(
        double complexityScore,
        ComplexityLevel complexityLevel,
        ComplexityFactors factors,

        /** Multiplier applied to the weighted total (volatility, arrays, externals, frequency) */
        double performanceMultiplier,

        String performancePrediction,
        String maintenanceRisk,
        List<String> optimizationSuggestions) {

    public ComplexityAnalysis {
        optimizationSuggestions = List.copyOf(optimizationSuggestions);
    }
}
