package com.repo.formulas.scoring;

/**
 * Workbook-wide spread of formula scores.
 * {@code simpleCount + moderateCount + complexCount + criticalCount == totalFormulas}.
 */
public record ComplexityDistribution(
        int simpleCount,
        int moderateCount,
        int complexCount,
        int criticalCount,
        int totalFormulas,
        double averageScore,
        double maxScore,
        double minScore,
        double variance) {

    public static ComplexityDistribution empty() {
        return new ComplexityDistribution(0, 0, 0, 0, 0, 0.0, 0.0, 0.0, 0.0);
    }
}
