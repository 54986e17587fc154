package com.repo.formulas.parser;

/**
 * Complexity bands shared by the parser and the scorer.
 */
public enum ComplexityLevel {
    SIMPLE, // 0-25
    MODERATE, // 26-50
    COMPLEX, // 51-75
    CRITICAL; // 76-100

    /**
     * Map a score to its band. Anything that is not {@code <= 75} (including
     * NaN) lands in {@link #CRITICAL}, so every input has exactly one band.
     */
    public static ComplexityLevel fromScore(double score) {
        if (score <= 25)
            return SIMPLE;
        if (score <= 50)
            return MODERATE;
        if (score <= 75)
            return COMPLEX;
        return CRITICAL;
    }

    public String label() {
        return name().toLowerCase();
    }
}
