package com.repo.formulas.parser;

/**
 * Function families with the multiplier the scorer applies to their weight.
 */
public enum FunctionCategory {
    MATHEMATICAL(0.8),
    LOGICAL(1.0),
    LOOKUP(1.4),
    FINANCIAL(1.3),
    STATISTICAL(1.1),
    ADVANCED(1.8),
    TEXT(0.9),
    DATE_TIME(1.2),
    DATABASE(1.3),
    INFORMATION(0.7);

    private final double multiplier;

    FunctionCategory(double multiplier) {
        this.multiplier = multiplier;
    }

    public double multiplier() {
        return multiplier;
    }
}
