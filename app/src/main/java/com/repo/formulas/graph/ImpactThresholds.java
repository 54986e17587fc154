package com.repo.formulas.graph;

/**
 * Affected-cell counts above which a change escalates to the next
 * {@link ImpactLevel}.
 */
public record ImpactThresholds(int medium, int high, int critical) {

    public static final ImpactThresholds DEFAULT = new ImpactThresholds(5, 20, 100);

    public ImpactThresholds {
        if (medium < 0 || high < medium || critical < high) {
            throw new IllegalArgumentException(
                    "Impact thresholds must be ascending: " + medium + ", " + high + ", " + critical);
        }
    }

    public ImpactLevel levelFor(int affectedCount) {
        if (affectedCount > critical)
            return ImpactLevel.CRITICAL;
        if (affectedCount > high)
            return ImpactLevel.HIGH;
        if (affectedCount > medium)
            return ImpactLevel.MEDIUM;
        return ImpactLevel.LOW;
    }
}
