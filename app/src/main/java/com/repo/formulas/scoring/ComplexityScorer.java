package com.repo.formulas.scoring;

import com.repo.formulas.parser.CellReference;
import com.repo.formulas.parser.ComplexityLevel;
import com.repo.formulas.parser.FunctionCall;
import com.repo.formulas.parser.FunctionCatalog;
import com.repo.formulas.parser.ParsedFormula;

import java.util.ArrayList;
import java.util.List;

/**
 * Multi-factor formula complexity scoring.
 *
 * <p>
 * Six factors are normalized to [0, 100] and combined with
 * {@link ScoringWeights}. The weighted total is then scaled by a performance
 * multiplier:
 *
 * <pre>
 * multiplier = (1.0 + 0.3 [volatile] + 0.2 [array] + 0.4 [external])
 *         * min(2.0, 1 + executionFrequency / 100)
 * score = min(100, weightedTotal * multiplier)
 * </pre>
 *
 * Pure and deterministic; safe to share between threads.
 */
public class ComplexityScorer {

    private static final double LENGTH_FOR_MAX = 500.0;
    private static final double NESTING_FOR_MAX = 10.0;
    private static final double CHAIN_FOR_MAX = 20.0;

    private final FunctionCatalog catalog;
    private final ScoringWeights weights;
    private final OptimizationAdvisor advisor;

    public ComplexityScorer() {
        this(FunctionCatalog.defaults());
    }

    public ComplexityScorer(FunctionCatalog catalog) {
        this(catalog, ScoringWeights.DEFAULT);
    }

    public ComplexityScorer(FunctionCatalog catalog, ScoringWeights weights) {
        this(catalog, weights, new OptimizationAdvisor());
    }

    public ComplexityScorer(FunctionCatalog catalog, ScoringWeights weights, OptimizationAdvisor advisor) {
        this.catalog = catalog;
        this.weights = weights;
        this.advisor = advisor;
    }

    public ComplexityAnalysis score(ParsedFormula formula) {
        return score(formula, 0, 1.0);
    }

    /**
     * Score a parsed formula in its dependency context.
     *
     * @param dependencyChainLength precedent chain length from the graph;
     *                              negative values count as 0
     * @param executionFrequency    relative recalculation frequency; negative or
     *                              NaN values count as 0
     */
    public ComplexityAnalysis score(ParsedFormula formula, int dependencyChainLength, double executionFrequency) {
        int chainLength = Math.max(0, dependencyChainLength);
        double frequency = executionFrequency >= 0 ? executionFrequency : 0.0;

        ComplexityFactors factors = calculateFactors(formula, chainLength);
        double multiplier = performanceMultiplier(formula, frequency);
        double finalScore = Math.min(100.0, weights.weightedTotal(factors) * multiplier);

        return new ComplexityAnalysis(
                finalScore,
                ComplexityLevel.fromScore(finalScore),
                factors,
                multiplier,
                predictPerformance(finalScore, formula),
                assessMaintenanceRisk(finalScore, factors),
                advisor.suggest(formula, factors));
    }

    /**
     * Spread of a list of scores over the four bands plus summary statistics.
     * Scores are clamped to [0, 100] (NaN and null count as 0).
     */
    public ComplexityDistribution workbookDistribution(List<Double> scores) {
        if (scores == null || scores.isEmpty()) {
            return ComplexityDistribution.empty();
        }

        int simple = 0;
        int moderate = 0;
        int complex = 0;
        int critical = 0;
        double sum = 0;
        double max = Double.NEGATIVE_INFINITY;
        double min = Double.POSITIVE_INFINITY;
        double[] values = new double[scores.size()];

        for (int i = 0; i < values.length; i++) {
            double value = clampScore(scores.get(i));
            values[i] = value;
            switch (ComplexityLevel.fromScore(value)) {
                case SIMPLE -> simple++;
                case MODERATE -> moderate++;
                case COMPLEX -> complex++;
                case CRITICAL -> critical++;
            }
            sum += value;
            max = Math.max(max, value);
            min = Math.min(min, value);
        }

        double average = sum / values.length;
        double squared = 0;
        for (double value : values) {
            squared += (value - average) * (value - average);
        }

        return new ComplexityDistribution(
                simple, moderate, complex, critical, values.length,
                average, max, min, squared / values.length);
    }

    // === Factors ===

    private ComplexityFactors calculateFactors(ParsedFormula formula, int chainLength) {
        double length = Math.min(100.0, formula.originalFormula().length() / LENGTH_FOR_MAX * 100);
        double nesting = Math.min(100.0, formula.maxNestingLevel() / NESTING_FOR_MAX * 100);
        double functions = functionComplexity(formula.functions());
        double dependency = Math.min(100.0, chainLength / CHAIN_FOR_MAX * 100);
        double references = referenceComplexity(formula);
        double special = specialFeatures(formula);

        return new ComplexityFactors(length, nesting, functions, dependency, references, special);
    }

    private double functionComplexity(List<FunctionCall> functions) {
        if (functions.isEmpty())
            return 0.0;

        double total = 0.0;
        for (FunctionCall function : functions) {
            double base = function.complexityWeight() * 20;
            double categoryMultiplier = catalog.categoryOf(function.name()).multiplier();
            double nestingPenalty = function.nestingLevel() * 5;
            double parameterCost = Math.min(function.parameterCount() * 2, 20);

            total += base * categoryMultiplier + nestingPenalty + parameterCost;
        }
        return Math.min(100.0, total / functions.size());
    }

    private double referenceComplexity(ParsedFormula formula) {
        double score = formula.cellReferences().size() * 2
                + formula.ranges().size() * 5
                + formula.externalReferences().size() * 15;

        for (CellReference ref : formula.cellReferences()) {
            if (ref.isExternal()) {
                score += 10;
            } else if (ref.isSheetQualified()) {
                score += 3;
            } else {
                score += 1;
            }
        }
        return Math.min(100.0, score);
    }

    private double specialFeatures(ParsedFormula formula) {
        double score = 0.0;
        if (formula.isArrayFormula())
            score += 25.0;
        if (formula.isTableFormula())
            score += 15.0;
        if (formula.isVolatile())
            score += 20.0;
        return Math.min(100.0, score);
    }

    private double performanceMultiplier(ParsedFormula formula, double executionFrequency) {
        double multiplier = 1.0;
        if (formula.isVolatile())
            multiplier += 0.3;
        if (formula.isArrayFormula())
            multiplier += 0.2;
        if (!formula.externalReferences().isEmpty())
            multiplier += 0.4;

        return multiplier * Math.min(2.0, 1.0 + executionFrequency / 100.0);
    }

    // === Narrative ===

    private String predictPerformance(double score, ParsedFormula formula) {
        return switch (ComplexityLevel.fromScore(score)) {
            case SIMPLE -> "Minimal performance impact. Fast execution expected.";
            case MODERATE -> "Low performance impact. Acceptable execution time.";
            case COMPLEX -> "Moderate performance impact. May slow calculations.";
            case CRITICAL -> formula.isVolatile()
                    ? "High performance impact. Volatile functions cause frequent recalculation."
                    : "High performance impact. Complex calculations may cause delays.";
        };
    }

    private String assessMaintenanceRisk(double score, ComplexityFactors factors) {
        List<String> concerns = new ArrayList<>();
        if (factors.nestingDepth() > 60)
            concerns.add("deep nesting");
        if (factors.functionComplexity() > 70)
            concerns.add("complex functions");
        if (factors.dependencyComplexity() > 50)
            concerns.add("long dependency chains");

        String base = switch (ComplexityLevel.fromScore(score)) {
            case SIMPLE -> "Low maintenance risk. Easy to understand and modify.";
            case MODERATE -> "Moderate maintenance risk.";
            case COMPLEX -> "High maintenance risk.";
            case CRITICAL -> "Critical maintenance risk.";
        };

        if (concerns.isEmpty())
            return base;
        return base + " Key concerns: " + String.join(", ", concerns) + ".";
    }

    private static double clampScore(Double score) {
        if (score == null || score.isNaN())
            return 0.0;
        return Math.max(0.0, Math.min(100.0, score));
    }
}
