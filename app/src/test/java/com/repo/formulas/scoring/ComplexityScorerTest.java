package com.repo.formulas.scoring;

import com.repo.formulas.parser.ComplexityLevel;
import com.repo.formulas.parser.FormulaParser;
import com.repo.formulas.parser.FunctionCatalog;
import com.repo.formulas.parser.ParsedFormula;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ComplexityScorerTest {

    private final FormulaParser parser = new FormulaParser();
    private final ComplexityScorer scorer = new ComplexityScorer();

    private ComplexityAnalysis score(String formula) {
        return scorer.score(parser.parseFormula(formula, "Sheet1"));
    }

    @Test
    void testNestedLookupDoesNotLowerScore() {
        ComplexityAnalysis plain = score("=IF(A1>0,B1,0)");
        ComplexityAnalysis withLookup = score("=IF(A1>0,VLOOKUP(B1,C1:D10,2,FALSE),0)");

        assertTrue(withLookup.complexityScore() >= plain.complexityScore(),
                "Nested VLOOKUP should not decrease the score");
        assertTrue(withLookup.factors().functionComplexity() > plain.factors().functionComplexity());
    }

    @Test
    void testScoreIsClampedAndLevelMatches() {
        StringBuilder deep = new StringBuilder("=");
        for (int i = 0; i < 15; i++) {
            deep.append("IF(INDIRECT(A").append(i + 1).append("),");
        }
        deep.append("[Other.xlsx]Data!A1");
        deep.append(",0)".repeat(15));

        ComplexityAnalysis analysis = scorer.score(parser.parseFormula(deep.toString()), 40, 500.0);

        assertTrue(analysis.complexityScore() <= 100.0);
        assertEquals(ComplexityLevel.fromScore(analysis.complexityScore()), analysis.complexityLevel());
        assertEquals(100.0, analysis.factors().nestingDepth());
        assertEquals(100.0, analysis.factors().dependencyComplexity());
        assertEquals(ComplexityLevel.CRITICAL, analysis.complexityLevel());
        assertEquals("High performance impact. Volatile functions cause frequent recalculation.",
                analysis.performancePrediction());
        assertTrue(analysis.maintenanceRisk().startsWith("Critical maintenance risk."));
        assertTrue(analysis.maintenanceRisk().contains("deep nesting"));
    }

    @Test
    void testPerformanceMultiplier() {
        assertEquals(1.0 * 1.01, score("=A1+B1").performanceMultiplier(), 1e-9);
        assertEquals(1.3 * 1.01, score("=NOW()").performanceMultiplier(), 1e-9);
        assertEquals(1.4 * 1.01, score("=[Book.xlsx]Sheet1!A1").performanceMultiplier(), 1e-9);

        ParsedFormula parsed = parser.parseFormula("=A1");
        assertEquals(2.0, scorer.score(parsed, 0, 1000.0).performanceMultiplier(), 1e-9);
        assertEquals(1.0, scorer.score(parsed, 0, -5.0).performanceMultiplier(), 1e-9);
    }

    @Test
    void testNegativeChainLengthCountsAsZero() {
        ParsedFormula parsed = parser.parseFormula("=A1+1");
        assertEquals(scorer.score(parsed, 0, 1.0), scorer.score(parsed, -3, 1.0));
    }

    @Test
    void testDependencyChainRaisesScore() {
        ParsedFormula parsed = parser.parseFormula("=SUM(A1:A10)*2");

        ComplexityAnalysis isolated = scorer.score(parsed, 0, 1.0);
        ComplexityAnalysis chained = scorer.score(parsed, 10, 1.0);

        assertEquals(50.0, chained.factors().dependencyComplexity(), 1e-9);
        assertTrue(chained.complexityScore() > isolated.complexityScore());
    }

    @Test
    void testSimpleFormulaNarrative() {
        ComplexityAnalysis analysis = score("=A1+1");

        assertEquals(ComplexityLevel.SIMPLE, analysis.complexityLevel());
        assertEquals("Minimal performance impact. Fast execution expected.", analysis.performancePrediction());
        assertEquals("Low maintenance risk. Easy to understand and modify.", analysis.maintenanceRisk());
        assertTrue(analysis.optimizationSuggestions().isEmpty());
    }

    @Test
    void testSuggestions() {
        List<String> volatileAndExternal = score("=NOW()+[Book.xlsx]Sheet1!A1").optimizationSuggestions();
        assertEquals(List.of(
                "Minimize external references for better performance",
                "Reduce volatile functions usage or calculate values manually"), volatileAndExternal);

        List<String> manyRanges = score("=SUM(A1:A2,B1:B2,C1:C2,D1:D2)").optimizationSuggestions();
        assertTrue(manyRanges.contains("Consolidate multiple ranges into named ranges for clarity"));
    }

    @Test
    void testCustomAdvisorRules() {
        OptimizationAdvisor advisor = new OptimizationAdvisor(List.of(
                new OptimizationAdvisor.SuggestionRule("ALWAYS", ctx -> true, "Always")));
        ComplexityScorer custom = new ComplexityScorer(FunctionCatalog.defaults(), ScoringWeights.DEFAULT, advisor);

        assertEquals(List.of("Always"), custom.score(parser.parseFormula("=A1")).optimizationSuggestions());
    }

    @Test
    void testWeightsChangeScore() {
        ParsedFormula parsed = parser.parseFormula("=IF(A1>0,SUM(B1:B9),0)");
        ScoringWeights functionsOnly = new ScoringWeights(0, 0, 1.0, 0, 0, 0);
        ComplexityScorer custom = new ComplexityScorer(FunctionCatalog.defaults(), functionsOnly);

        ComplexityAnalysis analysis = custom.score(parsed);
        assertEquals(analysis.factors().functionComplexity() * analysis.performanceMultiplier(),
                analysis.complexityScore(), 1e-9);
        assertThrows(IllegalArgumentException.class, () -> new ScoringWeights(-0.1, 0, 0, 0, 0, 0));
    }

    @Test
    void testDistributionPartitionsScores() {
        ComplexityDistribution dist = scorer.workbookDistribution(
                Arrays.asList(10.0, 25.0, 30.0, 60.0, 80.0, 150.0, -4.0, Double.NaN, null));

        assertEquals(9, dist.totalFormulas());
        assertEquals(dist.totalFormulas(),
                dist.simpleCount() + dist.moderateCount() + dist.complexCount() + dist.criticalCount());
        assertEquals(5, dist.simpleCount());
        assertEquals(1, dist.moderateCount());
        assertEquals(1, dist.complexCount());
        assertEquals(2, dist.criticalCount());
        assertEquals(100.0, dist.maxScore());
        assertEquals(0.0, dist.minScore());
    }

    @Test
    void testDistributionStatistics() {
        ComplexityDistribution dist = scorer.workbookDistribution(List.of(20.0, 40.0));

        assertEquals(30.0, dist.averageScore(), 1e-9);
        assertEquals(100.0, dist.variance(), 1e-9);
    }

    @Test
    void testEmptyDistribution() {
        assertEquals(ComplexityDistribution.empty(), scorer.workbookDistribution(new ArrayList<>()));
        assertEquals(ComplexityDistribution.empty(), scorer.workbookDistribution(null));
    }
}
