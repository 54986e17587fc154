package com.repo.formulas.core;

import com.repo.formulas.graph.CircularReference;
import com.repo.formulas.graph.DependencyMetrics;
import com.repo.formulas.scoring.ComplexityAnalysis;
import com.repo.formulas.scoring.ComplexityDistribution;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything the workbook pass produces, ready for a report.
 */
public record WorkbookAnalysisResult(
        /** Formula cells consumed, up to the configured cap */
        int totalFormulas,

        /** Formula cells accepted into the dependency graph */
        int analyzedFormulas,

        int volatileFormulaCount,
        int arrayFormulaCount,

        /** Full cell address to its scored analysis, in input order */
        Map<String, ComplexityAnalysis> formulaAnalyses,

        List<CircularReference> circularReferences,
        DependencyMetrics dependencyMetrics,
        ComplexityDistribution complexityDistribution,

        /** Distinct external workbook names, in order of first use */
        List<String> externalWorkbooks,

        List<FormulaIssue> issues,

        /** True when the formula cap stopped the pass early */
        boolean truncated,

        /** Overall workbook complexity in [0, 1] */
        double overallComplexity) {

    public WorkbookAnalysisResult {
        formulaAnalyses = Collections.unmodifiableMap(new LinkedHashMap<>(formulaAnalyses));
        circularReferences = List.copyOf(circularReferences);
        externalWorkbooks = List.copyOf(externalWorkbooks);
        issues = List.copyOf(issues);
    }

    public boolean hasCircularReferences() {
        return !circularReferences.isEmpty();
    }
}
