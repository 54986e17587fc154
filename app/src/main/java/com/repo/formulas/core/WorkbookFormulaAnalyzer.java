package com.repo.formulas.core;

import com.repo.formulas.graph.CircularReference;
import com.repo.formulas.graph.DependencyMetrics;
import com.repo.formulas.graph.FormulaDependencyAnalyzer;
import com.repo.formulas.parser.CellAddress;
import com.repo.formulas.parser.FormulaParser;
import com.repo.formulas.parser.FunctionCatalog;
import com.repo.formulas.parser.ParsedFormula;
import com.repo.formulas.scoring.ComplexityAnalysis;
import com.repo.formulas.scoring.ComplexityDistribution;
import com.repo.formulas.scoring.ComplexityScorer;

import java.util.*;

/**
 * Runs the whole formula pipeline over the formula cells of one workbook:
 * parse, build the dependency graph, detect circular references and score
 * every formula with its chain length.
 *
 * <p>
 * Each call to {@link #analyze(Iterable)} starts from an empty graph.
 */
public class WorkbookFormulaAnalyzer {

    private final AnalyzerConfig config;
    private final FormulaParser parser;
    private final ComplexityScorer scorer;

    public WorkbookFormulaAnalyzer() {
        this(AnalyzerConfig.defaults());
    }

    public WorkbookFormulaAnalyzer(AnalyzerConfig config) {
        this.config = config;
        FunctionCatalog catalog = FunctionCatalog.defaults();
        this.scorer = new ComplexityScorer(catalog, config.scoringWeights());
        this.parser = new FormulaParser(catalog, scorer);
    }

    public WorkbookAnalysisResult analyze(Iterable<FormulaCell> cells) {
        FormulaDependencyAnalyzer analyzer = new FormulaDependencyAnalyzer(
                parser, scorer, config.getMaxDependencyDepth(), config.impactThresholds());
        int limit = config.getMaxFormulasAnalyze();

        int processed = 0;
        int volatileCount = 0;
        int arrayCount = 0;
        boolean truncated = false;
        List<CellAddress> accepted = new ArrayList<>();
        Set<String> externalWorkbooks = new LinkedHashSet<>();
        List<FormulaIssue> issues = new ArrayList<>();

        for (FormulaCell cell : cells) {
            if (processed >= limit) {
                System.err.println("Warning: Formula analysis limit reached: " + limit);
                truncated = true;
                break;
            }
            processed++;

            String address = cell.fullAddress();
            if (!analyzer.addFormula(address, cell.formula())) {
                issues.add(FormulaIssue.of(address, cell.formula(),
                        "Formula could not be added to the dependency graph"));
                continue;
            }

            CellAddress owner = CellAddress.parse(address);
            accepted.add(owner);
            ParsedFormula parsed = analyzer.parsedFormula(owner).orElseThrow();

            externalWorkbooks.addAll(parsed.externalReferences());
            if (parsed.isVolatile())
                volatileCount++;
            if (parsed.isArrayFormula())
                arrayCount++;
            for (String error : parsed.parsingErrors()) {
                issues.add(FormulaIssue.of(address, cell.formula(), error));
            }
        }

        System.out.println("Analyzed " + accepted.size() + " of " + processed + " formulas.");

        Map<String, ComplexityAnalysis> analyses = new LinkedHashMap<>();
        List<Double> scores = new ArrayList<>();
        for (CellAddress owner : accepted) {
            analyzer.analyzeFormula(owner, config.getExecutionFrequency()).ifPresent(analysis -> {
                if (analyses.put(owner.toString(), analysis) == null) {
                    scores.add(analysis.complexityScore());
                }
            });
        }

        List<CircularReference> circular = analyzer.findCircularReferences();
        if (!circular.isEmpty()) {
            System.out.println("Found " + circular.size() + " circular references.");
        }
        DependencyMetrics metrics = analyzer.getDependencyMetrics();
        ComplexityDistribution distribution = scorer.workbookDistribution(scores);

        return new WorkbookAnalysisResult(
                processed,
                accepted.size(),
                volatileCount,
                arrayCount,
                analyses,
                circular,
                metrics,
                distribution,
                new ArrayList<>(externalWorkbooks),
                issues,
                truncated,
                overallComplexity(processed, issues.size(), volatileCount, arrayCount, metrics));
    }

    /**
     * Workbook complexity in [0, 1] from formula volume, special formula
     * ratios and dependency structure, discounted by the share of problem
     * formulas.
     */
    static double overallComplexity(int totalFormulas, int errorCount, int volatileCount, int arrayCount,
            DependencyMetrics metrics) {
        if (totalFormulas == 0)
            return 0.0;

        double n = totalFormulas;
        double base = Math.min(1.0, n / 1000.0);
        double volatileFactor = volatileCount / n * 0.2;
        double arrayFactor = arrayCount / n * 0.3;
        double circularFactor = metrics.circularReferenceCount() / n * 0.3;
        double externalFactor = metrics.externalDependencyCount() / n * 0.2;
        double chainFactor = Math.min(1.0, metrics.avgChainLength() / 10.0) * 0.2;

        double score = base + volatileFactor + arrayFactor + circularFactor + externalFactor + chainFactor;
        double errorRatio = Math.min(1.0, errorCount / n);
        score *= 1.0 - errorRatio * 0.5;
        return Math.min(1.0, Math.max(0.0, score));
    }

    public AnalyzerConfig config() {
        return config;
    }
}
