package com.repo.formulas.report;

import com.repo.formulas.core.FormulaIssue;
import com.repo.formulas.core.WorkbookAnalysisResult;
import com.repo.formulas.graph.CircularReference;
import com.repo.formulas.graph.DependencyEdge;
import com.repo.formulas.graph.DependencyGraph;
import com.repo.formulas.graph.DependencyMetrics;
import com.repo.formulas.graph.NodeMetadata;
import com.repo.formulas.parser.CellAddress;
import com.repo.formulas.scoring.ComplexityAnalysis;
import com.repo.formulas.scoring.ComplexityDistribution;
import com.repo.formulas.scoring.ComplexityFactors;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Converts formula analysis results to JSON for downstream renderers.
 */
public class JsonDataConverter {

    /**
     * Converts the per-formula analyses to a JSON array.
     */
    public String convertToDataJson(WorkbookAnalysisResult result) {
        return result.formulaAnalyses().entrySet().stream()
                .map(e -> analysisToJson(e.getKey(), e.getValue()))
                .collect(Collectors.joining(", ", "[", "]"));
    }

    /**
     * Converts a workbook result to a self-describing JSON object with metadata
     * and schema, so external tools can read it without documentation.
     */
    public String convertToSelfDescribingJson(WorkbookAnalysisResult result) {
        return String.format(Locale.ROOT,
                "{ \"metadata\": { \"generatedAt\": \"%s\", \"tool\": \"Formula Panopticon 1.0\", \"description\": \"Spreadsheet formula analysis report\" }, "
                        +
                        "\"schema\": { " +
                        "\"score\": \"0-100 formula complexity. >25 moderate, >50 complex, >75 critical.\", "
                        +
                        "\"level\": \"Complexity band of the score: simple, moderate, complex or critical.\", "
                        +
                        "\"multiplier\": \"Performance multiplier applied for volatile functions, array formulas, external references and recalculation frequency.\", "
                        +
                        "\"factors\": \"Per-factor breakdown (0-100 each) of length, nesting, functions, dependencies, references and special features.\", "
                        +
                        "\"circularReferences\": \"Closed cell chains; chainLength counts the distinct cells in the cycle.\", "
                        +
                        "\"overallComplexity\": \"0-1 workbook complexity combining formula volume, volatility, arrays, cycles, external links and chain length.\" "
                        +
                        "}, \"summary\": %s, \"formulas\": %s, \"circularReferences\": %s, \"issues\": %s }",
                java.time.Instant.now().toString(),
                summaryToJson(result),
                convertToDataJson(result),
                circularReferencesToJson(result.circularReferences()),
                issuesToJson(result.issues()));
    }

    /**
     * Converts one scored formula to a JSON object.
     */
    public String analysisToJson(String address, ComplexityAnalysis a) {
        ComplexityFactors f = a.factors();
        return String.format(Locale.ROOT,
                "{ \"address\": \"%s\", \"score\": %.2f, \"level\": \"%s\", \"multiplier\": %.2f, "
                        +
                        "\"factors\": { \"length\": %.2f, \"nesting\": %.2f, \"functions\": %.2f, \"dependencies\": %.2f, "
                        +
                        "\"references\": %.2f, \"specialFeatures\": %.2f }, "
                        +
                        "\"performance\": \"%s\", \"maintenance\": \"%s\", \"suggestions\": %s }",
                escapeJson(address), a.complexityScore(), a.complexityLevel().label(), a.performanceMultiplier(),
                f.formulaLength(), f.nestingDepth(), f.functionComplexity(), f.dependencyComplexity(),
                f.referenceComplexity(), f.specialFeatures(),
                escapeJson(a.performancePrediction()), escapeJson(a.maintenanceRisk()),
                stringArray(a.optimizationSuggestions()));
    }

    /**
     * Converts the dependency graph to node/link JSON for a network view.
     * Cells on a circular reference are flagged.
     */
    public String convertToNetworkJson(DependencyGraph graph, List<CircularReference> cycles) {
        Set<CellAddress> inCycle = new HashSet<>();
        for (CircularReference cycle : cycles) {
            inCycle.addAll(cycle.cells());
        }

        StringBuilder nodes = new StringBuilder("[");
        StringBuilder links = new StringBuilder("[");
        boolean firstNode = true;
        boolean firstLink = true;

        for (CellAddress node : graph.nodes()) {
            NodeMetadata meta = graph.getNode(node).orElse(NodeMetadata.precedent());
            if (!firstNode)
                nodes.append(",");
            firstNode = false;

            nodes.append(String.format(Locale.ROOT,
                    "{\"id\":\"%s\",\"hasFormula\":%b,\"complexity\":%.2f,\"level\":\"%s\",\"volatile\":%b,\"external\":%b,\"inCycle\":%b}",
                    escapeJson(node.toString()), meta.hasFormula(), meta.complexityScore(),
                    meta.complexityLevel().label(), meta.isVolatile(), node.isExternal(),
                    inCycle.contains(node)));

            for (DependencyEdge edge : graph.outgoingEdges(node)) {
                if (!firstLink)
                    links.append(",");
                firstLink = false;

                links.append(String.format(Locale.ROOT,
                        "{\"source\":\"%s\",\"target\":\"%s\",\"type\":\"%s\",\"weight\":%.2f}",
                        escapeJson(edge.source().toString()), escapeJson(edge.target().toString()),
                        edge.dependencyType().name().toLowerCase(Locale.ROOT), edge.weight()));
            }
        }
        nodes.append("]");
        links.append("]");

        return String.format("{\"nodes\":%s,\"links\":%s}", nodes, links);
    }

    private String summaryToJson(WorkbookAnalysisResult r) {
        DependencyMetrics m = r.dependencyMetrics();
        ComplexityDistribution d = r.complexityDistribution();
        return String.format(Locale.ROOT,
                "{ \"totalFormulas\": %d, \"analyzedFormulas\": %d, \"volatileFormulas\": %d, \"arrayFormulas\": %d, "
                        +
                        "\"truncated\": %b, \"overallComplexity\": %.3f, \"externalWorkbooks\": %s, "
                        +
                        "\"dependencies\": { \"total\": %d, \"maxChainLength\": %d, \"avgChainLength\": %.2f, "
                        +
                        "\"circularReferences\": %d, \"externalDependencies\": %d, \"orphanedFormulas\": %d, "
                        +
                        "\"volatility\": %.3f, \"fanOut\": %s }, "
                        +
                        "\"distribution\": { \"simple\": %d, \"moderate\": %d, \"complex\": %d, \"critical\": %d, "
                        +
                        "\"average\": %.2f, \"max\": %.2f, \"min\": %.2f, \"variance\": %.2f } }",
                r.totalFormulas(), r.analyzedFormulas(), r.volatileFormulaCount(), r.arrayFormulaCount(),
                r.truncated(), r.overallComplexity(), stringArray(r.externalWorkbooks()),
                m.totalDependencies(), m.maxChainLength(), m.avgChainLength(),
                m.circularReferenceCount(), m.externalDependencyCount(), m.orphanedFormulaCount(),
                m.volatilityScore(), countsToJson(m.fanOutDistribution(), List.of("0", "1-5", "6-20", "21+")),
                d.simpleCount(), d.moderateCount(), d.complexCount(), d.criticalCount(),
                d.averageScore(), d.maxScore(), d.minScore(), d.variance());
    }

    private String circularReferencesToJson(List<CircularReference> cycles) {
        return cycles.stream()
                .map(c -> String.format(Locale.ROOT,
                        "{ \"chain\": %s, \"chainLength\": %d, \"score\": %.2f, \"impact\": \"%s\", \"description\": \"%s\" }",
                        stringArray(c.chain().stream().map(CellAddress::toString).toList()),
                        c.chainLength(), c.complexityScore(), c.impactLevel().name(), escapeJson(c.description())))
                .collect(Collectors.joining(", ", "[", "]"));
    }

    private String issuesToJson(List<FormulaIssue> issues) {
        return issues.stream()
                .map(i -> String.format("{ \"address\": \"%s\", \"formula\": \"%s\", \"message\": \"%s\" }",
                        escapeJson(i.address()), escapeJson(i.formula()), escapeJson(i.message())))
                .collect(Collectors.joining(", ", "[", "]"));
    }

    // keys in the given order
    private String countsToJson(Map<String, Integer> counts, List<String> keys) {
        return keys.stream()
                .map(k -> "\"" + k + "\": " + counts.getOrDefault(k, 0))
                .collect(Collectors.joining(", ", "{ ", " }"));
    }

    private String stringArray(List<String> values) {
        return values.stream()
                .map(s -> "\"" + escapeJson(s) + "\"")
                .collect(Collectors.joining(", ", "[", "]"));
    }

    private String escapeJson(String s) {
        if (s == null)
            return "";
        return s.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }
}
