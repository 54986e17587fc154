package com.repo.formulas.core;

import com.repo.formulas.graph.ImpactThresholds;
import com.repo.formulas.scoring.ScoringWeights;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class AnalyzerConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void testDefaults() {
        AnalyzerConfig config = AnalyzerConfig.defaults();
        assertEquals(50, config.getMaxDependencyDepth());
        assertEquals(50_000, config.getMaxFormulasAnalyze());
        assertEquals(1.0, config.getExecutionFrequency());
        assertEquals(ScoringWeights.DEFAULT, config.scoringWeights());
        assertEquals(ImpactThresholds.DEFAULT, config.impactThresholds());
    }

    @Test
    void testMissingFileYieldsDefaults() {
        AnalyzerConfig config = AnalyzerConfig.load(tempDir);
        assertEquals(50, config.getMaxDependencyDepth());
        assertEquals(ScoringWeights.DEFAULT, config.scoringWeights());
    }

    @Test
    void testYamlLoading() throws IOException {
        Path yamlFile = tempDir.resolve("formula-analysis.yaml");
        String yamlContent = """
                limits:
                  max_dependency_depth: 25
                  max_formulas_analyze: 1000
                scoring:
                  execution_frequency: 10.0
                weights:
                  nesting: 0.5
                  functions: 0.1
                thresholds:
                  impact:
                    medium: 2
                    high: 10
                    critical: 40
                """;
        Files.writeString(yamlFile, yamlContent);

        AnalyzerConfig config = AnalyzerConfig.load(tempDir);

        assertEquals(25, config.getMaxDependencyDepth(), "Should override default depth");
        assertEquals(1000, config.getMaxFormulasAnalyze());
        assertEquals(10.0, config.getExecutionFrequency());
        assertEquals(new ScoringWeights(0.15, 0.5, 0.1, 0.15, 0.10, 0.05), config.scoringWeights(),
                "Unlisted weights keep their defaults");
        assertEquals(new ImpactThresholds(2, 10, 40), config.impactThresholds());
    }

    @Test
    void testInvalidValuesAreIgnored() throws IOException {
        Files.writeString(tempDir.resolve("formula-analysis.yaml"), """
                limits:
                  max_dependency_depth: -3
                  max_formulas_analyze: "many"
                weights:
                  length: -1.0
                thresholds:
                  impact:
                    medium: 50
                    high: 10
                    critical: 40
                """);

        AnalyzerConfig config = AnalyzerConfig.load(tempDir);

        assertEquals(50, config.getMaxDependencyDepth());
        assertEquals(50_000, config.getMaxFormulasAnalyze());
        assertEquals(0.15, config.scoringWeights().length());
        assertEquals(ImpactThresholds.DEFAULT, config.impactThresholds(), "Non-ascending thresholds are rejected");
    }

    @Test
    void testOutOfRangeIntegersAreIgnored() throws IOException {
        Files.writeString(tempDir.resolve("formula-analysis.yaml"), """
                limits:
                  max_dependency_depth: 4294967297
                  max_formulas_analyze: 99999999999999999999
                """);

        AnalyzerConfig config = AnalyzerConfig.load(tempDir);

        assertEquals(50, config.getMaxDependencyDepth());
        assertEquals(50_000, config.getMaxFormulasAnalyze());
    }

    @Test
    void testMalformedYamlFallsBackToDefaults() throws IOException {
        Files.writeString(tempDir.resolve("formula-analysis.yaml"), "limits: [unclosed\n  - : :");

        AnalyzerConfig config = AnalyzerConfig.load(tempDir);

        assertEquals(50, config.getMaxDependencyDepth());
    }
}
