package com.repo.formulas.core;

import com.repo.formulas.graph.ImpactThresholds;
import com.repo.formulas.scoring.ScoringWeights;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Configuration for formula analysis.
 * Loaded from formula-analysis.yaml in a directory or uses sensible defaults.
 */
public class AnalyzerConfig {

    public static final String FILE_NAME = "formula-analysis.yaml";

    // Limits
    private int maxDependencyDepth = 50;
    private int maxFormulasAnalyze = 50_000;

    // Scoring
    private double executionFrequency = 1.0;

    // Factor weights
    private double weightLength = 0.15;
    private double weightNesting = 0.25;
    private double weightFunctions = 0.30;
    private double weightDependencies = 0.15;
    private double weightReferences = 0.10;
    private double weightSpecialFeatures = 0.05;

    // Impact thresholds (affected cell counts)
    private int impactMedium = 5;
    private int impactHigh = 20;
    private int impactCritical = 100;

    /**
     * Load configuration from YAML file or return defaults.
     */
    public static AnalyzerConfig load(Path directory) {
        AnalyzerConfig config = new AnalyzerConfig();
        Path configFile = directory.resolve(FILE_NAME);

        if (Files.exists(configFile)) {
            try (InputStream is = Files.newInputStream(configFile)) {
                Yaml yaml = new Yaml();
                Map<String, Object> data = yaml.load(is);
                if (data != null) {
                    config.parseYaml(data);
                }
                System.out.println("Loaded configuration from: " + configFile);
            } catch (IOException | YAMLException | ClassCastException e) {
                System.err.println("Warning: Could not read config file, using defaults: " + e.getMessage());
                return new AnalyzerConfig();
            }
        }
        return config;
    }

    /**
     * Default configuration.
     */
    public static AnalyzerConfig defaults() {
        return new AnalyzerConfig();
    }

    @SuppressWarnings("unchecked")
    private void parseYaml(Map<String, Object> data) {
        if (data.get("limits") instanceof Map<?, ?> raw) {
            Map<String, Object> limits = (Map<String, Object>) raw;
            maxDependencyDepth = getPositiveInt(limits, "max_dependency_depth", maxDependencyDepth);
            maxFormulasAnalyze = getPositiveInt(limits, "max_formulas_analyze", maxFormulasAnalyze);
        }

        if (data.get("scoring") instanceof Map<?, ?> raw) {
            Map<String, Object> scoring = (Map<String, Object>) raw;
            executionFrequency = getNonNegativeDouble(scoring, "execution_frequency", executionFrequency);
        }

        if (data.get("weights") instanceof Map<?, ?> raw) {
            Map<String, Object> weights = (Map<String, Object>) raw;
            weightLength = getNonNegativeDouble(weights, "length", weightLength);
            weightNesting = getNonNegativeDouble(weights, "nesting", weightNesting);
            weightFunctions = getNonNegativeDouble(weights, "functions", weightFunctions);
            weightDependencies = getNonNegativeDouble(weights, "dependencies", weightDependencies);
            weightReferences = getNonNegativeDouble(weights, "references", weightReferences);
            weightSpecialFeatures = getNonNegativeDouble(weights, "special_features", weightSpecialFeatures);
        }

        if (data.get("thresholds") instanceof Map<?, ?> raw) {
            Map<String, Object> thresholds = (Map<String, Object>) raw;
            if (thresholds.get("impact") instanceof Map<?, ?> impactRaw) {
                Map<String, Object> impact = (Map<String, Object>) impactRaw;
                int medium = getPositiveInt(impact, "medium", impactMedium);
                int high = getPositiveInt(impact, "high", impactHigh);
                int critical = getPositiveInt(impact, "critical", impactCritical);
                if (medium <= high && high <= critical) {
                    impactMedium = medium;
                    impactHigh = high;
                    impactCritical = critical;
                } else {
                    System.err.println("Warning: Impact thresholds must be ascending, keeping defaults");
                }
            }
        }
    }

    private int getPositiveInt(Map<String, Object> map, String key, int defaultVal) {
        Object val = map.get(key);
        if (val instanceof Number) {
            long value = ((Number) val).longValue();
            if (value > 0 && value <= Integer.MAX_VALUE && ((Number) val).doubleValue() == value)
                return (int) value;
        }
        return defaultVal;
    }

    private double getNonNegativeDouble(Map<String, Object> map, String key, double defaultVal) {
        Object val = map.get(key);
        if (val instanceof Number && ((Number) val).doubleValue() >= 0)
            return ((Number) val).doubleValue();
        return defaultVal;
    }

    // === Getters ===

    public int getMaxDependencyDepth() {
        return maxDependencyDepth;
    }

    public int getMaxFormulasAnalyze() {
        return maxFormulasAnalyze;
    }

    public double getExecutionFrequency() {
        return executionFrequency;
    }

    public ScoringWeights scoringWeights() {
        return new ScoringWeights(weightLength, weightNesting, weightFunctions,
                weightDependencies, weightReferences, weightSpecialFeatures);
    }

    public ImpactThresholds impactThresholds() {
        return new ImpactThresholds(impactMedium, impactHigh, impactCritical);
    }

    public AnalyzerConfig withMaxDependencyDepth(int depth) {
        if (depth > 0) {
            this.maxDependencyDepth = depth;
        }
        return this;
    }

    public AnalyzerConfig withMaxFormulasAnalyze(int limit) {
        if (limit > 0) {
            this.maxFormulasAnalyze = limit;
        }
        return this;
    }
}
