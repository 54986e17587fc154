package com.repo.formulas.scoring;

import com.repo.formulas.parser.ParsedFormula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rule-based optimization advice. Unlike a verdict, every rule that matches
 * contributes its suggestion, in rule order.
 */
public class OptimizationAdvisor {

    @FunctionalInterface
    public interface RuleCondition {
        boolean applies(AdviceContext ctx);
    }

    public record SuggestionRule(
            String name,
            RuleCondition condition,
            String suggestion) {
    }

    /**
     * What a rule can look at.
     */
    public record AdviceContext(ParsedFormula formula, ComplexityFactors factors) {

        public boolean hasExternalReferences() {
            return !formula.externalReferences().isEmpty();
        }

        public boolean isVolatile() {
            return formula.isVolatile();
        }

        public int rangeCount() {
            return formula.ranges().size();
        }
    }

    private final List<SuggestionRule> rules;

    public OptimizationAdvisor() {
        this(buildDefaultRules());
    }

    public OptimizationAdvisor(List<SuggestionRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public List<String> suggest(ParsedFormula formula, ComplexityFactors factors) {
        AdviceContext ctx = new AdviceContext(formula, factors);
        List<String> suggestions = new ArrayList<>();
        for (SuggestionRule rule : rules) {
            if (rule.condition().applies(ctx)) {
                suggestions.add(rule.suggestion());
            }
        }
        return suggestions;
    }

    public List<SuggestionRule> getRules() {
        return Collections.unmodifiableList(rules);
    }

    private static List<SuggestionRule> buildDefaultRules() {
        List<SuggestionRule> defaultRules = new ArrayList<>();

        defaultRules.add(new SuggestionRule(
                "DEEP_NESTING",
                ctx -> ctx.factors().nestingDepth() > 60,
                "Break down nested functions into intermediate cells"));

        defaultRules.add(new SuggestionRule(
                "HEAVY_FUNCTIONS",
                ctx -> ctx.factors().functionComplexity() > 70,
                "Consider using helper columns for complex calculations"));

        defaultRules.add(new SuggestionRule(
                "EXTERNAL_REFERENCES",
                AdviceContext::hasExternalReferences,
                "Minimize external references for better performance"));

        defaultRules.add(new SuggestionRule(
                "VOLATILE_FUNCTIONS",
                AdviceContext::isVolatile,
                "Reduce volatile functions usage or calculate values manually"));

        defaultRules.add(new SuggestionRule(
                "LARGE_ARRAY_FORMULA",
                ctx -> ctx.formula().isArrayFormula() && ctx.factors().formulaLength() > 60,
                "Consider breaking array formulas into smaller components"));

        defaultRules.add(new SuggestionRule(
                "MANY_RANGES",
                ctx -> ctx.rangeCount() > 3,
                "Consolidate multiple ranges into named ranges for clarity"));

        return defaultRules;
    }
}
