package com.repo.formulas.parser;

import java.util.List;

/**
 * Structured view of one formula. Immutable once produced by
 * {@link FormulaParser}.
 */
public record ParsedFormula(
        /** Normalized text: leading '=' guaranteed unless wrapped as {=...} */
        String originalFormula,

        /** Sheet that owns the formula; unqualified references resolve here */
        String currentSheet,

        List<CellReference> cellReferences,
        List<FunctionCall> functions,

        /** Distinct range strings such as "A1:B10" */
        List<String> ranges,

        /** Distinct external workbook names, in order of appearance */
        List<String> externalReferences,

        /** Structured references such as "Sales[Amount]" */
        List<String> tableReferences,

        boolean isArrayFormula,
        boolean isTableFormula,
        double complexityScore,
        ComplexityLevel complexityLevel,
        List<String> parsingErrors,

        /** True when parsing aborted on an internal fault; contents are empty */
        boolean failed) {

    public ParsedFormula {
        cellReferences = List.copyOf(cellReferences);
        functions = List.copyOf(functions);
        ranges = List.copyOf(ranges);
        externalReferences = List.copyOf(externalReferences);
        tableReferences = List.copyOf(tableReferences);
        parsingErrors = List.copyOf(parsingErrors);
    }

    static ParsedFormula failed(String formula, String currentSheet, String reason) {
        return new ParsedFormula(
                formula == null ? "" : formula, currentSheet,
                List.of(), List.of(), List.of(), List.of(), List.of(),
                false, false, 0.0, ComplexityLevel.SIMPLE,
                List.of(reason), true);
    }

    ParsedFormula withComplexity(double score) {
        return new ParsedFormula(
                originalFormula, currentSheet, cellReferences, functions, ranges,
                externalReferences, tableReferences, isArrayFormula, isTableFormula,
                score, ComplexityLevel.fromScore(score), parsingErrors, failed);
    }

    public boolean hasErrors() {
        return !parsingErrors.isEmpty();
    }

    public boolean isVolatile() {
        return functions.stream().anyMatch(f -> FunctionCatalog.isVolatile(f.name()));
    }

    public int maxNestingLevel() {
        return functions.stream()
                .mapToInt(FunctionCall::nestingLevel)
                .max()
                .orElse(0);
    }

    /**
     * Reference targets with unqualified references placed on
     * {@link #currentSheet()}.
     */
    public List<CellAddress> resolvedReferences() {
        return cellReferences.stream()
                .map(ref -> ref.resolve(currentSheet))
                .toList();
    }
}
