package com.repo.formulas.graph;

import com.repo.formulas.parser.ComplexityLevel;
import com.repo.formulas.parser.ParsedFormula;

import java.util.List;

/**
 * What the graph knows about a cell. Cells that are only ever referenced carry
 * no formula.
 */
public record NodeMetadata(
        String formula,
        double complexityScore,
        ComplexityLevel complexityLevel,
        boolean isVolatile,
        List<String> parsingErrors) {

    private static final NodeMetadata PRECEDENT = new NodeMetadata(null, 0.0, ComplexityLevel.SIMPLE, false, List.of());

    public NodeMetadata {
        parsingErrors = List.copyOf(parsingErrors);
    }

    public static NodeMetadata precedent() {
        return PRECEDENT;
    }

    public static NodeMetadata of(ParsedFormula parsed) {
        return new NodeMetadata(
                parsed.originalFormula(),
                parsed.complexityScore(),
                parsed.complexityLevel(),
                parsed.isVolatile(),
                parsed.parsingErrors());
    }

    public boolean hasFormula() {
        return formula != null;
    }
}
