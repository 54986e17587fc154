package com.repo.formulas.graph;

import com.repo.formulas.parser.CellAddress;

/**
 * Precedent to dependent edge: {@code target}'s formula references {@code source}.
 */
public record DependencyEdge(
        CellAddress source,
        CellAddress target,
        DependencyType dependencyType,
        double weight,

        /** First 50 characters of the dependent formula */
        String formulaSnippet) {
}
