package com.repo.formulas.graph;

import com.repo.formulas.parser.CellAddress;

import java.util.List;

/**
 * Downstream reach of a change to one cell.
 */
public record ImpactAnalysis(
        CellAddress modifiedCell,

        /** Dependents one hop away */
        List<CellAddress> directlyAffected,

        /** Dependents two or more hops away, within the depth limit */
        List<CellAddress> indirectlyAffected,

        int totalAffectedCount,
        ImpactLevel impactLevel,

        /** Sum of the complexity scores of the affected formulas */
        double affectedComplexity,

        List<String> riskFactors,
        List<String> recommendations) {

    public ImpactAnalysis {
        directlyAffected = List.copyOf(directlyAffected);
        indirectlyAffected = List.copyOf(indirectlyAffected);
        riskFactors = List.copyOf(riskFactors);
        recommendations = List.copyOf(recommendations);
    }
}
