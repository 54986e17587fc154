package com.repo.formulas.graph;

import com.repo.formulas.parser.CellAddress;

import java.util.List;

/**
 * One detected cycle. The chain is closed: it starts and ends with the same
 * address, so {@code chainLength == chain.size() - 1} edges.
 */
public record CircularReference(
        List<CellAddress> chain,
        int chainLength,
        double complexityScore,
        ImpactLevel impactLevel,
        String description) {

    public CircularReference {
        chain = List.copyOf(chain);
    }

    /** Distinct cells taking part in the cycle */
    public List<CellAddress> cells() {
        return chain.subList(0, chainLength);
    }
}
