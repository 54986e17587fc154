package com.repo.formulas.graph;

import com.repo.formulas.parser.CellAddress;
import com.repo.formulas.parser.ComplexityLevel;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DependencyGraphTest {

    private static DependencyEdge edge(String source, String target) {
        return new DependencyEdge(CellAddress.parse(source), CellAddress.parse(target),
                DependencyType.DIRECT, 1.0, "=" + source);
    }

    @Test
    void testAddEdgeRegistersBothEnds() {
        DependencyGraph graph = new DependencyGraph();
        assertTrue(graph.addEdge(edge("S!A1", "S!B1")));

        assertTrue(graph.hasNode(CellAddress.parse("S!A1")));
        assertTrue(graph.hasNode(CellAddress.parse("S!B1")));
        assertEquals(List.of(CellAddress.parse("S!B1")), graph.successors(CellAddress.parse("S!A1")));
        assertEquals(List.of(CellAddress.parse("S!A1")), graph.predecessors(CellAddress.parse("S!B1")));
        assertEquals(1, graph.edgeCount());
    }

    @Test
    void testDuplicateEdgeIsIgnored() {
        DependencyGraph graph = new DependencyGraph();
        assertTrue(graph.addEdge(edge("S!A1", "S!B1")));
        assertFalse(graph.addEdge(edge("S!$A$1", "S!B1")));

        assertEquals(1, graph.edgeCount());
        assertEquals(1, graph.outgoingEdges(CellAddress.parse("S!A1")).size());
    }

    @Test
    void testPrecedentRegistrationKeepsFormulaMetadata() {
        DependencyGraph graph = new DependencyGraph();
        CellAddress cell = CellAddress.parse("S!A1");
        NodeMetadata meta = new NodeMetadata("=1+1", 3.0, ComplexityLevel.SIMPLE, false, List.of());

        graph.addNode(cell, meta);
        graph.addNode(cell);

        assertEquals(meta, graph.getNode(cell).orElseThrow());
        assertEquals(List.of(cell), graph.formulaNodes());
    }

    @Test
    void testInterningSharesInstances() {
        DependencyGraph graph = new DependencyGraph();
        CellAddress first = graph.intern(CellAddress.parse("S!A1"));
        CellAddress second = graph.intern(CellAddress.parse("S!A1"));

        assertSame(first, second);
        assertSame(first, graph.canonical(CellAddress.parse("S!A1")));
    }

    @Test
    void testCanonicalDoesNotAddNodes() {
        DependencyGraph graph = new DependencyGraph();
        graph.canonical(CellAddress.parse("S!Z9"));

        assertEquals(0, graph.nodeCount());
        assertTrue(graph.getNode(CellAddress.parse("S!Z9")).isEmpty());
        assertTrue(graph.successors(CellAddress.parse("S!Z9")).isEmpty());
    }
}
