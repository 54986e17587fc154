package com.repo.formulas.graph;

import com.repo.formulas.parser.CellAddress;

import java.util.*;

/**
 * Directed precedent to dependent graph over cell addresses.
 *
 * <p>
 * Node metadata plus forward and reverse adjacency, all keyed by interned
 * {@link CellAddress} instances. Append-only. Not synchronized: a single
 * thread builds it, after which concurrent reads are safe.
 */
public class DependencyGraph {

    private final Map<String, CellAddress> interned = new HashMap<>();
    private final Map<CellAddress, NodeMetadata> nodes = new LinkedHashMap<>();
    private final Map<CellAddress, Map<CellAddress, DependencyEdge>> outgoing = new HashMap<>();
    private final Map<CellAddress, Map<CellAddress, DependencyEdge>> incoming = new HashMap<>();
    private int edgeCount;

    /**
     * Canonical instance for an address, so repeated edges share one object.
     */
    public CellAddress intern(CellAddress address) {
        return interned.computeIfAbsent(address.toString(), key -> address);
    }

    /**
     * Interned instance if known, otherwise {@code address} itself. Does not
     * modify the graph.
     */
    public CellAddress canonical(CellAddress address) {
        return interned.getOrDefault(address.toString(), address);
    }

    public boolean hasNode(CellAddress address) {
        return nodes.containsKey(address);
    }

    /**
     * Register a referenced cell; existing metadata is kept.
     */
    public CellAddress addNode(CellAddress address) {
        CellAddress node = intern(address);
        nodes.putIfAbsent(node, NodeMetadata.precedent());
        return node;
    }

    /**
     * Insert or replace the metadata of a cell.
     */
    public CellAddress addNode(CellAddress address, NodeMetadata metadata) {
        CellAddress node = intern(address);
        nodes.put(node, metadata);
        return node;
    }

    public Optional<NodeMetadata> getNode(CellAddress address) {
        return Optional.ofNullable(nodes.get(address));
    }

    /**
     * Add an edge, registering both ends. A second edge between the same
     * pair is ignored.
     *
     * @return true if the edge was new
     */
    public boolean addEdge(DependencyEdge edge) {
        CellAddress source = addNode(edge.source());
        CellAddress target = addNode(edge.target());

        Map<CellAddress, DependencyEdge> out = outgoing.computeIfAbsent(source, k -> new LinkedHashMap<>());
        if (out.containsKey(target)) {
            return false;
        }
        DependencyEdge stored = new DependencyEdge(
                source, target, edge.dependencyType(), edge.weight(), edge.formulaSnippet());
        out.put(target, stored);
        incoming.computeIfAbsent(target, k -> new LinkedHashMap<>()).put(source, stored);
        edgeCount++;
        return true;
    }

    public boolean hasEdge(CellAddress source, CellAddress target) {
        return outgoing.getOrDefault(source, Map.of()).containsKey(target);
    }

    /** Dependents of {@code node} */
    public List<CellAddress> successors(CellAddress node) {
        return List.copyOf(outgoing.getOrDefault(node, Map.of()).keySet());
    }

    /** Precedents of {@code node} */
    public List<CellAddress> predecessors(CellAddress node) {
        return List.copyOf(incoming.getOrDefault(node, Map.of()).keySet());
    }

    public Collection<DependencyEdge> outgoingEdges(CellAddress node) {
        return Collections.unmodifiableCollection(outgoing.getOrDefault(node, Map.of()).values());
    }

    public Collection<DependencyEdge> incomingEdges(CellAddress node) {
        return Collections.unmodifiableCollection(incoming.getOrDefault(node, Map.of()).values());
    }

    /** Nodes in insertion order */
    public Set<CellAddress> nodes() {
        return Collections.unmodifiableSet(nodes.keySet());
    }

    public List<CellAddress> formulaNodes() {
        return nodes.entrySet().stream()
                .filter(e -> e.getValue().hasFormula())
                .map(Map.Entry::getKey)
                .toList();
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edgeCount;
    }
}
