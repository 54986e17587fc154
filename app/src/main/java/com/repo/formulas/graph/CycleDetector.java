package com.repo.formulas.graph;

import com.repo.formulas.parser.CellAddress;

import java.util.*;

/**
 * Depth-first circular reference search over a {@link DependencyGraph}.
 *
 * <p>
 * Uses an explicit stack so the depth limit holds regardless of the thread's
 * call stack. A branch whose path grows past {@code maxDepth} is abandoned
 * without reporting anything, so an empty result means "no cycle within the
 * explored depth", not a proof of acyclicity.
 */
public class CycleDetector {

    public static final int DEFAULT_MAX_DEPTH = 50;

    private final DependencyGraph graph;
    private final int maxDepth;

    public CycleDetector(DependencyGraph graph) {
        this(graph, DEFAULT_MAX_DEPTH);
    }

    public CycleDetector(DependencyGraph graph, int maxDepth) {
        this.graph = graph;
        this.maxDepth = Math.max(1, maxDepth);
    }

    private static final class Frame {
        final CellAddress node;
        final Iterator<CellAddress> successors;

        Frame(CellAddress node, Iterator<CellAddress> successors) {
            this.node = node;
            this.successors = successors;
        }
    }

    public List<CircularReference> findCircularReferences() {
        List<CircularReference> cycles = new ArrayList<>();
        Set<CellAddress> visited = new HashSet<>();

        for (CellAddress root : graph.nodes()) {
            if (!visited.contains(root)) {
                explore(root, visited, cycles);
            }
        }
        return cycles;
    }

    private void explore(CellAddress root, Set<CellAddress> visited, List<CircularReference> cycles) {
        Deque<Frame> stack = new ArrayDeque<>();
        List<CellAddress> path = new ArrayList<>();
        Map<CellAddress, Integer> pathIndex = new HashMap<>();

        enter(root, stack, path, pathIndex, visited);

        while (!stack.isEmpty()) {
            Frame top = stack.peek();
            if (!top.successors.hasNext()) {
                stack.pop();
                path.remove(path.size() - 1);
                pathIndex.remove(top.node);
                continue;
            }

            CellAddress next = top.successors.next();
            Integer cycleStart = pathIndex.get(next);
            if (cycleStart != null) {
                List<CellAddress> chain = new ArrayList<>(path.subList(cycleStart, path.size()));
                chain.add(next);
                cycles.add(toCircularReference(chain));
                continue;
            }

            // path holds every node before `next`
            if (visited.contains(next) || path.size() > maxDepth) {
                continue;
            }
            enter(next, stack, path, pathIndex, visited);
        }
    }

    private void enter(CellAddress node, Deque<Frame> stack, List<CellAddress> path,
            Map<CellAddress, Integer> pathIndex, Set<CellAddress> visited) {
        visited.add(node);
        pathIndex.put(node, path.size());
        path.add(node);
        stack.push(new Frame(node, graph.successors(node).iterator()));
    }

    private CircularReference toCircularReference(List<CellAddress> chain) {
        int chainLength = chain.size() - 1;
        double complexity = Math.min(100.0, chainLength * 10.0);
        ImpactLevel impact = complexity > 50 ? ImpactLevel.HIGH : ImpactLevel.MEDIUM;
        return new CircularReference(
                chain,
                chainLength,
                complexity,
                impact,
                "Circular reference involving " + chainLength + " cells");
    }
}
