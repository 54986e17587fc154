package com.repo.formulas.graph;

import com.repo.formulas.parser.CellAddress;
import com.repo.formulas.parser.CellReference;
import com.repo.formulas.parser.ComplexityLevel;
import com.repo.formulas.parser.FormulaParser;
import com.repo.formulas.parser.ParsedFormula;
import com.repo.formulas.parser.ReferenceType;
import com.repo.formulas.scoring.ComplexityAnalysis;
import com.repo.formulas.scoring.ComplexityScorer;

import java.util.*;

/**
 * Builds the workbook dependency graph from formulas and answers questions
 * about it: circular references, chain lengths, impact of a change and
 * aggregate metrics.
 *
 * <p>
 * {@link #addFormula(String, String)} must be called from a single thread
 * (or under external locking). Once construction is finished the query
 * methods only read and may run concurrently.
 */
public class FormulaDependencyAnalyzer {

    private static final int SNIPPET_LENGTH = 50;

    private final FormulaParser parser;
    private final ComplexityScorer scorer;
    private final int maxDepth;
    private final ImpactThresholds impactThresholds;

    private final DependencyGraph graph = new DependencyGraph();
    private final Map<CellAddress, ParsedFormula> parsedFormulas = new LinkedHashMap<>();
    private final Map<String, Set<CellAddress>> externalDependencies = new LinkedHashMap<>();

    public FormulaDependencyAnalyzer() {
        this(CycleDetector.DEFAULT_MAX_DEPTH);
    }

    public FormulaDependencyAnalyzer(int maxDepth) {
        this(new FormulaParser(), new ComplexityScorer(), maxDepth, ImpactThresholds.DEFAULT);
    }

    public FormulaDependencyAnalyzer(FormulaParser parser, ComplexityScorer scorer, int maxDepth,
            ImpactThresholds impactThresholds) {
        this.parser = parser;
        this.scorer = scorer;
        this.maxDepth = Math.max(1, maxDepth);
        this.impactThresholds = impactThresholds;
    }

    private record StagedEdge(DependencyEdge edge, String externalWorkbook) {
    }

    /**
     * Parse a formula and wire its references into the graph.
     *
     * <p>
     * All-or-nothing: on any failure the graph is left as it was. A formula
     * with syntax errors is kept as a node without reference edges.
     *
     * @param fullAddress owning cell, e.g. "Sheet1!A1"
     * @param formula     formula text
     * @return false if the address or formula could not be processed
     */
    public boolean addFormula(String fullAddress, String formula) {
        try {
            CellAddress owner = CellAddress.parse(fullAddress);
            if (owner.isExternal()) {
                warn(fullAddress, "external cells cannot own formulas in this workbook");
                return false;
            }

            ParsedFormula parsed = parser.parseFormula(formula, owner.sheet());
            if (parsed.failed()) {
                warn(fullAddress, String.join("; ", parsed.parsingErrors()));
                return false;
            }

            List<StagedEdge> staged = parser.validateFormulaSyntax(parsed.originalFormula()).valid()
                    ? stageEdges(owner, parsed)
                    : List.of();

            commit(owner, parsed, staged);
            return true;
        } catch (RuntimeException e) {
            warn(fullAddress, e.getMessage());
            return false;
        }
    }

    private List<StagedEdge> stageEdges(CellAddress owner, ParsedFormula parsed) {
        List<StagedEdge> staged = new ArrayList<>();
        String snippet = parsed.originalFormula().substring(
                0, Math.min(SNIPPET_LENGTH, parsed.originalFormula().length()));

        for (CellReference ref : parsed.cellReferences()) {
            CellAddress source = ref.resolve(owner.sheet());
            DependencyType type = ref.isExternal() ? DependencyType.EXTERNAL
                    : parsed.isVolatile() ? DependencyType.VOLATILE
                            : DependencyType.DIRECT;

            DependencyEdge edge = new DependencyEdge(source, owner, type, edgeWeight(ref, parsed), snippet);
            staged.add(new StagedEdge(edge, ref.isExternal() ? source.workbook() : null));
        }
        return staged;
    }

    private void commit(CellAddress owner, ParsedFormula parsed, List<StagedEdge> staged) {
        CellAddress node = graph.addNode(owner, NodeMetadata.of(parsed));
        parsedFormulas.put(node, parsed);

        for (StagedEdge s : staged) {
            graph.addEdge(s.edge());
            if (s.externalWorkbook() != null) {
                externalDependencies
                        .computeIfAbsent(s.externalWorkbook(), k -> new LinkedHashSet<>())
                        .add(graph.intern(s.edge().source()));
            }
        }
    }

    private double edgeWeight(CellReference ref, ParsedFormula parsed) {
        double weight = ref.isExternal() ? 2.0 : 1.0;
        if (ref.referenceType() == ReferenceType.ABSOLUTE) {
            weight *= 1.1;
        }
        return weight + parsed.complexityScore() / 100.0;
    }

    // === Queries ===

    public List<CircularReference> findCircularReferences() {
        return findCircularReferences(maxDepth);
    }

    public List<CircularReference> findCircularReferences(int depthLimit) {
        return new CycleDetector(graph, depthLimit).findCircularReferences();
    }

    /**
     * Longest precedent chain (in edges) ending at {@code address}, capped at
     * the depth limit. Edges that would close a cycle are not followed.
     */
    public int chainLength(CellAddress address) {
        CellAddress node = graph.canonical(address);
        if (!graph.hasNode(node)) {
            return 0;
        }
        return precedentDepth(node, new HashMap<>());
    }

    /**
     * Score the stored formula of {@code address} with its chain length.
     */
    public Optional<ComplexityAnalysis> analyzeFormula(CellAddress address, double executionFrequency) {
        ParsedFormula parsed = parsedFormulas.get(graph.canonical(address));
        if (parsed == null) {
            return Optional.empty();
        }
        return Optional.of(scorer.score(parsed, chainLength(address), executionFrequency));
    }

    public Optional<ComplexityAnalysis> analyzeFormula(CellAddress address) {
        return analyzeFormula(address, 1.0);
    }

    public ImpactAnalysis analyzeImpact(CellAddress address) {
        return analyzeImpact(address, maxDepth);
    }

    /**
     * Breadth-first walk over dependents of {@code address}, up to
     * {@code depthLimit} hops.
     */
    public ImpactAnalysis analyzeImpact(CellAddress address, int depthLimit) {
        CellAddress start = graph.canonical(address);
        List<CellAddress> direct = new ArrayList<>();
        List<CellAddress> indirect = new ArrayList<>();
        Set<CellAddress> seen = new HashSet<>();
        seen.add(start);
        boolean circular = false;

        Deque<CellAddress> frontier = new ArrayDeque<>(List.of(start));
        for (int depth = 1; depth <= Math.max(1, depthLimit) && !frontier.isEmpty(); depth++) {
            Deque<CellAddress> nextFrontier = new ArrayDeque<>();
            for (CellAddress current : frontier) {
                for (CellAddress dependent : graph.successors(current)) {
                    if (dependent.equals(start)) {
                        circular = true;
                    }
                    if (seen.add(dependent)) {
                        (depth == 1 ? direct : indirect).add(dependent);
                        nextFrontier.add(dependent);
                    }
                }
            }
            frontier = nextFrontier;
        }

        int total = direct.size() + indirect.size();
        ImpactLevel level = impactThresholds.levelFor(total);
        NodeMetadata source = graph.getNode(start).orElse(NodeMetadata.precedent());

        double affectedComplexity = 0.0;
        int volatileDependents = 0;
        for (CellAddress cell : seen) {
            if (cell.equals(start))
                continue;
            NodeMetadata meta = graph.getNode(cell).orElse(NodeMetadata.precedent());
            affectedComplexity += meta.complexityScore();
            if (meta.isVolatile())
                volatileDependents++;
        }

        List<String> risks = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();
        if (source.isVolatile()) {
            risks.add("Source cell uses volatile functions");
        }
        if (start.isExternal()) {
            risks.add("Source cell lives in external workbook " + start.workbook());
            recommendations.add("Coordinate changes with the owners of " + start.workbook());
        }
        if (circular) {
            risks.add("Source cell is part of a circular reference");
            recommendations.add("Resolve the circular reference before modifying this cell");
        }
        if (volatileDependents > 0) {
            risks.add(volatileDependents + " affected cells use volatile functions");
            recommendations.add("Expect full recalculation of volatile dependents");
        }
        if (level == ImpactLevel.HIGH || level == ImpactLevel.CRITICAL) {
            recommendations.add("Review the " + total + " dependent cells before changing this cell");
        }

        return new ImpactAnalysis(start, direct, indirect, total, level, affectedComplexity, risks,
                recommendations);
    }

    public DependencyMetrics getDependencyMetrics() {
        List<CellAddress> formulaNodes = graph.formulaNodes();
        int totalFormulas = formulaNodes.size();

        Map<String, Integer> complexityDist = new LinkedHashMap<>();
        for (ComplexityLevel level : ComplexityLevel.values()) {
            complexityDist.put(level.label(), 0);
        }
        int volatileCount = 0;
        int orphaned = 0;
        int maxChain = 0;
        long chainSum = 0;
        Map<CellAddress, Integer> memo = new HashMap<>();

        for (CellAddress node : formulaNodes) {
            NodeMetadata meta = graph.getNode(node).orElseThrow();
            complexityDist.merge(meta.complexityLevel().label(), 1, Integer::sum);
            if (meta.isVolatile())
                volatileCount++;
            if (graph.predecessors(node).isEmpty() && graph.successors(node).isEmpty())
                orphaned++;

            int chain = precedentDepth(node, memo);
            maxChain = Math.max(maxChain, chain);
            chainSum += chain;
        }

        Map<String, Integer> fanOutDist = new LinkedHashMap<>();
        fanOutDist.put("0", 0);
        fanOutDist.put("1-5", 0);
        fanOutDist.put("6-20", 0);
        fanOutDist.put("21+", 0);
        int externalCount = 0;

        for (CellAddress node : graph.nodes()) {
            fanOutDist.merge(fanOutBucket(graph.successors(node).size()), 1, Integer::sum);
            if (isExternalOnly(node))
                externalCount++;
        }

        return new DependencyMetrics(
                totalFormulas,
                graph.edgeCount(),
                maxChain,
                totalFormulas == 0 ? 0.0 : (double) chainSum / totalFormulas,
                findCircularReferences().size(),
                externalCount,
                orphaned,
                complexityDist,
                fanOutDist,
                totalFormulas == 0 ? 0.0 : (double) volatileCount / totalFormulas);
    }

    public DependencyGraph graph() {
        return graph;
    }

    public Optional<ParsedFormula> parsedFormula(CellAddress address) {
        return Optional.ofNullable(parsedFormulas.get(graph.canonical(address)));
    }

    public Map<CellAddress, ParsedFormula> parsedFormulas() {
        return Collections.unmodifiableMap(parsedFormulas);
    }

    /**
     * External workbook name to the cells referenced in it.
     */
    public Map<String, Set<CellAddress>> externalDependencies() {
        Map<String, Set<CellAddress>> copy = new LinkedHashMap<>();
        externalDependencies.forEach((workbook, cells) -> copy.put(workbook, Set.copyOf(cells)));
        return Collections.unmodifiableMap(copy);
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    // === Internals ===

    private static final class DepthFrame {
        final CellAddress node;
        final Iterator<CellAddress> precedents;
        int best;

        DepthFrame(CellAddress node, Iterator<CellAddress> precedents) {
            this.node = node;
            this.precedents = precedents;
        }
    }

    /**
     * Longest path over predecessors with an explicit stack, capped at
     * {@code maxDepth}. The memo holds uncapped lengths, so a shared memo
     * gives the same answer whatever order the roots are visited in. Inside
     * a cycle the result depends on where the walk entered it.
     */
    private int precedentDepth(CellAddress start, Map<CellAddress, Integer> memo) {
        Integer known = memo.get(start);
        if (known != null) {
            return Math.min(known, maxDepth);
        }

        Deque<DepthFrame> stack = new ArrayDeque<>();
        Set<CellAddress> onPath = new HashSet<>();
        stack.push(new DepthFrame(start, graph.predecessors(start).iterator()));
        onPath.add(start);

        while (!stack.isEmpty()) {
            DepthFrame top = stack.peek();
            if (top.precedents.hasNext()) {
                CellAddress precedent = top.precedents.next();
                Integer depth = memo.get(precedent);
                if (depth != null) {
                    top.best = Math.max(top.best, depth + 1);
                } else if (!onPath.contains(precedent)) {
                    stack.push(new DepthFrame(precedent, graph.predecessors(precedent).iterator()));
                    onPath.add(precedent);
                }
                continue;
            }

            stack.pop();
            onPath.remove(top.node);
            memo.put(top.node, top.best);
            DepthFrame parent = stack.peek();
            if (parent != null) {
                parent.best = Math.max(parent.best, top.best + 1);
            }
        }
        return Math.min(memo.get(start), maxDepth);
    }

    private boolean isExternalOnly(CellAddress node) {
        NodeMetadata meta = graph.getNode(node).orElse(NodeMetadata.precedent());
        Collection<DependencyEdge> uses = graph.outgoingEdges(node);
        return !meta.hasFormula()
                && !uses.isEmpty()
                && uses.stream().allMatch(e -> e.dependencyType() == DependencyType.EXTERNAL);
    }

    private static String fanOutBucket(int fanOut) {
        if (fanOut == 0)
            return "0";
        if (fanOut <= 5)
            return "1-5";
        if (fanOut <= 20)
            return "6-20";
        return "21+";
    }

    private static void warn(String address, String reason) {
        System.err.println("Warning: Failed to add formula for " + address + ": " + reason);
    }
}
