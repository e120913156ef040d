package org.calista.formalizer.plan;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.formalizer.graph.ConceptGraph;
import org.calista.formalizer.graph.ConceptNode;
import org.calista.formalizer.graph.GraphInvariantException;
import org.calista.formalizer.graph.NodeStatus;
import org.calista.formalizer.ground.GroundingDecision;
import org.calista.formalizer.ground.GroundingResolver;

import java.util.ArrayDeque;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * GraphBuilder — Stage 1. Grows the concept graph from one statement with a FIFO worklist:
 * ground each PENDING node, expand it when grounding fails, enqueue the new children.
 * Ends when the worklist is empty; every node is then GROUNDED or TO_SYNTHESIZE.
 */
public final class GraphBuilder {

    private static final Logger log = LogManager.getLogger(GraphBuilder.class);

    private final GroundingResolver resolver;
    private final DecompositionExpander expander;
    private final int maxNodes;
    private final boolean forceRootDecomposition;

    public GraphBuilder(GroundingResolver resolver, DecompositionExpander expander,
                        int maxNodes, boolean forceRootDecomposition) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.expander = Objects.requireNonNull(expander, "expander");
        if (maxNodes < 1) throw new IllegalArgumentException("maxNodes must be >= 1: " + maxNodes);
        this.maxNodes = maxNodes;
        this.forceRootDecomposition = forceRootDecomposition;
    }

    /** Stage 1 output: the graph plus per-outcome counters for the run report. */
    public static final class Result {
        public final ConceptGraph graph;
        public final int groundingErrors;
        public final Map<Expansion.Outcome, Integer> expansions;

        Result(ConceptGraph graph, int groundingErrors, Map<Expansion.Outcome, Integer> expansions) {
            this.graph = graph;
            this.groundingErrors = groundingErrors;
            this.expansions = Map.copyOf(expansions);
        }
    }

    public Result build(String statement) {
        ConceptGraph graph = new ConceptGraph(statement, maxNodes);
        ArrayDeque<String> worklist = new ArrayDeque<>();
        worklist.add(graph.root().id());

        int groundingErrors = 0;
        EnumMap<Expansion.Outcome, Integer> expansions = new EnumMap<>(Expansion.Outcome.class);

        while (!worklist.isEmpty()) {
            ConceptNode node = graph.node(worklist.poll());
            if (node.status() != NodeStatus.PENDING) continue;

            boolean skipGrounding = forceRootDecomposition && node == graph.root();
            if (!skipGrounding) {
                GroundingDecision d = resolver.resolve(node);
                if (d.isRecoverableError()) groundingErrors++;
                if (d.grounded) {
                    log.info("[stage1] {} GROUNDED -> {} ({})", node.id(), d.reference.canonicalId, d.reason);
                    continue;
                }
            }

            Expansion e = expander.expand(graph, node);
            expansions.merge(e.outcome, 1, Integer::sum);
            log.info("[stage1] {} '{}' -> {}", node.id(), node.description(), e);
            for (ConceptNode child : e.newChildren) worklist.add(child.id());
        }

        verify(graph);
        log.info("[stage1] done: {} nodes {}", graph.size(), graph.statusCounts());
        return new Result(graph, groundingErrors, expansions);
    }

    private static void verify(ConceptGraph graph) {
        for (ConceptNode n : graph.reachableFromRoot()) {
            if (!n.status().isPlanned()) {
                throw new GraphInvariantException("node left unplanned after stage 1: " + n);
            }
        }
    }
}
