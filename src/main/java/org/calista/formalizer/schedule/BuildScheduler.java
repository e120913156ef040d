package org.calista.formalizer.schedule;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.formalizer.graph.ConceptGraph;
import org.calista.formalizer.graph.ConceptNode;
import org.calista.formalizer.graph.GraphInvariantException;
import org.calista.formalizer.graph.NodeStatus;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

/**
 * BuildScheduler — Kahn's algorithm over the root-reachable subgraph, ready set ordered
 * by creation ordinal so equal graphs always give equal plans.
 *
 * <p>Fatal ({@link GraphInvariantException}): a PENDING node, an unknown dependency id,
 * or a cycle. GROUNDED nodes have no dependencies to wait for, so only TO_SYNTHESIZE
 * nodes land in {@link BuildPlan#synthesisOrder}.</p>
 */
public final class BuildScheduler {

    private static final Logger log = LogManager.getLogger(BuildScheduler.class);

    public BuildPlan schedule(ConceptGraph graph) {
        return order(graph.reachableFromRoot());
    }

    /** Orders exactly {@code reachable}; every dependency must be in the list. */
    BuildPlan order(List<ConceptNode> reachable) {
        Map<String, Integer> indegree = new HashMap<>(reachable.size() * 2);
        Map<String, List<ConceptNode>> dependents = new HashMap<>(reachable.size() * 2);
        for (ConceptNode n : reachable) {
            if (n.status() == NodeStatus.PENDING) {
                throw new GraphInvariantException("cannot schedule PENDING node " + n);
            }
            indegree.put(n.id(), n.dependencies().size());
        }
        for (ConceptNode n : reachable) {
            for (String dep : n.dependencies()) {
                if (!indegree.containsKey(dep)) {
                    throw new GraphInvariantException("node " + n.id() + " depends on unknown node " + dep);
                }
                dependents.computeIfAbsent(dep, k -> new ArrayList<>()).add(n);
            }
        }

        PriorityQueue<ConceptNode> ready = new PriorityQueue<>(Comparator.comparingInt(ConceptNode::ordinal));
        for (ConceptNode n : reachable) {
            if (indegree.get(n.id()) == 0) ready.add(n);
        }

        List<ConceptNode> order = new ArrayList<>(reachable.size());
        List<ConceptNode> grounded = new ArrayList<>();
        int visited = 0;
        while (!ready.isEmpty()) {
            ConceptNode n = ready.poll();
            visited++;
            if (n.status() == NodeStatus.GROUNDED) grounded.add(n);
            else order.add(n);

            for (ConceptNode d : dependents.getOrDefault(n.id(), List.of())) {
                int left = indegree.merge(d.id(), -1, Integer::sum);
                if (left == 0) ready.add(d);
            }
        }

        if (visited != reachable.size()) {
            List<String> stuck = new ArrayList<>();
            for (ConceptNode n : reachable) {
                if (indegree.get(n.id()) > 0) stuck.add(n.id());
            }
            throw new GraphInvariantException("dependency cycle among " + stuck);
        }

        grounded.sort(Comparator.comparingInt(ConceptNode::ordinal));
        BuildPlan plan = new BuildPlan(order, grounded);
        log.info("[schedule] {}", plan);
        return plan;
    }
}
