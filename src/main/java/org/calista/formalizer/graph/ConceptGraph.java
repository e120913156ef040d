package org.calista.formalizer.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * ConceptGraph — arena of {@link ConceptNode}s keyed by id, plus dependency edges.
 *
 * <p>Invariants held at all times:
 * <ul>
 *   <li>edges reference existing ids only;</li>
 *   <li>the dependency relation is acyclic ({@link #addDependency} rejects closing edges);</li>
 *   <li>{@link #size()} never exceeds {@link #maxNodes()};</li>
 *   <li>nodes are never removed.</li>
 * </ul>
 * Mutated by the Stage 1 driver only; read-only afterwards.</p>
 */
public final class ConceptGraph {

    private final int maxNodes;
    private final LinkedHashMap<String, ConceptNode> nodes = new LinkedHashMap<>();
    private final HashMap<String, String> idsByName = new HashMap<>();
    private final ConceptNode root;

    private int sequence;

    public ConceptGraph(String rootDescription, int maxNodes) {
        if (maxNodes < 1) throw new IllegalArgumentException("maxNodes must be >= 1: " + maxNodes);
        this.maxNodes = maxNodes;
        this.root = create(rootDescription, 0);
    }

    // ---------------------------------------------------------------------
    // Mutation (Stage 1)
    // ---------------------------------------------------------------------

    /**
     * Creates a new PENDING node one level below {@code parent} and adds the edge
     * parent → child.
     */
    public ConceptNode addChild(ConceptNode parent, String description) {
        ConceptNode p = node(parent.id());
        String key = normalize(description);
        if (idsByName.containsKey(key)) {
            throw new GraphInvariantException("concept already present: '" + description + "'");
        }
        ConceptNode child = create(description, p.depth() + 1);
        p.addDependency(child.id());
        return child;
    }

    /** Adds the edge {@code fromId} → {@code toId} (dependent → dependency). */
    public void addDependency(String fromId, String toId) {
        ConceptNode from = node(fromId);
        node(toId);
        if (wouldCreateCycle(fromId, toId)) {
            throw new GraphInvariantException("edge " + fromId + " -> " + toId + " closes a cycle");
        }
        from.addDependency(toId);
    }

    /** True when adding {@code fromId} → {@code toId} would close a cycle (self edges included). */
    public boolean wouldCreateCycle(String fromId, String toId) {
        return fromId.equals(toId) || reaches(toId, fromId);
    }

    private ConceptNode create(String description, int depth) {
        if (nodes.size() >= maxNodes) {
            throw new GraphInvariantException("node cap reached (" + maxNodes + ")");
        }
        String key = normalize(description);
        if (key.isEmpty()) throw new IllegalArgumentException("blank concept description");
        int ordinal = sequence++;
        ConceptNode n = new ConceptNode("n" + ordinal, ordinal, description, depth);
        nodes.put(n.id(), n);
        idsByName.put(key, n.id());
        return n;
    }

    // ---------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------

    public ConceptNode root() { return root; }

    public int size() { return nodes.size(); }

    public int maxNodes() { return maxNodes; }

    public int remainingCapacity() { return maxNodes - nodes.size(); }

    /** @throws GraphInvariantException for an unknown id */
    public ConceptNode node(String id) {
        ConceptNode n = nodes.get(id);
        if (n == null) throw new GraphInvariantException("unknown node id: " + id);
        return n;
    }

    public Optional<ConceptNode> find(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public Optional<ConceptNode> findByDescription(String description) {
        if (description == null) return Optional.empty();
        String id = idsByName.get(normalize(description));
        return id == null ? Optional.empty() : Optional.of(nodes.get(id));
    }

    /** All nodes in creation order. */
    public List<ConceptNode> nodes() {
        return Collections.unmodifiableList(new ArrayList<>(nodes.values()));
    }

    /** True if {@code toId} is reachable from {@code fromId} along dependency edges (or equal). */
    public boolean reaches(String fromId, String toId) {
        if (fromId.equals(toId)) return true;
        Set<String> seen = new HashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        stack.push(fromId);
        while (!stack.isEmpty()) {
            String cur = stack.pop();
            if (!seen.add(cur)) continue;
            ConceptNode n = nodes.get(cur);
            if (n == null) continue;
            for (String d : n.dependencies()) {
                if (d.equals(toId)) return true;
                stack.push(d);
            }
        }
        return false;
    }

    /** Nodes reachable from the root (root included), in creation order. */
    public List<ConceptNode> reachableFromRoot() {
        Set<String> seen = new HashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        stack.push(root.id());
        while (!stack.isEmpty()) {
            String cur = stack.pop();
            if (!seen.add(cur)) continue;
            for (String d : node(cur).dependencies()) stack.push(d);
        }
        List<ConceptNode> out = new ArrayList<>(seen.size());
        for (ConceptNode n : nodes.values()) {
            if (seen.contains(n.id())) out.add(n);
        }
        return out;
    }

    /**
     * Transitive dependencies of a node, dependencies before dependents (post-order,
     * following edge insertion order). The node itself is not included.
     */
    public List<ConceptNode> transitiveDependencies(String id) {
        LinkedHashSet<String> order = new LinkedHashSet<>();
        collectPostOrder(node(id), order, new HashSet<>());
        order.remove(id);
        List<ConceptNode> out = new ArrayList<>(order.size());
        for (String d : order) out.add(nodes.get(d));
        return out;
    }

    private void collectPostOrder(ConceptNode n, LinkedHashSet<String> out, Set<String> onPath) {
        if (out.contains(n.id())) return;
        if (!onPath.add(n.id())) {
            throw new GraphInvariantException("cycle through node " + n.id());
        }
        for (String d : n.dependencies()) collectPostOrder(node(d), out, onPath);
        onPath.remove(n.id());
        out.add(n.id());
    }

    /** Count of nodes per status, for logging. */
    public Map<NodeStatus, Integer> statusCounts() {
        Map<NodeStatus, Integer> m = new LinkedHashMap<>();
        for (NodeStatus s : NodeStatus.values()) m.put(s, 0);
        for (ConceptNode n : nodes.values()) m.merge(n.status(), 1, Integer::sum);
        return m;
    }

    /** Lower-case, whitespace collapsed; the key used to share identical concepts. */
    public static String normalize(String description) {
        if (description == null) return "";
        return description.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
