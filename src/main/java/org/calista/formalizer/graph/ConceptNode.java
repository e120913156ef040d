package org.calista.formalizer.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * ConceptNode — one unit of formalization work.
 *
 * <p>Identity and description are immutable. Every other field is written at most once,
 * through a status transition; {@link #attemptCount()} only grows and is bounded by the
 * caller-supplied maximum. Nodes are created by {@link ConceptGraph} only.</p>
 */
public final class ConceptNode {

    private final String id;
    private final int ordinal;
    private final String description;
    private final int depth;

    private final LinkedHashSet<String> dependencies = new LinkedHashSet<>();
    private final ArrayList<NodeStatus> statusHistory = new ArrayList<>(3);

    private NodeStatus status = NodeStatus.PENDING;
    private GroundedReference resolvedReference;
    private String plannedShape;
    private String synthesizedCode;
    private List<String> lastDiagnostics = List.of();
    private int attemptCount;

    ConceptNode(String id, int ordinal, String description, int depth) {
        this.id = Objects.requireNonNull(id, "id");
        this.ordinal = ordinal;
        this.description = Objects.requireNonNull(description, "description").trim();
        this.depth = depth;
        if (this.description.isEmpty()) throw new IllegalArgumentException("description is blank");
        this.statusHistory.add(NodeStatus.PENDING);
    }

    // ---------------------------------------------------------------------
    // Identity
    // ---------------------------------------------------------------------

    public String id() { return id; }

    /** Creation sequence; used for deterministic tie-breaks. */
    public int ordinal() { return ordinal; }

    public String description() { return description; }

    public int depth() { return depth; }

    // ---------------------------------------------------------------------
    // State
    // ---------------------------------------------------------------------

    public synchronized NodeStatus status() { return status; }

    public synchronized List<NodeStatus> statusHistory() {
        return List.copyOf(statusHistory);
    }

    public synchronized Set<String> dependencies() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(dependencies));
    }

    public synchronized GroundedReference resolvedReference() { return resolvedReference; }

    public synchronized String plannedShape() { return plannedShape; }

    public synchronized String synthesizedCode() { return synthesizedCode; }

    public synchronized List<String> lastDiagnostics() { return lastDiagnostics; }

    public synchronized int attemptCount() { return attemptCount; }

    // ---------------------------------------------------------------------
    // Transitions
    // ---------------------------------------------------------------------

    /** PENDING → GROUNDED. */
    public synchronized void ground(GroundedReference reference) {
        Objects.requireNonNull(reference, "reference");
        transition(NodeStatus.GROUNDED);
        this.resolvedReference = reference;
    }

    /** PENDING → TO_SYNTHESIZE, optionally recording the intended statement shape. */
    public synchronized void planSynthesis(String shape) {
        transition(NodeStatus.TO_SYNTHESIZE);
        if (shape != null && !shape.isBlank()) this.plannedShape = shape.trim();
    }

    /** TO_SYNTHESIZE → SYNTHESIZED. */
    public synchronized void synthesized(String code) {
        Objects.requireNonNull(code, "code");
        transition(NodeStatus.SYNTHESIZED);
        this.synthesizedCode = code;
    }

    /** TO_SYNTHESIZE → FAILED, keeping the diagnostics of the last attempt. */
    public synchronized void failed(List<String> diagnostics) {
        transition(NodeStatus.FAILED);
        this.lastDiagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    /**
     * Claims one synthesis attempt.
     *
     * @return the 1-based number of the claimed attempt, or 0 (and no change) when
     *         {@code maxAttempts} is already reached
     */
    public synchronized int tryBeginAttempt(int maxAttempts) {
        if (status != NodeStatus.TO_SYNTHESIZE) {
            throw new GraphInvariantException("attempt on node " + id + " in status " + status);
        }
        if (attemptCount >= maxAttempts) return 0;
        return ++attemptCount;
    }

    synchronized void addDependency(String dependencyId) {
        if (status != NodeStatus.PENDING) {
            throw new GraphInvariantException("edges can only be added to PENDING nodes: " + id + " is " + status);
        }
        dependencies.add(dependencyId);
    }

    private void transition(NodeStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new GraphInvariantException("illegal transition " + status + " -> " + next + " on node " + id);
        }
        status = next;
        statusHistory.add(next);
    }

    @Override
    public String toString() {
        return "ConceptNode{" + id + " '" + description + "' " + status() + '}';
    }
}
