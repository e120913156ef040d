package org.calista.formalizer.graph;

/**
 * Logic defect in graph construction or scheduling: a cycle, an unknown node id,
 * an illegal status transition, a second write to a write-once field, or the node cap.
 *
 * <p>Never recovered from inside a run.</p>
 */
public final class GraphInvariantException extends IllegalStateException {

    public GraphInvariantException(String message) {
        super(message);
    }
}
