package org.calista.formalizer.graph;

/**
 * Lifecycle of a concept node.
 *
 * <pre>
 * PENDING ──(grounding)──────▶ GROUNDED
 * PENDING ──(decomposition)──▶ TO_SYNTHESIZE ──▶ SYNTHESIZED
 *                                             └─▶ FAILED
 * </pre>
 */
public enum NodeStatus {
    PENDING,
    GROUNDED,
    TO_SYNTHESIZE,
    SYNTHESIZED,
    FAILED;

    public boolean canTransitionTo(NodeStatus next) {
        if (next == null) return false;
        switch (this) {
            case PENDING:
                return next == GROUNDED || next == TO_SYNTHESIZE;
            case TO_SYNTHESIZE:
                return next == SYNTHESIZED || next == FAILED;
            default:
                return false;
        }
    }

    /** Stage 1 is done with the node. */
    public boolean isPlanned() {
        return this != PENDING;
    }

    /** No further transition can happen. */
    public boolean isTerminal() {
        return this == GROUNDED || this == SYNTHESIZED || this == FAILED;
    }
}
