package org.calista.formalizer.synth;

import org.calista.formalizer.graph.NodeStatus;

/** How one node left Stage 2. */
public final class SynthesisOutcome {

    public enum Reason {
        COMPILED,
        ATTEMPTS_EXHAUSTED,
        COLLABORATOR_FAILURE,
        BUDGET_EXHAUSTED,
        /** The root gate refused the first candidate of every worker. */
        SEMANTIC_REJECTED
    }

    public final String nodeId;
    public final String description;
    public final NodeStatus status;
    public final Reason reason;
    public final int attempts;
    public final long elapsedMs;

    SynthesisOutcome(String nodeId, String description, NodeStatus status, Reason reason, int attempts, long elapsedMs) {
        this.nodeId = nodeId;
        this.description = description;
        this.status = status;
        this.reason = reason;
        this.attempts = attempts;
        this.elapsedMs = elapsedMs;
    }

    public boolean synthesized() {
        return status == NodeStatus.SYNTHESIZED;
    }

    @Override
    public String toString() {
        return nodeId + " " + status + " (" + reason + ", attempts=" + attempts + ", " + elapsedMs + "ms)";
    }
}
