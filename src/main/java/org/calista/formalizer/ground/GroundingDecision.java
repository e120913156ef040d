package org.calista.formalizer.ground;

import org.calista.formalizer.graph.GroundedReference;
import org.calista.formalizer.search.SearchHit;

import java.util.List;

/**
 * Outcome of one grounding query. {@link #reference} is set iff {@link #grounded};
 * {@link #error} carries the message of a collaborator failure that was failed open.
 */
public final class GroundingDecision {

    public final boolean grounded;
    public final GroundedReference reference;
    public final List<SearchHit> candidates;
    public final String reason;
    public final String error;

    private GroundingDecision(boolean grounded, GroundedReference reference, List<SearchHit> candidates,
                              String reason, String error) {
        this.grounded = grounded;
        this.reference = reference;
        this.candidates = candidates == null ? List.of() : List.copyOf(candidates);
        this.reason = reason;
        this.error = error;
    }

    public static GroundingDecision found(GroundedReference reference, List<SearchHit> candidates, String reason) {
        return new GroundingDecision(true, reference, candidates, reason, null);
    }

    public static GroundingDecision notFound(List<SearchHit> candidates, String reason) {
        return new GroundingDecision(false, null, candidates, reason, null);
    }

    public static GroundingDecision failedOpen(String error) {
        return new GroundingDecision(false, null, List.of(), "collaborator failure", error);
    }

    public boolean isRecoverableError() {
        return error != null;
    }

    @Override
    public String toString() {
        return grounded
                ? "GroundingDecision{grounded " + reference + ", " + reason + '}'
                : "GroundingDecision{notFound, " + reason + (error == null ? "" : ", error=" + error) + '}';
    }
}
