package org.calista.formalizer.plan;

import org.calista.formalizer.graph.ConceptNode;

import java.util.List;

/** What one expansion step did to its parent node. */
public final class Expansion {

    public enum Outcome {
        /** Children created or shared; parent TO_SYNTHESIZE. */
        EXPANDED,
        /** Model proposed nothing; parent TO_SYNTHESIZE without dependencies. */
        IRREDUCIBLE,
        FORCED_DEPTH,
        FORCED_COUNT,
        REJECTED_CYCLE,
        /** Unusable model output after retries; treated as irreducible. */
        MALFORMED,
        /** Model unreachable after retries; treated as irreducible. */
        UNAVAILABLE
    }

    public final Outcome outcome;
    /** Nodes created by this step, in proposal order. */
    public final List<ConceptNode> newChildren;
    /** Existing nodes linked as dependencies instead of duplicated. */
    public final List<ConceptNode> sharedDependencies;
    public final String detail;

    Expansion(Outcome outcome, List<ConceptNode> newChildren, List<ConceptNode> sharedDependencies, String detail) {
        this.outcome = outcome;
        this.newChildren = List.copyOf(newChildren);
        this.sharedDependencies = List.copyOf(sharedDependencies);
        this.detail = detail == null ? "" : detail;
    }

    static Expansion of(Outcome outcome, String detail) {
        return new Expansion(outcome, List.of(), List.of(), detail);
    }

    public boolean forced() {
        return outcome != Outcome.EXPANDED && outcome != Outcome.IRREDUCIBLE;
    }

    @Override
    public String toString() {
        return "Expansion{" + outcome + ", new=" + newChildren.size() + ", shared=" + sharedDependencies.size()
                + (detail.isEmpty() ? "" : ", " + detail) + '}';
    }
}
