package org.calista.formalizer.schedule;

import org.calista.formalizer.graph.ConceptNode;

import java.util.List;

/**
 * Output of the scheduler: TO_SYNTHESIZE nodes in a valid build order (dependencies
 * first, ties by creation order) and the GROUNDED nodes reachable from the root.
 */
public final class BuildPlan {

    public final List<ConceptNode> synthesisOrder;
    public final List<ConceptNode> grounded;

    public BuildPlan(List<ConceptNode> synthesisOrder, List<ConceptNode> grounded) {
        this.synthesisOrder = List.copyOf(synthesisOrder);
        this.grounded = List.copyOf(grounded);
    }

    public int size() {
        return synthesisOrder.size();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("BuildPlan{");
        for (int i = 0; i < synthesisOrder.size(); i++) {
            if (i > 0) sb.append(" -> ");
            sb.append(synthesisOrder.get(i).id());
        }
        return sb.append(", grounded=").append(grounded.size()).append('}').toString();
    }
}
