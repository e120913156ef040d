package org.calista.formalizer.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.calista.formalizer.align.AlignmentReport;
import org.calista.formalizer.assemble.FormalArtifact;
import org.calista.formalizer.graph.ConceptGraph;
import org.calista.formalizer.graph.ConceptNode;
import org.calista.formalizer.graph.GroundedReference;
import org.calista.formalizer.schedule.BuildPlan;
import org.calista.formalizer.synth.SynthesisOutcome;

import java.util.List;
import java.util.Locale;

/** Everything one formalization run produced. */
public final class FormalizationResult {

    public enum Status {
        /** Compiled, and consistent when alignment ran. */
        SUCCESS,
        /** Compiled, but the semantic check found a different meaning. */
        INCONSISTENT,
        /** At least one node failed, or the assembled file did not compile. */
        FAILED;

        public String wire() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public final String runId;
    public final String statement;
    public final ConceptGraph graph;
    public final BuildPlan plan;
    public final List<SynthesisOutcome> outcomes;
    public final FormalArtifact artifact;
    public final boolean compilationPassed;
    public final AlignmentReport alignment; // null when not run
    public final int savedToKnowledge;
    public final long elapsedMs;

    FormalizationResult(String runId, String statement, ConceptGraph graph, BuildPlan plan,
                        List<SynthesisOutcome> outcomes, FormalArtifact artifact, boolean compilationPassed,
                        AlignmentReport alignment, int savedToKnowledge, long elapsedMs) {
        this.runId = runId;
        this.statement = statement;
        this.graph = graph;
        this.plan = plan;
        this.outcomes = List.copyOf(outcomes);
        this.artifact = artifact;
        this.compilationPassed = compilationPassed;
        this.alignment = alignment;
        this.savedToKnowledge = savedToKnowledge;
        this.elapsedMs = elapsedMs;
    }

    public Status status() {
        if (!compilationPassed) return Status.FAILED;
        if (alignment != null && !alignment.isConsistent()) return Status.INCONSISTENT;
        return Status.SUCCESS;
    }

    public boolean semanticPassed() {
        return compilationPassed && alignment != null && alignment.isConsistent();
    }

    /** JSON report (graph, per-node outcome, alignment) for the batch output. */
    public ObjectNode report(ObjectMapper mapper) {
        ObjectNode r = mapper.createObjectNode();
        r.put("runId", runId);
        r.put("statement", statement);
        r.put("status", status().wire());
        r.put("compilationPassed", compilationPassed);
        r.put("semanticPassed", semanticPassed());
        r.put("elapsedMs", elapsedMs);
        r.put("savedToKnowledge", savedToKnowledge);

        ArrayNode nodes = r.putArray("nodes");
        for (ConceptNode n : graph.nodes()) {
            ObjectNode o = nodes.addObject();
            o.put("id", n.id());
            o.put("description", n.description());
            o.put("depth", n.depth());
            o.put("status", n.status().name());
            ArrayNode deps = o.putArray("dependencies");
            for (String d : n.dependencies()) deps.add(d);
            ArrayNode hist = o.putArray("statusHistory");
            n.statusHistory().forEach(s -> hist.add(s.name()));
            GroundedReference ref = n.resolvedReference();
            if (ref != null) {
                o.put("groundedTo", ref.canonicalId);
                o.put("groundedSource", ref.source.name());
            }
            if (n.plannedShape() != null) o.put("plannedShape", n.plannedShape());
            if (n.attemptCount() > 0) o.put("attempts", n.attemptCount());
            if (!n.lastDiagnostics().isEmpty()) o.put("lastDiagnostic", n.lastDiagnostics().get(0));
        }

        ArrayNode order = r.putArray("buildOrder");
        for (ConceptNode n : plan.synthesisOrder) order.add(n.id());

        ArrayNode synth = r.putArray("synthesis");
        for (SynthesisOutcome o : outcomes) {
            ObjectNode x = synth.addObject();
            x.put("id", o.nodeId);
            x.put("status", o.status.name());
            x.put("reason", o.reason.name());
            x.put("attempts", o.attempts);
            x.put("elapsedMs", o.elapsedMs);
        }

        if (alignment != null) r.set("alignment", mapper.valueToTree(alignment));
        return r;
    }
}
