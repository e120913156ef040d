package org.calista.formalizer.assemble;

import org.calista.formalizer.graph.ConceptGraph;
import org.calista.formalizer.graph.ConceptNode;
import org.calista.formalizer.graph.GroundedReference;
import org.calista.formalizer.graph.NodeStatus;
import org.calista.formalizer.knowledge.VerifiedEntry;
import org.calista.formalizer.knowledge.VerifiedKnowledgeBase;
import org.calista.formalizer.llm.ModelOutputs;
import org.calista.formalizer.schedule.BuildPlan;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Assembler — one ordered file from a finished Stage 2.
 *
 * <pre>
 * import lines (base, then hoisted, first-seen order, no duplicates)
 * -- Verified: ...   knowledge-base closures of VERIFIED_KB nodes
 * -- Grounded: ...   library annotations (optional)
 * -- Node: ...       synthesized code or a FAILED placeholder, in build order
 * </pre>
 *
 * A pure function of graph, plan and knowledge base: equal input, byte-identical output.
 */
public final class Assembler {

    static final String NODE_MARKER = "-- Node: ";

    private final List<String> baseImports;
    private final VerifiedKnowledgeBase knowledge; // nullable
    private final boolean annotateGrounded;

    public Assembler(List<String> baseImports, VerifiedKnowledgeBase knowledge, boolean annotateGrounded) {
        this.baseImports = List.copyOf(Objects.requireNonNull(baseImports, "baseImports"));
        this.knowledge = knowledge;
        this.annotateGrounded = annotateGrounded;
    }

    public FormalArtifact assemble(ConceptGraph graph, BuildPlan plan) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(plan, "plan");

        LinkedHashSet<String> imports = new LinkedHashSet<>(baseImports);
        List<String> sections = new ArrayList<>();

        // knowledge-base closures, deduplicated across grounded nodes
        LinkedHashMap<String, String> verified = new LinkedHashMap<>();
        List<ConceptNode> library = new ArrayList<>();
        for (ConceptNode n : plan.grounded) {
            GroundedReference ref = n.resolvedReference();
            if (ref.isLibrary()) {
                library.add(n);
                continue;
            }
            List<VerifiedEntry> closure = knowledge == null ? List.of() : knowledge.closure(ref.canonicalId);
            if (closure.isEmpty()) {
                verified.putIfAbsent(ref.canonicalId, ref.code);
            } else {
                for (VerifiedEntry e : closure) verified.putIfAbsent(e.key, e.code);
            }
        }
        for (Map.Entry<String, String> e : verified.entrySet()) {
            ModelOutputs.Candidate c = ModelOutputs.splitImports(e.getValue());
            imports.addAll(c.imports);
            sections.add("-- Verified: " + ModelOutputs.oneLine(e.getKey(), 200) + "\n" + c.body);
        }

        if (annotateGrounded && !library.isEmpty()) {
            StringBuilder sb = new StringBuilder();
            for (ConceptNode n : library) {
                if (sb.length() > 0) sb.append('\n');
                sb.append("-- Grounded: ").append(ModelOutputs.oneLine(n.description(), 200))
                        .append(" -> ").append(n.resolvedReference().canonicalId);
            }
            sections.add(sb.toString());
        }

        int synthesized = 0;
        int failed = 0;
        for (ConceptNode n : plan.synthesisOrder) {
            String header = NODE_MARKER + ModelOutputs.oneLine(n.description(), 200);
            if (n.status() == NodeStatus.SYNTHESIZED) {
                ModelOutputs.Candidate c = ModelOutputs.splitImports(n.synthesizedCode());
                imports.addAll(c.imports);
                sections.add(header + "\n" + c.body);
                synthesized++;
            } else if (n.status() == NodeStatus.FAILED) {
                sections.add(header + "\n" + placeholder(n));
                failed++;
            } else {
                throw new IllegalStateException("node " + n.id() + " not finished: " + n.status());
            }
        }

        StringBuilder out = new StringBuilder();
        out.append(String.join("\n", imports));
        for (String s : sections) {
            if (out.length() > 0) out.append("\n\n");
            out.append(s);
        }
        out.append('\n');

        return new FormalArtifact(out.toString(), new ArrayList<>(imports), synthesized, failed, plan.grounded.size());
    }

    static String placeholder(ConceptNode n) {
        StringBuilder sb = new StringBuilder();
        sb.append("-- [FAILED] not formalized after ").append(n.attemptCount()).append(" attempt")
                .append(n.attemptCount() == 1 ? "" : "s");
        List<String> d = n.lastDiagnostics();
        if (!d.isEmpty()) {
            sb.append("\n-- last error: ").append(ModelOutputs.oneLine(d.get(0), 300));
        }
        return sb.toString();
    }
}
