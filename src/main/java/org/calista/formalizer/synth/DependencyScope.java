package org.calista.formalizer.synth;

import org.calista.formalizer.graph.ConceptGraph;
import org.calista.formalizer.graph.ConceptNode;
import org.calista.formalizer.graph.GroundedReference;
import org.calista.formalizer.graph.NodeStatus;
import org.calista.formalizer.knowledge.VerifiedEntry;
import org.calista.formalizer.knowledge.VerifiedKnowledgeBase;
import org.calista.formalizer.llm.ModelOutputs;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Everything a node's transitive dependencies contribute to one synthesis attempt.
 *
 * <ul>
 *   <li>code blocks that must compile ahead of the candidate: knowledge-base closures
 *       first, then synthesized dependencies in build order;</li>
 *   <li>import lines hoisted out of those blocks;</li>
 *   <li>library references (prompt only, the library is already imported);</li>
 *   <li>failed dependencies (prompt only, excluded from the unit).</li>
 * </ul>
 */
public final class DependencyScope {

    static final String DEP_MARKER = "-- [Dep] ";

    public final List<String> imports;
    public final List<String> blocks;
    public final List<String> blockLabels;
    public final List<GroundedReference> libraryRefs;
    public final List<String> libraryConcepts;
    public final List<String> failedConcepts;

    private DependencyScope(List<String> imports, List<String> blocks, List<String> blockLabels,
                            List<GroundedReference> libraryRefs, List<String> libraryConcepts,
                            List<String> failedConcepts) {
        this.imports = List.copyOf(imports);
        this.blocks = List.copyOf(blocks);
        this.blockLabels = List.copyOf(blockLabels);
        this.libraryRefs = List.copyOf(libraryRefs);
        this.libraryConcepts = List.copyOf(libraryConcepts);
        this.failedConcepts = List.copyOf(failedConcepts);
    }

    /**
     * @param knowledge nullable; without it a VERIFIED_KB dependency contributes only its own code
     */
    public static DependencyScope of(ConceptGraph graph, ConceptNode node, VerifiedKnowledgeBase knowledge) {
        LinkedHashSet<String> imports = new LinkedHashSet<>();
        LinkedHashMap<String, String> kbBlocks = new LinkedHashMap<>();
        List<String> blocks = new ArrayList<>();
        List<String> labels = new ArrayList<>();
        List<GroundedReference> refs = new ArrayList<>();
        List<String> refConcepts = new ArrayList<>();
        List<String> failed = new ArrayList<>();

        for (ConceptNode dep : graph.transitiveDependencies(node.id())) {
            NodeStatus s = dep.status();
            if (s == NodeStatus.GROUNDED) {
                GroundedReference ref = dep.resolvedReference();
                if (ref.isLibrary()) {
                    refs.add(ref);
                    refConcepts.add(dep.description());
                } else {
                    collectKnowledge(ref, knowledge, kbBlocks);
                }
            } else if (s == NodeStatus.SYNTHESIZED) {
                ModelOutputs.Candidate c = ModelOutputs.splitImports(dep.synthesizedCode());
                imports.addAll(c.imports);
                blocks.add(c.body);
                labels.add(dep.description());
            } else if (s == NodeStatus.FAILED) {
                failed.add(dep.description());
            } else {
                throw new IllegalStateException("dependency " + dep.id() + " of " + node.id() + " is not terminal: " + s);
            }
        }

        List<String> allBlocks = new ArrayList<>(kbBlocks.size() + blocks.size());
        List<String> allLabels = new ArrayList<>(kbBlocks.size() + labels.size());
        for (Map.Entry<String, String> e : kbBlocks.entrySet()) {
            ModelOutputs.Candidate c = ModelOutputs.splitImports(e.getValue());
            imports.addAll(c.imports);
            allBlocks.add(c.body);
            allLabels.add(e.getKey());
        }
        allBlocks.addAll(blocks);
        allLabels.addAll(labels);

        return new DependencyScope(new ArrayList<>(imports), allBlocks, allLabels, refs, refConcepts, failed);
    }

    private static void collectKnowledge(GroundedReference ref, VerifiedKnowledgeBase knowledge,
                                         LinkedHashMap<String, String> out) {
        List<VerifiedEntry> closure = knowledge == null ? List.of() : knowledge.closure(ref.canonicalId);
        if (closure.isEmpty()) {
            out.putIfAbsent(ref.canonicalId, ref.code);
            return;
        }
        for (VerifiedEntry e : closure) out.putIfAbsent(e.key, e.code);
    }

    /** Prompt text for {dependency_context}. */
    public String promptContext() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < blocks.size(); i++) {
            if (sb.length() > 0) sb.append("\n\n");
            sb.append(DEP_MARKER).append(blockLabels.get(i)).append('\n').append(blocks.get(i));
        }
        for (String f : failedConcepts) {
            if (sb.length() > 0) sb.append("\n\n");
            sb.append("-- unavailable (not formalized): ").append(f)
                    .append("\n-- state what is needed from it directly instead of referring to it");
        }
        return sb.length() == 0 ? "(none)" : sb.toString();
    }

    /** Prompt text for {grounded_context}. */
    public String groundedContext() {
        if (libraryRefs.isEmpty()) return "(none)";
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < libraryRefs.size(); i++) {
            GroundedReference r = libraryRefs.get(i);
            if (sb.length() > 0) sb.append('\n');
            sb.append("- ").append(libraryConcepts.get(i)).append(" -> ").append(r.canonicalId);
            if (r.informalDescription != null && !r.informalDescription.isBlank()) {
                sb.append(": ").append(ModelOutputs.oneLine(r.informalDescription, 300));
            }
        }
        return sb.toString();
    }
}
