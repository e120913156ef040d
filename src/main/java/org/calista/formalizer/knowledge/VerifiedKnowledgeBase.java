package org.calista.formalizer.knowledge;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * VerifiedKnowledgeBase — previously verified code blocks, consulted before library
 * search during grounding and pasted (with their dependencies) into scope and artifact.
 */
public interface VerifiedKnowledgeBase {

    /** @return true if the stored data changed */
    boolean upsert(VerifiedEntry entry);

    /** Lookup by description; normalization is applied by the implementation. */
    Optional<VerifiedEntry> get(String description);

    /** All entries ordered by key. */
    List<VerifiedEntry> snapshotSorted();

    int size();

    /**
     * The entry for {@code description} preceded by everything it needs, dependencies
     * first. Missing dependency keys are skipped; a dependency cycle in stored data is
     * cut at the revisit.
     */
    default List<VerifiedEntry> closure(String description) {
        Optional<VerifiedEntry> start = get(description);
        if (start.isEmpty()) return List.of();
        LinkedHashMap<String, VerifiedEntry> out = new LinkedHashMap<>();
        visit(start.get(), out, new HashSet<>());
        return new ArrayList<>(out.values());
    }

    private void visit(VerifiedEntry e, LinkedHashMap<String, VerifiedEntry> out, Set<String> onPath) {
        if (out.containsKey(e.key) || !onPath.add(e.key)) return;
        for (String d : e.deps) {
            get(d).ifPresent(dep -> visit(dep, out, onPath));
        }
        onPath.remove(e.key);
        out.put(e.key, e);
    }
}
