package org.calista.formalizer.search;

import org.calista.formalizer.core.CollaboratorException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Search collaborator: free-text query in, ranked library candidates out.
 *
 * <p>Implementations must be idempotent and side-effect free. Transport failures and
 * unparsable responses are reported as {@link CollaboratorException}, never as an empty
 * list.</p>
 */
public interface SearchClient {

    /** Top {@code limit} hits for one query, closest first. */
    List<SearchHit> search(String query, int limit) throws CollaboratorException;

    /**
     * Multi-query search with deterministic merge.
     *
     * <p>Default: one call per non-blank query, first occurrence of a canonical id wins,
     * then re-ranked by {@link SearchHit#BY_RELEVANCE} and cut to {@code limit}.</p>
     */
    default List<SearchHit> search(List<String> queries, int limit) throws CollaboratorException {
        if (queries == null || queries.isEmpty() || limit <= 0) return List.of();

        LinkedHashMap<String, SearchHit> merged = new LinkedHashMap<>();
        for (String q : queries) {
            if (q == null || q.isBlank()) continue;
            for (SearchHit h : search(q, limit)) {
                if (h != null) merged.putIfAbsent(h.canonicalId, h);
            }
        }

        ArrayList<SearchHit> out = new ArrayList<>(merged.values());
        out.sort(SearchHit.BY_RELEVANCE);
        return out.size() > limit ? List.copyOf(out.subList(0, limit)) : List.copyOf(out);
    }
}
