package org.calista.formalizer.search;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.formalizer.core.CollaboratorException;

import java.util.List;
import java.util.Objects;

/** Asks {@code primary} first and {@code fallback} only when the primary cannot answer. */
public final class FallbackSearchClient implements SearchClient {

    private static final Logger log = LogManager.getLogger(FallbackSearchClient.class);

    private final SearchClient primary;
    private final SearchClient fallback;

    public FallbackSearchClient(SearchClient primary, SearchClient fallback) {
        this.primary = Objects.requireNonNull(primary, "primary");
        this.fallback = Objects.requireNonNull(fallback, "fallback");
    }

    @Override
    public List<SearchHit> search(String query, int limit) throws CollaboratorException {
        try {
            return primary.search(query, limit);
        } catch (CollaboratorException e) {
            log.warn("primary search failed ({}), asking {}", e.getMessage(), fallback.getClass().getSimpleName());
            return fallback.search(query, limit);
        }
    }
}
