package org.calista.formalizer.ground;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.formalizer.core.CollaboratorException;
import org.calista.formalizer.core.FormalizerConfig;
import org.calista.formalizer.core.Retries;
import org.calista.formalizer.graph.ConceptNode;
import org.calista.formalizer.graph.GroundedReference;
import org.calista.formalizer.graph.NodeStatus;
import org.calista.formalizer.knowledge.VerifiedEntry;
import org.calista.formalizer.knowledge.VerifiedKnowledgeBase;
import org.calista.formalizer.search.SearchClient;
import org.calista.formalizer.search.SearchHit;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * GroundingResolver — decides whether a concept already exists, either in the verified
 * knowledge base or in the reference library.
 *
 * <p>Order: knowledge base, then search (description and its {@code $}-stripped variant),
 * then the distance threshold, then the optional {@link GroundingReasoner}. Collaborator
 * failures are retried and then fail open: the decision is "not found" so the concept is
 * decomposed instead.</p>
 */
public final class GroundingResolver {

    private static final Logger log = LogManager.getLogger(GroundingResolver.class);

    private final SearchClient search;
    private final VerifiedKnowledgeBase knowledge; // nullable
    private final GroundingReasoner reasoner;      // nullable
    private final FormalizerConfig.Grounding cfg;
    private final Retries retries;

    public GroundingResolver(SearchClient search, VerifiedKnowledgeBase knowledge, GroundingReasoner reasoner,
                             FormalizerConfig.Grounding cfg, Retries retries) {
        this.search = Objects.requireNonNull(search, "search");
        this.knowledge = knowledge;
        this.reasoner = reasoner;
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.retries = Objects.requireNonNull(retries, "retries");
    }

    /** Decides and, when grounded, moves the node PENDING → GROUNDED. */
    public GroundingDecision resolve(ConceptNode node) {
        if (node.status() != NodeStatus.PENDING) {
            throw new IllegalArgumentException("only PENDING nodes are grounded: " + node);
        }
        GroundingDecision d = decide(node.description());
        if (d.grounded) node.ground(d.reference);
        log.debug("grounding {} '{}': {}", node.id(), node.description(), d);
        return d;
    }

    public GroundingDecision decide(String description) {
        if (knowledge != null) {
            Optional<VerifiedEntry> hit = knowledge.get(description);
            if (hit.isPresent()) {
                return GroundingDecision.found(GroundedReference.verified(hit.get().key, hit.get().code),
                        List.of(), "verified knowledge base");
            }
        }

        List<SearchHit> hits;
        try {
            List<String> queries = queries(description);
            hits = retries.call("search", () -> search.search(queries, cfg.searchLimit));
        } catch (CollaboratorException e) {
            log.warn("search failed for '{}', treating as not found: {}", description, e.getMessage());
            return GroundingDecision.failedOpen(e.getMessage());
        }

        List<SearchHit> accepted = new ArrayList<>();
        for (SearchHit h : hits) {
            if (h.distance <= cfg.acceptDistance) accepted.add(h);
        }
        if (accepted.isEmpty()) {
            String best = hits.isEmpty() ? "no hits" : "best distance " + hits.get(0).distance;
            return GroundingDecision.notFound(hits, best + " > " + cfg.acceptDistance);
        }

        if (reasoner == null) {
            SearchHit top = accepted.get(0);
            return GroundingDecision.found(toReference(top), hits, "distance " + top.distance);
        }

        List<SearchHit> shortlist = accepted.subList(0, Math.min(cfg.reasonerCandidates, accepted.size()));
        try {
            Optional<SearchHit> chosen = retries.call("grounding-reasoner", () -> reasoner.choose(description, shortlist));
            if (chosen.isEmpty()) return GroundingDecision.notFound(hits, "reasoner: no match");
            return GroundingDecision.found(toReference(chosen.get()), hits, "reasoner confirmed");
        } catch (CollaboratorException e) {
            log.warn("grounding reasoner failed for '{}', treating as not found: {}", description, e.getMessage());
            return GroundingDecision.failedOpen(e.getMessage());
        }
    }

    List<String> queries(String description) {
        List<String> q = new ArrayList<>(2);
        q.add(description);
        if (cfg.stripLatexQuery) {
            String plain = description.replace("$", "").replaceAll("\\s+", " ").trim();
            if (!plain.isEmpty() && !plain.equals(description)) q.add(plain);
        }
        return q;
    }

    private static GroundedReference toReference(SearchHit h) {
        return GroundedReference.library(h.canonicalId, h.informalDescription, h.distance);
    }
}
