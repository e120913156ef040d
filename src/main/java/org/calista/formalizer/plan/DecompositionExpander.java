package org.calista.formalizer.plan;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.formalizer.core.CollaboratorException;
import org.calista.formalizer.core.FormalizerConfig;
import org.calista.formalizer.core.Retries;
import org.calista.formalizer.graph.ConceptGraph;
import org.calista.formalizer.graph.ConceptNode;
import org.calista.formalizer.graph.NodeStatus;
import org.calista.formalizer.llm.LanguageModel;
import org.calista.formalizer.llm.PromptLibrary;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * DecompositionExpander — turns one unresolved concept into children.
 *
 * <p>Guardrails, checked in this order, each ending with the parent TO_SYNTHESIZE and the
 * graph untouched:
 * <ol>
 *   <li>depth: a node at {@code maxDepth} is not sent to the model;</li>
 *   <li>cycle: a proposal naming the parent or any node that already depends on it is
 *       rejected in full;</li>
 *   <li>count: a proposal that would push the graph past {@code maxNodes} is discarded in full.</li>
 * </ol>
 * A proposed concept already in the graph is linked, not duplicated.</p>
 */
public final class DecompositionExpander {

    private static final Logger log = LogManager.getLogger(DecompositionExpander.class);

    private final LanguageModel model;
    private final PromptLibrary prompts;
    private final ObjectMapper mapper;
    private final FormalizerConfig.Planner cfg;
    private final Retries retries;

    public DecompositionExpander(LanguageModel model, PromptLibrary prompts, ObjectMapper mapper,
                                 FormalizerConfig.Planner cfg, Retries retries) {
        this.model = Objects.requireNonNull(model, "model");
        this.prompts = Objects.requireNonNull(prompts, "prompts");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.retries = Objects.requireNonNull(retries, "retries");
    }

    public Expansion expand(ConceptGraph graph, ConceptNode node) {
        if (node.status() != NodeStatus.PENDING) {
            throw new IllegalArgumentException("only PENDING nodes are expanded: " + node);
        }

        if (node.depth() >= cfg.maxDepth) {
            node.planSynthesis(null);
            return Expansion.of(Expansion.Outcome.FORCED_DEPTH, "depth " + node.depth() + " >= " + cfg.maxDepth);
        }

        Decomposition proposal;
        try {
            proposal = retries.call("expansion", () -> Decomposition.parse(mapper, model.complete(
                    prompts.conversation(PromptLibrary.EXPANSION, Map.of(
                            "concept", node.description(),
                            "known_concepts", knownConcepts(graph, node))),
                    cfg.temperature)));
        } catch (CollaboratorException e) {
            node.planSynthesis(null);
            Expansion.Outcome o = e.kind() == CollaboratorException.Kind.MALFORMED_RESPONSE
                    ? Expansion.Outcome.MALFORMED
                    : Expansion.Outcome.UNAVAILABLE;
            log.warn("expansion of {} failed ({}), synthesizing directly: {}", node.id(), o, e.getMessage());
            return Expansion.of(o, e.getMessage());
        }

        if (proposal.isEmpty()) {
            node.planSynthesis(proposal.statementShape);
            return Expansion.of(Expansion.Outcome.IRREDUCIBLE, "no sub-concepts");
        }

        List<String> fresh = new ArrayList<>();
        List<ConceptNode> shared = new ArrayList<>();
        for (String name : proposal.subconcepts) {
            Optional<ConceptNode> existing = graph.findByDescription(name);
            if (existing.isEmpty()) {
                fresh.add(name);
                continue;
            }
            ConceptNode e = existing.get();
            if (graph.wouldCreateCycle(node.id(), e.id())) {
                node.planSynthesis(null);
                return Expansion.of(Expansion.Outcome.REJECTED_CYCLE,
                        "'" + name + "' (" + e.id() + ") depends on " + node.id());
            }
            shared.add(e);
        }

        if (graph.size() + fresh.size() > graph.maxNodes()) {
            node.planSynthesis(null);
            return Expansion.of(Expansion.Outcome.FORCED_COUNT,
                    graph.size() + " + " + fresh.size() + " > " + graph.maxNodes());
        }

        List<ConceptNode> created = new ArrayList<>(fresh.size());
        for (String name : fresh) created.add(graph.addChild(node, name));
        for (ConceptNode e : shared) graph.addDependency(node.id(), e.id());
        node.planSynthesis(proposal.statementShape);

        return new Expansion(Expansion.Outcome.EXPANDED, created, shared, null);
    }

    private static String knownConcepts(ConceptGraph graph, ConceptNode self) {
        StringBuilder sb = new StringBuilder();
        for (ConceptNode n : graph.nodes()) {
            if (n == self) continue;
            sb.append("- ").append(n.description()).append('\n');
        }
        return sb.length() == 0 ? "(none)" : sb.toString().trim();
    }
}
