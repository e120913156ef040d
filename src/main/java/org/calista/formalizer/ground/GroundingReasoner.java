package org.calista.formalizer.ground;

import org.calista.formalizer.core.CollaboratorException;
import org.calista.formalizer.llm.LanguageModel;
import org.calista.formalizer.llm.PromptLibrary;
import org.calista.formalizer.search.SearchHit;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Asks the language model which of the shortlisted library declarations, if any, states
 * the concept exactly. Reply grammar: one line {@code FOUND: <canonical id>} or {@code NO_MATCH}.
 */
public final class GroundingReasoner {

    private static final Pattern FOUND = Pattern.compile("(?m)^\\s*\\**FOUND\\**\\s*:\\s*`?([^`\\s]+)`?\\s*$");
    private static final Pattern NO_MATCH = Pattern.compile("(?m)^\\s*\\**NO_MATCH\\**\\s*$");

    private final LanguageModel model;
    private final PromptLibrary prompts;
    private final double temperature;

    public GroundingReasoner(LanguageModel model, PromptLibrary prompts, double temperature) {
        this.model = Objects.requireNonNull(model, "model");
        this.prompts = Objects.requireNonNull(prompts, "prompts");
        this.temperature = temperature;
    }

    /**
     * @return the chosen candidate; empty on NO_MATCH or when the named id was not shown
     * @throws CollaboratorException MALFORMED_RESPONSE when neither answer form is present
     */
    public Optional<SearchHit> choose(String concept, List<SearchHit> shortlist) throws CollaboratorException {
        if (shortlist.isEmpty()) return Optional.empty();

        StringBuilder sb = new StringBuilder();
        for (SearchHit h : shortlist) {
            sb.append("- ").append(h.canonicalId).append(": ").append(h.informalDescription).append('\n');
        }
        String reply = model.complete(prompts.conversation(PromptLibrary.GROUNDING,
                Map.of("concept", concept, "candidates", sb.toString().trim())), temperature);

        return parse(reply, shortlist);
    }

    static Optional<SearchHit> parse(String reply, List<SearchHit> shortlist) throws CollaboratorException {
        String r = reply == null ? "" : reply;
        Matcher m = FOUND.matcher(r);
        if (m.find()) {
            String id = m.group(1).trim();
            for (SearchHit h : shortlist) {
                if (h.canonicalId.equals(id)) return Optional.of(h);
            }
            return Optional.empty();
        }
        if (NO_MATCH.matcher(r).find()) return Optional.empty();
        throw CollaboratorException.malformed("grounding-reasoner", "expected FOUND: <id> or NO_MATCH");
    }
}
