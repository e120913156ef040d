package org.calista.formalizer.plan;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.calista.formalizer.core.CollaboratorException;
import org.calista.formalizer.graph.ConceptGraph;
import org.calista.formalizer.llm.ModelOutputs;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A decomposition proposal from the language model: sub-concept descriptions (blank and
 * duplicate entries dropped, proposal order kept) and the parent's intended statement shape.
 *
 * <p>Accepted reply shapes, optionally fenced:
 * {@code {"subconcepts": [..], "statement_shape": ".."}} or a bare array of strings.
 * Single quotes and trailing commas are tolerated.</p>
 */
public final class Decomposition {

    private static final String NAME = "expansion";

    public final List<String> subconcepts;
    public final String statementShape; // nullable

    public Decomposition(List<String> subconcepts, String statementShape) {
        this.subconcepts = List.copyOf(Objects.requireNonNull(subconcepts, "subconcepts"));
        this.statementShape = statementShape == null || statementShape.isBlank() ? null : statementShape.trim();
    }

    public boolean isEmpty() {
        return subconcepts.isEmpty();
    }

    public static Decomposition parse(ObjectMapper mapper, String reply) throws CollaboratorException {
        String payload = ModelOutputs.extractBlock(reply);
        if (payload.isEmpty()) throw CollaboratorException.malformed(NAME, "empty reply");

        JsonNode root;
        try {
            ObjectReader reader = mapper.reader()
                    .with(JsonReadFeature.ALLOW_SINGLE_QUOTES)
                    .with(JsonReadFeature.ALLOW_TRAILING_COMMA);
            root = reader.readTree(payload);
        } catch (JsonProcessingException e) {
            throw CollaboratorException.malformed(NAME, "not JSON: " + ModelOutputs.oneLine(e.getOriginalMessage(), 160));
        }
        if (root == null || root.isMissingNode()) throw CollaboratorException.malformed(NAME, "empty JSON");

        if (root.isArray()) return new Decomposition(names(root), null);

        if (!root.isObject()) throw CollaboratorException.malformed(NAME, "expected object or array, got " + root.getNodeType());
        JsonNode subs = root.get("subconcepts");
        if (subs == null || subs.isNull()) subs = root.get("sub_concepts");
        if (subs == null || !subs.isArray()) throw CollaboratorException.malformed(NAME, "missing 'subconcepts' array");

        JsonNode shape = root.get("statement_shape");
        if (shape != null && !shape.isNull() && !shape.isTextual()) {
            throw CollaboratorException.malformed(NAME, "'statement_shape' must be a string");
        }
        return new Decomposition(names(subs), shape == null || shape.isNull() ? null : shape.asText());
    }

    private static List<String> names(JsonNode array) throws CollaboratorException {
        List<String> out = new ArrayList<>(array.size());
        Set<String> seen = new LinkedHashSet<>();
        for (JsonNode n : array) {
            if (!n.isTextual()) throw CollaboratorException.malformed(NAME, "sub-concept entries must be strings");
            String s = n.asText().trim();
            if (s.isEmpty()) continue;
            if (seen.add(ConceptGraph.normalize(s))) out.add(s);
        }
        return out;
    }
}
