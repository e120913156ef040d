package org.calista.formalizer.search;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.formalizer.core.CollaboratorException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * LeanSearch result format, shared by the web API and the local search script.
 *
 * <p>A JSON array whose first element is the hit list for the query (a flat hit list is
 * accepted too); every hit is
 * {@code {"result": {"name": [..] | "..", "informal_description", "docstring"}, "distance"}}.</p>
 */
final class SearchResponses {

    private static final Logger log = LogManager.getLogger(SearchResponses.class);
    private static final String TRANSLATION_FAILED = "[TRANSLATION_FAILED]";

    private SearchResponses() {
    }

    static List<SearchHit> parse(ObjectMapper mapper, String name, String body) throws CollaboratorException {
        if (body == null || body.isBlank()) throw CollaboratorException.malformed(name, "empty body");

        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (IOException e) {
            throw CollaboratorException.malformed(name, "not JSON: " + e.getMessage());
        }
        if (root == null || !root.isArray()) throw CollaboratorException.malformed(name, "expected JSON array");
        if (root.isEmpty()) return List.of();

        JsonNode list = root.get(0).isArray() ? root.get(0) : root;
        ArrayList<SearchHit> out = new ArrayList<>(list.size());
        int skipped = 0;

        for (JsonNode hit : (ArrayNode) list) {
            SearchHit h = toHit(hit);
            if (h == null) skipped++;
            else out.add(h);
        }

        if (out.isEmpty() && skipped > 0) {
            throw CollaboratorException.malformed(name, "no well-formed hit among " + skipped);
        }
        if (skipped > 0) log.warn("{}: skipped {} malformed hits", name, skipped);

        out.sort(SearchHit.BY_RELEVANCE);
        return List.copyOf(out);
    }

    private static SearchHit toHit(JsonNode hit) {
        if (hit == null || !hit.isObject()) return null;
        JsonNode result = hit.has("result") ? hit.get("result") : hit;
        if (!result.isObject()) return null;

        String name = nameOf(result.get("name"));
        if (name == null || name.isBlank()) return null;

        JsonNode d = hit.has("distance") ? hit.get("distance") : result.get("distance");
        if (d == null || !d.isNumber()) return null;

        String desc = text(result.get("informal_description"));
        if (desc == null || desc.isBlank() || desc.contains(TRANSLATION_FAILED)) {
            String doc = text(result.get("docstring"));
            desc = doc == null ? "" : "(Docstring): " + (doc.length() > 150 ? doc.substring(0, 150) + "..." : doc);
        }
        return new SearchHit(name, desc, d.asDouble());
    }

    private static String nameOf(JsonNode n) {
        if (n == null || n.isNull()) return null;
        if (n.isArray()) {
            StringBuilder sb = new StringBuilder();
            for (JsonNode part : n) {
                if (sb.length() > 0) sb.append('.');
                sb.append(part.asText());
            }
            return sb.toString();
        }
        return n.asText();
    }

    private static String text(JsonNode n) {
        return (n == null || n.isNull()) ? null : n.asText();
    }
}
