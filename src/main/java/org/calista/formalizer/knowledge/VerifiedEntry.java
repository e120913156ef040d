package org.calista.formalizer.knowledge;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.calista.formalizer.graph.ConceptGraph;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * VerifiedEntry — a code block that compiled and passed semantic alignment in an
 * earlier run, keyed by the normalized concept description.
 *
 * <p>Public fields for Jackson; {@link #validate()} normalizes.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class VerifiedEntry {

    /** Normalized description ({@link ConceptGraph#normalize(String)}). */
    public String key;

    /** Description as it was written when verified. */
    public String description;

    public String code;

    /** Keys of the entries this code needs in scope. */
    public List<String> deps = List.of();

    public long createdAtEpochMs = 0L;
    public long updatedAtEpochMs = 0L;

    public static VerifiedEntry of(String description, String code, List<String> depDescriptions) {
        VerifiedEntry e = new VerifiedEntry();
        e.description = description;
        e.key = ConceptGraph.normalize(description);
        e.code = code;
        ArrayList<String> d = new ArrayList<>();
        if (depDescriptions != null) for (String x : depDescriptions) d.add(ConceptGraph.normalize(x));
        e.deps = d;
        return e;
    }

    public void validate() {
        if (key == null || key.isBlank()) {
            if (description == null || description.isBlank()) {
                throw new IllegalArgumentException("VerifiedEntry.key is required");
            }
            key = description;
        }
        key = ConceptGraph.normalize(key);
        if (code == null || code.isBlank()) throw new IllegalArgumentException("VerifiedEntry.code is required: " + key);
        if (description == null || description.isBlank()) description = key;

        if (deps == null || deps.isEmpty()) {
            deps = List.of();
        } else {
            LinkedHashSet<String> norm = new LinkedHashSet<>();
            for (String d : deps) {
                String x = ConceptGraph.normalize(d);
                if (!x.isEmpty() && !x.equals(key)) norm.add(x);
            }
            deps = norm.isEmpty() ? List.of() : new ArrayList<>(norm);
        }

        long now = System.currentTimeMillis();
        if (createdAtEpochMs <= 0L) createdAtEpochMs = now;
        if (updatedAtEpochMs < createdAtEpochMs) updatedAtEpochMs = createdAtEpochMs;
    }
}
