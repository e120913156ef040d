package org.calista.formalizer.align;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of the semantic consistency check. {@code level_1} and {@code level_2} count as
 * consistent; anything unreadable is {@code level_3}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class AlignmentReport {

    public static final String LEVEL_1 = "level_1";
    public static final String LEVEL_2 = "level_2";
    public static final String LEVEL_3 = "level_3";

    public String consistencyLevel = LEVEL_3;
    public List<String> discrepancies = new ArrayList<>();
    public List<String> recommendations = new ArrayList<>();
    /** Back-translation per concept, build order. */
    public Map<String, String> segments = new LinkedHashMap<>();
    public String mergedBackTranslation = "";
    public String error; // nullable

    public boolean isConsistent() {
        return LEVEL_1.equals(consistencyLevel) || LEVEL_2.equals(consistencyLevel);
    }

    static AlignmentReport failed(String error) {
        AlignmentReport r = new AlignmentReport();
        r.error = error;
        return r;
    }

    @Override
    public String toString() {
        return "AlignmentReport{" + consistencyLevel + ", discrepancies=" + discrepancies.size()
                + (error == null ? "" : ", error=" + error) + '}';
    }
}
