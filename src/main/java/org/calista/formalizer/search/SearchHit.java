package org.calista.formalizer.search;

import java.util.Comparator;
import java.util.Objects;

/**
 * One ranked candidate from the search index.
 * Ordering: ascending distance (closer first), stable tie-break by canonical id.
 */
public final class SearchHit implements Comparable<SearchHit> {

    public static final Comparator<SearchHit> BY_RELEVANCE =
            Comparator.comparingDouble((SearchHit h) -> h.distance).thenComparing(h -> h.canonicalId);

    public final String canonicalId;
    public final String informalDescription;
    public final double distance;

    public SearchHit(String canonicalId, String informalDescription, double distance) {
        this.canonicalId = Objects.requireNonNull(canonicalId, "canonicalId");
        this.informalDescription = informalDescription == null ? "" : informalDescription;
        this.distance = distance;
    }

    public static SearchHit of(String canonicalId, String informalDescription, double distance) {
        return new SearchHit(canonicalId, informalDescription, distance);
    }

    @Override
    public int compareTo(SearchHit o) {
        return BY_RELEVANCE.compare(this, o);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof SearchHit)) return false;
        SearchHit h = (SearchHit) other;
        return canonicalId.equals(h.canonicalId)
                && Double.doubleToLongBits(distance) == Double.doubleToLongBits(h.distance);
    }

    @Override
    public int hashCode() {
        return Objects.hash(canonicalId, Double.doubleToLongBits(distance));
    }

    @Override
    public String toString() {
        return "SearchHit{" + canonicalId + ", d=" + distance + '}';
    }
}
