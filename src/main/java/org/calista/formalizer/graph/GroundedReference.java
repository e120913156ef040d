package org.calista.formalizer.graph;

import java.util.Objects;

/**
 * Where a grounded concept lives: a library declaration found by search, or a
 * previously verified block from the local knowledge base (which carries its code).
 */
public final class GroundedReference {

    public enum Source { LIBRARY, VERIFIED_KB }

    public final String canonicalId;
    public final String informalDescription;
    /** Relevance distance reported by search (lower is closer); NaN for knowledge base hits. */
    public final double distance;
    public final Source source;
    /** Only for {@link Source#VERIFIED_KB}. */
    public final String code;

    private GroundedReference(String canonicalId, String informalDescription, double distance, Source source, String code) {
        this.canonicalId = Objects.requireNonNull(canonicalId, "canonicalId");
        this.informalDescription = informalDescription == null ? "" : informalDescription;
        this.distance = distance;
        this.source = Objects.requireNonNull(source, "source");
        this.code = code;
    }

    public static GroundedReference library(String canonicalId, String informalDescription, double distance) {
        return new GroundedReference(canonicalId, informalDescription, distance, Source.LIBRARY, null);
    }

    public static GroundedReference verified(String key, String code) {
        return new GroundedReference(key, "verified knowledge base entry", Double.NaN, Source.VERIFIED_KB,
                Objects.requireNonNull(code, "code"));
    }

    public boolean isLibrary() {
        return source == Source.LIBRARY;
    }

    @Override
    public String toString() {
        return "GroundedReference{" + source + ":" + canonicalId
                + (Double.isNaN(distance) ? "" : ", d=" + distance) + '}';
    }
}
