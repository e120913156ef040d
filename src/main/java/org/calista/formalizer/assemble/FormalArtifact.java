package org.calista.formalizer.assemble;

import java.util.List;

/** The assembled formal file plus a few counters for the report. */
public final class FormalArtifact {

    public final String text;
    public final List<String> imports;
    public final int synthesized;
    public final int failed;
    public final int grounded;

    FormalArtifact(String text, List<String> imports, int synthesized, int failed, int grounded) {
        this.text = text;
        this.imports = List.copyOf(imports);
        this.synthesized = synthesized;
        this.failed = failed;
        this.grounded = grounded;
    }

    /** No placeholder in the file. */
    public boolean isComplete() {
        return failed == 0;
    }
}
