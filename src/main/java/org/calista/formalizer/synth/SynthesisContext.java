package org.calista.formalizer.synth;

import org.calista.formalizer.compiler.Diagnostic;
import org.calista.formalizer.graph.ConceptNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * State carried from one attempt to the next within one worker: the last candidate that
 * reached the compiler and every problem found since. The worker's first attempt uses the
 * synthesis prompt; every later one reflects on this state.
 */
public final class SynthesisContext {

    public final ConceptNode node;
    public final DependencyScope scope;

    private int attempt;
    private int workerAttempts;
    private String lastCandidate = "";
    private List<String> lastDiagnostics = List.of();

    public SynthesisContext(ConceptNode node, DependencyScope scope) {
        this.node = Objects.requireNonNull(node, "node");
        this.scope = Objects.requireNonNull(scope, "scope");
    }

    void beginAttempt(int attemptNumber) {
        this.attempt = attemptNumber;
        this.workerAttempts++;
    }

    public int attempt() {
        return attempt;
    }

    /** Attempts this worker has started, the current one included. */
    public int workerAttempts() {
        return workerAttempts;
    }

    /** True after any recorded problem, whether or not a candidate came with it. */
    public boolean isReflection() {
        return workerAttempts > 1 && !lastDiagnostics.isEmpty();
    }

    public String lastCandidate() {
        return lastCandidate;
    }

    public List<String> lastDiagnostics() {
        return lastDiagnostics;
    }

    void recordCompiled(String candidate) {
        this.lastCandidate = candidate;
        this.lastDiagnostics = List.of();
    }

    void recordCompileFailure(String candidate, List<Diagnostic> diagnostics) {
        List<String> d = new ArrayList<>(diagnostics.size());
        for (Diagnostic x : diagnostics) d.add(x.render());
        if (d.isEmpty()) d.add("compilation failed without diagnostics");
        this.lastCandidate = candidate;
        this.lastDiagnostics = List.copyOf(d);
    }

    /**
     * A problem without a new candidate (empty reply, rejected meaning). The last compiled-against
     * candidate and its diagnostics stay; the problem is added after them.
     */
    void recordProblem(String problem) {
        List<String> d = new ArrayList<>(lastDiagnostics);
        if (d.isEmpty() || !d.get(d.size() - 1).equals(problem)) d.add(problem);
        this.lastDiagnostics = List.copyOf(d);
    }

    /** Diagnostics as prompt text, cut to {@code maxChars}. */
    String diagnosticsText(int maxChars) {
        String all = String.join("\n", lastDiagnostics);
        if (all.length() <= maxChars) return all;
        return all.substring(0, Math.max(0, maxChars - 16)) + "\n... (truncated)";
    }
}
