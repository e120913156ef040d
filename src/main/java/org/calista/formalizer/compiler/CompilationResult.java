package org.calista.formalizer.compiler;

import java.util.List;

/** Compiler verdict: success, or failure with at least one diagnostic. */
public final class CompilationResult {

    private static final CompilationResult OK = new CompilationResult(true, List.of());

    public final boolean success;
    public final List<Diagnostic> diagnostics;

    private CompilationResult(boolean success, List<Diagnostic> diagnostics) {
        this.success = success;
        this.diagnostics = List.copyOf(diagnostics);
    }

    public static CompilationResult success() {
        return OK;
    }

    public static CompilationResult failure(List<Diagnostic> diagnostics) {
        if (diagnostics == null || diagnostics.isEmpty()) {
            return new CompilationResult(false, List.of(Diagnostic.of("unknown compilation error")));
        }
        return new CompilationResult(false, diagnostics);
    }

    public static CompilationResult failure(String message) {
        return failure(List.of(Diagnostic.of(message)));
    }

    @Override
    public String toString() {
        return success ? "CompilationResult{ok}" : "CompilationResult{failed, " + diagnostics.size() + " diagnostics}";
    }
}
