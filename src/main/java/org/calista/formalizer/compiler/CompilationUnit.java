package org.calista.formalizer.compiler;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * One formal source unit plus the dependency blocks that must be in scope.
 * {@link #render()} is the exact text handed to the compiler.
 */
public final class CompilationUnit {

    public final List<String> imports;
    public final List<String> dependencyBlocks;
    public final String source;

    public CompilationUnit(List<String> imports, List<String> dependencyBlocks, String source) {
        this.imports = imports == null ? List.of() : List.copyOf(new LinkedHashSet<>(imports));
        this.dependencyBlocks = dependencyBlocks == null ? List.of() : List.copyOf(dependencyBlocks);
        this.source = Objects.requireNonNull(source, "source");
    }

    public String render() {
        List<String> parts = new ArrayList<>(3);
        if (!imports.isEmpty()) parts.add(String.join("\n", imports));
        if (!dependencyBlocks.isEmpty()) parts.add(String.join("\n\n", dependencyBlocks));
        if (!source.isBlank()) parts.add(source);
        return String.join("\n\n", parts) + "\n";
    }
}
