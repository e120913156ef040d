package org.calista.formalizer.compiler;

import org.calista.formalizer.core.CollaboratorException;

/**
 * Compiler collaborator. Every call is isolated: nothing persists between calls beyond
 * what the unit carries, and concurrent calls with distinct request ids never share a
 * scratch compilation unit.
 */
public interface CompilerClient {

    /**
     * @param requestId unique per in-flight attempt
     * @throws CollaboratorException when the toolchain cannot be run at all
     *         (a type error is a {@link CompilationResult#failure}, not an exception)
     */
    CompilationResult check(CompilationUnit unit, String requestId) throws CollaboratorException;
}
