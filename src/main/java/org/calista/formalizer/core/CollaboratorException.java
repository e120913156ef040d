package org.calista.formalizer.core;

/**
 * A call to an external collaborator (search, language model, compiler) did not produce
 * a usable answer. Always recoverable at the call site; see {@link Kind}.
 */
public final class CollaboratorException extends Exception {

    public enum Kind {
        /** Unreachable, timed out, non-success status, process could not start. */
        UNAVAILABLE,
        /** Reachable, but the response did not have the expected shape. */
        MALFORMED_RESPONSE
    }

    private final Kind kind;
    private final String collaborator;

    public CollaboratorException(String collaborator, Kind kind, String message) {
        super(collaborator + ": " + message);
        this.collaborator = collaborator;
        this.kind = kind;
    }

    public CollaboratorException(String collaborator, Kind kind, String message, Throwable cause) {
        super(collaborator + ": " + message, cause);
        this.collaborator = collaborator;
        this.kind = kind;
    }

    public Kind kind() { return kind; }

    public String collaborator() { return collaborator; }

    public static CollaboratorException unavailable(String collaborator, String message, Throwable cause) {
        return new CollaboratorException(collaborator, Kind.UNAVAILABLE, message, cause);
    }

    public static CollaboratorException malformed(String collaborator, String message) {
        return new CollaboratorException(collaborator, Kind.MALFORMED_RESPONSE, message);
    }
}
