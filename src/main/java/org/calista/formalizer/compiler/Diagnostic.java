package org.calista.formalizer.compiler;

import java.util.Objects;

/** One compiler message. Line/column are 1-based, 0 when unknown. */
public final class Diagnostic {

    public final String message;
    public final int line;
    public final int column;

    public Diagnostic(String message, int line, int column) {
        this.message = Objects.requireNonNull(message, "message");
        this.line = Math.max(0, line);
        this.column = Math.max(0, column);
    }

    public static Diagnostic of(String message) {
        return new Diagnostic(message, 0, 0);
    }

    public boolean hasLocation() {
        return line > 0;
    }

    /** {@code line:col: message} or just the message. */
    public String render() {
        return hasLocation() ? line + ":" + column + ": " + message : message;
    }

    @Override
    public String toString() {
        return render();
    }
}
