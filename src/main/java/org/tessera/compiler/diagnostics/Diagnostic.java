package org.tessera.compiler.diagnostics;

/**
 * Represents a single diagnostic message (error, warning, info)
 * that occurs during the compilation of a template.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param message The diagnostic message.
 * @param fileName The template path, or {@code null} for in-memory templates.
 * @param lineNumber The 1-based line of the issue, 0 if unknown.
 * @param column The 1-based column of the issue, 0 if unknown.
 * @param snippet The rendered source excerpt, or {@code null}.
 * @param suggestion A suggested correction, or {@code null}.
 */
public record Diagnostic(
        Type type,
        String message,
        String fileName,
        int lineNumber,
        int column,
        String snippet,
        String suggestion
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that prevents compilation. */
        ERROR,
        /** A warning that does not prevent compilation. */
        WARNING,
        /** An informational message. */
        INFO
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d:%d: %s", type, fileName == null ? "<memory>" : fileName,
                lineNumber, column, message);
    }
}
