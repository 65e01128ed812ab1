package org.tessera.compiler.api;

import org.tessera.compiler.diagnostics.Diagnostic;

/**
 * An exception that is thrown when the compilation of a template fails.
 * <p>
 * It is part of the public API and hides the internal exception types of the compiler.
 */
public class CompilationException extends Exception {

    private final transient Diagnostic diagnostic;

    /**
     * Constructs a new compilation exception from an internal template error.
     * @param cause The internal error.
     */
    public CompilationException(TemplateException cause) {
        super(cause.getMessage(), cause);
        this.diagnostic = cause.toDiagnostic();
    }

    /**
     * Constructs a new compilation exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public CompilationException(String message, Throwable cause) {
        super(message, cause);
        this.diagnostic = new Diagnostic(Diagnostic.Type.ERROR, message, null, 0, 0, null, null);
    }

    /**
     * @return The error diagnostic with position, snippet and suggestion.
     */
    public Diagnostic getDiagnostic() {
        return diagnostic;
    }
}
