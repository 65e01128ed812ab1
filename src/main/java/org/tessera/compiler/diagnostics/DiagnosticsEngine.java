package org.tessera.compiler.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the non-fatal diagnostics (parser recovery warnings) of one compilation.
 * <p>
 * Fatal problems are raised as {@link org.tessera.compiler.api.TemplateException}s instead;
 * this engine only keeps what the compiler could recover from.
 */
public class DiagnosticsEngine {

    private final String fileName;
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * @param fileName The template path the diagnostics refer to, may be {@code null}.
     */
    public DiagnosticsEngine(String fileName) {
        this.fileName = fileName;
    }

    /**
     * @return The template path the diagnostics refer to, may be {@code null}.
     */
    public String getFileName() {
        return fileName;
    }

    /**
     * Reports a warning.
     *
     * @param message The warning message.
     * @param line    The line of the warning.
     * @param column  The column of the warning.
     */
    public void reportWarning(String message, int line, int column) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, message, fileName, line, column, null, null));
        CompilerLogger.debug("{}:{}:{}: {}", fileName, line, column, message);
    }

    /**
     * Records an already built diagnostic.
     * @param diagnostic The diagnostic.
     */
    public void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
