package org.tessera.compiler.api;

import org.tessera.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * The result of a successful compilation.
 *
 * @param templatePath The template path, or {@code null} for in-memory templates.
 * @param source The generated Java render body.
 * @param diagnostics The warnings collected while compiling.
 */
public record CompiledTemplate(
        String templatePath,
        String source,
        List<Diagnostic> diagnostics
) {
    public CompiledTemplate {
        diagnostics = List.copyOf(diagnostics);
    }
}
