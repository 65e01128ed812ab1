package org.tessera.compiler.api;

import java.io.IOException;

/**
 * Defines the public interface of the Tessera template compiler.
 */
public interface ITemplateCompiler {

    /**
     * Compiles an in-memory template.
     *
     * @param source The template source.
     * @param templatePath The path used in diagnostics and the debug header, may be {@code null}.
     * @return The generated render body and any warnings.
     * @throws CompilationException if the template is invalid.
     */
    CompiledTemplate compile(String source, String templatePath) throws CompilationException;

    /**
     * Resolves and loads a template through a loader, then compiles it.
     *
     * @param path The template reference.
     * @param loader The loader that resolves and reads the template.
     * @param dependencies The sink receiving every template the compilation consumed.
     * @return The generated render body and any warnings.
     * @throws CompilationException if the template is invalid.
     * @throws IOException if the template cannot be loaded.
     */
    CompiledTemplate compile(String path, TemplateLoader loader, DependencySink dependencies)
            throws CompilationException, IOException;
}
