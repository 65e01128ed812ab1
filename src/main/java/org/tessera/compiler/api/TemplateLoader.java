package org.tessera.compiler.api;

import java.io.IOException;

/**
 * Resolves and loads template sources. Implemented by the embedding host.
 */
public interface TemplateLoader {

    /**
     * Resolves a template reference relative to the template that contains it.
     * @param path The referenced path.
     * @param fromPath The path of the referencing template, or {@code null} for a root template.
     * @return The canonical path.
     */
    String resolve(String path, String fromPath);

    /**
     * Loads the source of a template.
     * @param path A canonical path as returned by {@link #resolve(String, String)}.
     * @return The template source.
     * @throws IOException if the template cannot be read.
     */
    String load(String path) throws IOException;
}
