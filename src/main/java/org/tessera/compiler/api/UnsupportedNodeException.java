package org.tessera.compiler.api;

/**
 * Thrown by the code generator when it meets a node it has no rule for.
 * This indicates a node that an earlier stage should have rewritten.
 */
public class UnsupportedNodeException extends TemplateException {

    /**
     * @param message The detail message.
     * @param templatePath The template path, may be {@code null}.
     * @param line The 1-based line.
     * @param column The 1-based column.
     */
    public UnsupportedNodeException(String message, String templatePath, int line, int column) {
        super(message, templatePath, line, column, null, null, null);
    }
}
