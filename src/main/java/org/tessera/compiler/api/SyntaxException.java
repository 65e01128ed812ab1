package org.tessera.compiler.api;

/**
 * Thrown for malformed directive usage: unknown directive names, missing loop clauses,
 * invalid switch structure and similar problems found while compiling a template.
 */
public class SyntaxException extends TemplateException {

    /**
     * @param message The detail message.
     * @param templatePath The template path, may be {@code null}.
     * @param line The 1-based line.
     * @param column The 1-based column.
     * @param snippet The rendered source excerpt, may be {@code null}.
     * @param suggestion A suggested correction, may be {@code null}.
     */
    public SyntaxException(String message, String templatePath, int line, int column, String snippet, String suggestion) {
        super(message, templatePath, line, column, snippet, suggestion, null);
    }
}
