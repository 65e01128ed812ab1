package org.tessera.compiler.api;

import org.tessera.compiler.diagnostics.Diagnostic;

/**
 * Base class of all fatal template compilation errors.
 * <p>
 * Carries the exact source position of the problem. The message returned by
 * {@link #getMessage()} is formatted as {@code message (template: path line:L column:C)};
 * the unformatted text is available from {@link #getRawMessage()}.
 */
public class TemplateException extends RuntimeException {

    private final String rawMessage;
    private final String templatePath;
    private final int line;
    private final int column;
    private final String snippet;
    private final String suggestion;

    /**
     * Constructs an exception without source position.
     * @param message The detail message.
     */
    public TemplateException(String message) {
        this(message, null, 0, 0, null, null, null);
    }

    /**
     * Constructs an exception with full positional information.
     * @param message The detail message.
     * @param templatePath The template path, may be {@code null}.
     * @param line The 1-based line, 0 if unknown.
     * @param column The 1-based column, 0 if unknown.
     * @param snippet The rendered source excerpt, may be {@code null}.
     * @param suggestion A suggested correction, may be {@code null}.
     * @param cause The cause, may be {@code null}.
     */
    public TemplateException(String message, String templatePath, int line, int column,
                             String snippet, String suggestion, Throwable cause) {
        super(format(message, templatePath, line, column), cause);
        this.rawMessage = message;
        this.templatePath = templatePath;
        this.line = line;
        this.column = column;
        this.snippet = snippet == null || snippet.isEmpty() ? null : snippet;
        this.suggestion = suggestion;
    }

    private static String format(String message, String templatePath, int line, int column) {
        if (templatePath == null) {
            return message;
        }
        StringBuilder location = new StringBuilder("template: ").append(templatePath);
        if (line > 0) {
            location.append(" line:").append(line);
        }
        if (column > 0) {
            location.append(" column:").append(column);
        }
        return message + " (" + location + ")";
    }

    /**
     * @return The message without the location suffix.
     */
    public String getRawMessage() {
        return rawMessage;
    }

    /**
     * @return The template path, or {@code null}.
     */
    public String getTemplatePath() {
        return templatePath;
    }

    /**
     * @return The 1-based line, 0 if unknown.
     */
    public int getLine() {
        return line;
    }

    /**
     * @return The 1-based column, 0 if unknown.
     */
    public int getColumn() {
        return column;
    }

    /**
     * @return The rendered source excerpt, or {@code null}.
     */
    public String getSnippet() {
        return snippet;
    }

    /**
     * @return The suggested correction, or {@code null}.
     */
    public String getSuggestion() {
        return suggestion;
    }

    /**
     * Converts this exception into an error diagnostic.
     * @return The diagnostic.
     */
    public Diagnostic toDiagnostic() {
        return new Diagnostic(Diagnostic.Type.ERROR, rawMessage, templatePath, line, column, snippet, suggestion);
    }
}
