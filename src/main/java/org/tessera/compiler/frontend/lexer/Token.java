package org.tessera.compiler.frontend.lexer;

/**
 * Represents a single token extracted from the template source by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., TagName, Expression, Text).
 * @param text The text of the token. Expressions and code are already trimmed.
 * @param line The 1-based line number where the token begins.
 * @param column The 1-based column number where the token begins.
 */
public record Token(
        TokenType type,
        String text,
        int line,
        int column
) {
    @Override
    public String toString() {
        return String.format("%s '%s' at %d:%d", type, text, line, column);
    }
}
