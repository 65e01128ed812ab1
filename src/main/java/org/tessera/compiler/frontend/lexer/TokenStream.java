package org.tessera.compiler.frontend.lexer;

import java.util.List;

/**
 * A forward-only cursor over the tokens produced by the {@link Lexer}.
 * The cursor never moves past the final {@link TokenType#EOF} token.
 */
public final class TokenStream {

    private final List<Token> tokens;
    private int position = 0;

    /**
     * @param tokens The tokens to read. The last token must be {@link TokenType#EOF}.
     */
    public TokenStream(List<Token> tokens) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.EOF) {
            throw new IllegalArgumentException("Token list must end with EOF");
        }
        this.tokens = List.copyOf(tokens);
    }

    /**
     * @return The token under the cursor.
     */
    public Token current() {
        return tokens.get(position);
    }

    /**
     * Looks ahead without moving the cursor.
     * @param offset The distance from the current token (0 is the current token).
     * @return The token at that distance, or EOF if the stream ends earlier.
     */
    public Token peek(int offset) {
        int index = Math.min(position + offset, tokens.size() - 1);
        return tokens.get(index);
    }

    /**
     * Returns the current token and advances. Sticks at EOF.
     * @return The consumed token.
     */
    public Token consume() {
        Token token = current();
        if (!isEof()) {
            position++;
        }
        return token;
    }

    /**
     * Consumes the current token if it has the expected type.
     * @param type The expected type.
     * @return {@code true} if a token was consumed.
     */
    public boolean consumeIf(TokenType type) {
        if (check(type)) {
            consume();
            return true;
        }
        return false;
    }

    /**
     * @param type The type to test.
     * @return {@code true} if the current token has the given type.
     */
    public boolean check(TokenType type) {
        return current().type() == type;
    }

    /**
     * @return {@code true} if the cursor is at EOF.
     */
    public boolean isEof() {
        return current().type() == TokenType.EOF;
    }
}
