package org.tessera.compiler.frontend.parser;

import org.tessera.compiler.config.CompilerConfig;
import org.tessera.compiler.diagnostics.DiagnosticsEngine;
import org.tessera.compiler.frontend.lexer.Token;
import org.tessera.compiler.frontend.lexer.TokenType;
import org.tessera.compiler.frontend.parser.ast.OutputNode;

/**
 * Provides helper parsers (such as the {@link AttributeParser}) with access to the token cursor
 * and the shared parsing services.
 */
public interface ParsingContext {

    /**
     * Checks if the current token matches any of the given types and consumes it if so.
     * @param types The token types to match.
     * @return {@code true} if a match was found and consumed, otherwise {@code false}.
     */
    boolean match(TokenType... types);

    /**
     * Checks if the current token is of the given type, without consuming it.
     * @param type The token type to check.
     * @return {@code true} if the current token is of the given type, otherwise {@code false}.
     */
    boolean check(TokenType type);

    /**
     * Consumes the current token and returns it.
     * @return The consumed token.
     */
    Token advance();

    /**
     * Returns the current token without consuming it.
     * @return The current token.
     */
    Token peek();

    /**
     * Parses an output region starting at the current {@link TokenType#OUTPUT_OPEN} token.
     * @return The output node, or {@code null} if the region has no expression.
     */
    OutputNode parseOutput();

    /**
     * Reports a recoverable problem at the given token.
     * @param message The warning message.
     * @param at The token the warning refers to.
     */
    void warn(String message, Token at);

    /**
     * @return The diagnostics engine for reporting warnings.
     */
    DiagnosticsEngine getDiagnostics();

    /**
     * @return The compiler configuration.
     */
    CompilerConfig getConfig();

    /**
     * Checks if the parser has reached the end of the token stream.
     * @return {@code true} if the end has been reached, otherwise {@code false}.
     */
    boolean isAtEnd();
}
