package org.tessera.compiler.frontend.parser;

import org.tessera.compiler.frontend.lexer.Token;
import org.tessera.compiler.frontend.lexer.TokenType;
import org.tessera.compiler.frontend.parser.ast.AttributeNode;
import org.tessera.compiler.frontend.parser.ast.AttributePart;
import org.tessera.compiler.frontend.parser.ast.AttributeValue;
import org.tessera.compiler.frontend.parser.ast.OutputNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses the attribute list of a start tag, up to (not including) its {@link TokenType#TAG_CLOSE}.
 */
public class AttributeParser {

    private final ParsingContext context;

    /**
     * @param context The parsing context providing the token cursor.
     */
    public AttributeParser(ParsingContext context) {
        this.context = context;
    }

    /**
     * Parses all attributes of the current tag. Unexpected tokens are skipped with a warning.
     * An output region in attribute position becomes a spread attribute.
     *
     * @return The attributes in source order.
     */
    public List<AttributeNode> parseAttributes() {
        List<AttributeNode> attributes = new ArrayList<>();
        while (!context.isAtEnd() && !context.check(TokenType.TAG_CLOSE) && !context.check(TokenType.TAG_OPEN)) {
            Token token = context.peek();
            if (token.type() == TokenType.ATTRIBUTE_NAME) {
                context.advance();
                AttributeValue value = context.match(TokenType.EQUALS) ? parseValue(token) : AttributeValue.BOOLEAN;
                attributes.add(new AttributeNode(token.text(), value, token.line(), token.column()));
            } else if (token.type() == TokenType.OUTPUT_OPEN) {
                OutputNode output = context.parseOutput();
                if (output != null) {
                    attributes.add(new AttributeNode("", AttributeValue.ofOutput(output), token.line(), token.column()));
                }
            } else {
                context.warn("Unexpected " + token.type() + " in tag", token);
                context.advance();
            }
        }
        return attributes;
    }

    private AttributeValue parseValue(Token name) {
        if (context.check(TokenType.ATTRIBUTE_VALUE_UNQUOTED)) {
            return AttributeValue.ofStatic(context.advance().text());
        }
        if (context.check(TokenType.OUTPUT_OPEN)) {
            OutputNode output = context.parseOutput();
            return output == null ? AttributeValue.ofStatic("") : AttributeValue.ofOutput(output);
        }
        if (!context.match(TokenType.QUOTE_OPEN)) {
            context.warn("Missing value for attribute '" + name.text() + "'", name);
            return AttributeValue.ofStatic("");
        }

        List<AttributePart> parts = new ArrayList<>();
        while (!context.isAtEnd()) {
            if (context.check(TokenType.ATTRIBUTE_TEXT)) {
                parts.add(new AttributePart.Literal(context.advance().text()));
            } else if (context.check(TokenType.OUTPUT_OPEN)) {
                OutputNode output = context.parseOutput();
                if (output != null) {
                    parts.add(new AttributePart.Dynamic(output));
                }
            } else {
                break;
            }
        }
        if (!context.match(TokenType.QUOTE_CLOSE)) {
            context.warn("Unterminated value of attribute '" + name.text() + "'", name);
        }
        return AttributeValue.of(parts);
    }
}
