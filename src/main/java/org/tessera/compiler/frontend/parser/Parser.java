package org.tessera.compiler.frontend.parser;

import org.tessera.compiler.api.SyntaxException;
import org.tessera.compiler.config.CompilerConfig;
import org.tessera.compiler.diagnostics.DiagnosticsEngine;
import org.tessera.compiler.frontend.lexer.Token;
import org.tessera.compiler.frontend.lexer.TokenStream;
import org.tessera.compiler.frontend.lexer.TokenType;
import org.tessera.compiler.frontend.parser.ast.AstNode;
import org.tessera.compiler.frontend.parser.ast.AttributeNode;
import org.tessera.compiler.frontend.parser.ast.ComponentNode;
import org.tessera.compiler.frontend.parser.ast.DocumentNode;
import org.tessera.compiler.frontend.parser.ast.ElementNode;
import org.tessera.compiler.frontend.parser.ast.FragmentNode;
import org.tessera.compiler.frontend.parser.ast.OutputContext;
import org.tessera.compiler.frontend.parser.ast.OutputNode;
import org.tessera.compiler.frontend.parser.ast.RawBodyNode;
import org.tessera.compiler.frontend.parser.ast.RawCodeNode;
import org.tessera.compiler.frontend.parser.ast.TextNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * The Parser builds the template syntax tree from the token stream.
 * <p>
 * It is a recursive-descent parser with one token of lookahead and no backtracking. Invalid
 * token sequences are skipped with a warning instead of aborting, so a single bad tag does not
 * break the whole document; semantic validation is left to the directive compilers.
 */
public class Parser implements ParsingContext {

    private final TokenStream tokens;
    private final CompilerConfig config;
    private final DiagnosticsEngine diagnostics;
    private final AttributeParser attributeParser;
    private final Deque<String> openTags = new ArrayDeque<>();

    /**
     * Creates a new parser.
     * @param tokens The tokens produced by the lexer.
     * @param config The compiler configuration (fragment and component naming).
     * @param diagnostics The engine collecting recovery warnings.
     */
    public Parser(List<Token> tokens, CompilerConfig config, DiagnosticsEngine diagnostics) {
        this.tokens = new TokenStream(tokens);
        this.config = config;
        this.diagnostics = diagnostics;
        this.attributeParser = new AttributeParser(this);
    }

    /**
     * Parses the whole token stream.
     * @return The document root.
     */
    public DocumentNode parse() {
        return new DocumentNode(parseNodes(null));
    }

    private List<AstNode> parseNodes(String closingTag) {
        List<AstNode> nodes = new ArrayList<>();
        while (!isAtEnd()) {
            if (check(TokenType.TAG_OPEN) && tokens.peek(1).type() == TokenType.SLASH) {
                Token nameToken = tokens.peek(2);
                String name = nameToken.type() == TokenType.TAG_NAME ? nameToken.text() : "";
                if (name.equalsIgnoreCase(closingTag)) {
                    skipClosingTag();
                    return nodes;
                }
                if (closesAncestor(name)) {
                    warn("Missing closing tag for <" + closingTag + ">", peek());
                    return nodes;
                }
                warn("Unexpected closing tag </" + name + ">", peek());
                skipClosingTag();
                continue;
            }
            AstNode node = parseNode();
            if (node != null) {
                nodes.add(node);
            }
        }
        if (closingTag != null) {
            warn("Unclosed element <" + closingTag + ">", peek());
        }
        return nodes;
    }

    private AstNode parseNode() {
        Token token = peek();
        return switch (token.type()) {
            case TEXT, SPECIAL_TAG -> {
                advance();
                yield new TextNode(token.text(), token.line(), token.column());
            }
            case COMMENT -> {
                advance();
                yield config.passThroughComments() ? new TextNode(token.text(), token.line(), token.column()) : null;
            }
            case RAW_BODY -> {
                advance();
                yield new RawBodyNode(token.text(), token.line(), token.column());
            }
            case OUTPUT_OPEN -> parseOutput();
            case CODE_BLOCK_OPEN -> parseCodeBlock();
            case TAG_OPEN -> parseTag();
            default -> {
                warn("Unexpected " + token.type(), token);
                advance();
                yield null;
            }
        };
    }

    private AstNode parseCodeBlock() {
        advance();
        if (!check(TokenType.CODE)) {
            return null;
        }
        Token code = advance();
        return new RawCodeNode(code.text(), code.line(), code.column());
    }

    private AstNode parseTag() {
        Token open = advance();
        if (!check(TokenType.TAG_NAME)) {
            warn("Expected a tag name", open);
            return null;
        }
        String name = advance().text();
        List<AttributeNode> attributes = attributeParser.parseAttributes();

        boolean selfClosing = false;
        if (check(TokenType.TAG_CLOSE)) {
            selfClosing = advance().text().equals("/>");
        } else {
            warn("Unterminated tag <" + name + ">", open);
        }

        List<AstNode> children = selfClosing ? List.of() : parseChildren(name, open);
        int line = open.line();
        int column = open.column();
        if (name.equalsIgnoreCase(config.fragmentElement())) {
            return new FragmentNode(attributes, children, line, column);
        }
        if (name.startsWith(config.elementPrefix()) && name.length() > config.elementPrefix().length()) {
            return new ComponentNode(name.substring(config.elementPrefix().length()), attributes, children, line, column);
        }
        return new ElementNode(name, attributes, children, selfClosing, line, column);
    }

    private List<AstNode> parseChildren(String tagName, Token open) {
        if (openTags.size() >= config.maxDepth()) {
            throw new SyntaxException("Template nesting exceeds the maximum depth of " + config.maxDepth(),
                    diagnostics.getFileName(), open.line(), open.column(), null, null);
        }
        openTags.push(tagName);
        try {
            return parseNodes(tagName);
        } finally {
            openTags.pop();
        }
    }

    private boolean closesAncestor(String name) {
        return openTags.stream().anyMatch(tag -> tag.equalsIgnoreCase(name));
    }

    private void skipClosingTag() {
        advance();
        while (!isAtEnd() && !check(TokenType.TAG_CLOSE) && !check(TokenType.TAG_OPEN)) {
            advance();
        }
        match(TokenType.TAG_CLOSE);
    }

    @Override
    public OutputNode parseOutput() {
        Token open = advance();
        String expression = check(TokenType.EXPRESSION) ? advance().text() : "";
        if (!match(TokenType.OUTPUT_CLOSE)) {
            warn("Unterminated output expression", open);
        }
        if (expression.isEmpty()) {
            warn("Empty output expression", open);
            return null;
        }
        PipeChain chain = PipeParser.parse(expression);
        OutputContext context = chain.json() ? OutputContext.JSON : chain.raw() ? OutputContext.RAW : OutputContext.HTML;
        return new OutputNode(chain.expression(), !chain.raw(), context, chain.filters(), open.line(), open.column());
    }

    @Override
    public boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean check(TokenType type) {
        return tokens.check(type);
    }

    @Override
    public Token advance() {
        return tokens.consume();
    }

    @Override
    public Token peek() {
        return tokens.current();
    }

    @Override
    public void warn(String message, Token at) {
        diagnostics.reportWarning(message, at.line(), at.column());
    }

    @Override
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    @Override
    public CompilerConfig getConfig() {
        return config;
    }

    @Override
    public boolean isAtEnd() {
        return tokens.isEof();
    }
}
