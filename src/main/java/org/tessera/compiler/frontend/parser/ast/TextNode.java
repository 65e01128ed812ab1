package org.tessera.compiler.frontend.parser.ast;

/**
 * Literal markup, emitted as-is.
 */
public final class TextNode extends AstNode {

    private final String text;

    public TextNode(String text, int line, int column) {
        super(line, column);
        this.text = text;
    }

    public String getText() {
        return text;
    }

    /**
     * @return {@code true} if the text consists of whitespace only.
     */
    public boolean isBlank() {
        return text.isBlank();
    }
}
