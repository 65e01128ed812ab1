package org.tessera.compiler.frontend.parser.ast;

/**
 * The unparsed body of a raw element, written to the output verbatim.
 */
public final class RawBodyNode extends AstNode {

    private final String content;

    public RawBodyNode(String content, int line, int column) {
        super(line, column);
        this.content = content;
    }

    public String getContent() {
        return content;
    }
}
