package org.tessera.compiler.frontend.parser.ast;

/**
 * Java statements emitted verbatim into the generated render body.
 */
public final class RawCodeNode extends AstNode {

    private final String code;

    public RawCodeNode(String code, int line, int column) {
        super(line, column);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
