package org.tessera.compiler.frontend.parser.ast;

import java.util.List;

/**
 * The root of a template syntax tree.
 */
public final class DocumentNode extends ContainerNode {

    /**
     * @param children The top-level nodes.
     */
    public DocumentNode(List<AstNode> children) {
        super(children, 1, 1);
    }
}
