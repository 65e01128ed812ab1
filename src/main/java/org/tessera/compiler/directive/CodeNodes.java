package org.tessera.compiler.directive;

import org.tessera.compiler.frontend.parser.ast.AstNode;
import org.tessera.compiler.frontend.parser.ast.RawCodeNode;

/**
 * Factory for generated code nodes positioned at their originating node.
 */
public final class CodeNodes {

    private CodeNodes() {}

    /**
     * @param code The Java statements.
     * @param origin The node the statements are generated for.
     * @return A raw code node at the origin's position.
     */
    public static RawCodeNode raw(String code, AstNode origin) {
        return new RawCodeNode(code, origin.getLine(), origin.getColumn());
    }
}
