package org.tessera.compiler.backend.emit;

import org.tessera.compiler.frontend.parser.ast.AstNode;

/**
 * Emits the Java statements for a specific AST node type.
 * <p>
 * Implementations should be stateless. All output goes through the provided {@link EmitContext}.
 *
 * @param <T> The concrete AST node type handled by this emitter.
 */
public interface INodeEmitter<T extends AstNode> {

    /**
     * Emits the node.
     *
     * @param node The node to emit.
     * @param ctx  The emission context.
     */
    void emit(T node, EmitContext ctx);
}
