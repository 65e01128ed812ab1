package org.tessera.compiler.backend.emit;

import org.tessera.compiler.api.UnsupportedNodeException;
import org.tessera.compiler.frontend.parser.ast.AstNode;
import org.tessera.compiler.frontend.parser.ast.ComponentNode;

/**
 * Fallback emitter for node types that must not reach code generation, such as components that
 * were not expanded before compiling.
 */
public final class UnsupportedNodeEmitter implements INodeEmitter<AstNode> {

    @Override
    public void emit(AstNode node, EmitContext ctx) {
        String what = node instanceof ComponentNode component
                ? "Component <" + ctx.compilation().getConfig().elementPrefix() + component.getName() + "> was not expanded"
                : "No emitter registered for node type " + node.getClass().getSimpleName();
        throw new UnsupportedNodeException(what, ctx.compilation().getTemplatePath(), node.getLine(), node.getColumn());
    }
}
