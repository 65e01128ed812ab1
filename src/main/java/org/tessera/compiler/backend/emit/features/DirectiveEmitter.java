package org.tessera.compiler.backend.emit.features;

import org.tessera.compiler.backend.emit.EmitContext;
import org.tessera.compiler.backend.emit.INodeEmitter;
import org.tessera.compiler.frontend.parser.ast.DirectiveNode;

/**
 * Rejects directive nodes that survived compilation, e.g. an {@code s:case} outside a switch that
 * was not caught earlier.
 */
public final class DirectiveEmitter implements INodeEmitter<DirectiveNode> {

    @Override
    public void emit(DirectiveNode node, EmitContext ctx) {
        throw ctx.compilation().syntaxError("Directive "
                + ctx.compilation().getConfig().directiveAttribute(node.getName()) + " was not compiled", node);
    }
}
