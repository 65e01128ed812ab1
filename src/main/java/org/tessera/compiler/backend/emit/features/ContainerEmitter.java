package org.tessera.compiler.backend.emit.features;

import org.tessera.compiler.backend.emit.EmitContext;
import org.tessera.compiler.backend.emit.INodeEmitter;
import org.tessera.compiler.frontend.parser.ast.ContainerNode;

/**
 * Emits documents and fragments, which render nothing of their own.
 */
public final class ContainerEmitter implements INodeEmitter<ContainerNode> {

    @Override
    public void emit(ContainerNode node, EmitContext ctx) {
        ctx.emitAll(node.getChildren());
    }
}
