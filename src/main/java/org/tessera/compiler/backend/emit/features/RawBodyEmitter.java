package org.tessera.compiler.backend.emit.features;

import org.tessera.compiler.backend.emit.EmitContext;
import org.tessera.compiler.backend.emit.INodeEmitter;
import org.tessera.compiler.frontend.parser.ast.RawBodyNode;

/**
 * Emits the body of a raw region verbatim, as markup.
 */
public final class RawBodyEmitter implements INodeEmitter<RawBodyNode> {

    @Override
    public void emit(RawBodyNode node, EmitContext ctx) {
        ctx.writer().literal(node.getContent());
    }
}
