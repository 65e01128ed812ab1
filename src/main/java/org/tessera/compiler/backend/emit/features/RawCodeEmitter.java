package org.tessera.compiler.backend.emit.features;

import org.tessera.compiler.backend.emit.EmitContext;
import org.tessera.compiler.backend.emit.INodeEmitter;
import org.tessera.compiler.frontend.parser.ast.RawCodeNode;

/**
 * Emits Java code blocks and directive-generated code verbatim.
 */
public final class RawCodeEmitter implements INodeEmitter<RawCodeNode> {

    @Override
    public void emit(RawCodeNode node, EmitContext ctx) {
        String code = node.getCode().strip();
        if (!code.isEmpty()) {
            ctx.writer().statement(code);
        }
    }
}
