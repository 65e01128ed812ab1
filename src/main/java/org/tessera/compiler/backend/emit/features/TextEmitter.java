package org.tessera.compiler.backend.emit.features;

import org.tessera.compiler.backend.emit.EmitContext;
import org.tessera.compiler.backend.emit.INodeEmitter;
import org.tessera.compiler.frontend.parser.ast.TextNode;

public final class TextEmitter implements INodeEmitter<TextNode> {

    @Override
    public void emit(TextNode node, EmitContext ctx) {
        ctx.writer().literal(node.getText());
    }
}
