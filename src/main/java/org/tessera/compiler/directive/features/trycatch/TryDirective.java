package org.tessera.compiler.directive.features.trycatch;

import org.tessera.compiler.directive.CodeNodes;
import org.tessera.compiler.directive.DirectiveDescriptor;
import org.tessera.compiler.directive.DirectiveType;
import org.tessera.compiler.directive.ElementClaim;
import org.tessera.compiler.directive.IDirectiveCompiler;
import org.tessera.compiler.frontend.parser.ast.AstNode;
import org.tessera.compiler.frontend.parser.ast.DirectiveNode;
import org.tessera.compiler.pipeline.CompilationContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Compiles {@code s:try}.
 * <p>
 * With a paired {@code s:finally} sibling the result is a {@code try/finally}; without one, runtime
 * failures inside the host are caught and the host renders nothing further.
 */
public class TryDirective implements IDirectiveCompiler {

    private static final DirectiveDescriptor DESCRIPTOR = DirectiveDescriptor.builder()
            .pairedWith("finally")
            .elementClaim(ElementClaim.bare())
            .build();

    @Override
    public List<AstNode> compile(DirectiveNode node, CompilationContext context) {
        List<AstNode> out = new ArrayList<>();
        out.add(CodeNodes.raw("try {", node));
        out.addAll(node.getChildren());
        if (node.getPairedSibling().isPresent()) {
            DirectiveNode fin = node.getPairedSibling().get();
            out.add(CodeNodes.raw("} finally {", fin));
            out.addAll(fin.getChildren());
            out.add(CodeNodes.raw("}", node));
        } else {
            String ignored = context.freshVariable("ignored");
            out.add(CodeNodes.raw("} catch (java.lang.RuntimeException " + ignored + ") {\n}", node));
        }
        return out;
    }

    @Override
    public DirectiveType getType() {
        return DirectiveType.CONTROL_FLOW;
    }

    @Override
    public DirectiveDescriptor getDescriptor() {
        return DESCRIPTOR;
    }
}
