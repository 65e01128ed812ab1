package org.tessera.compiler.directive.features.trycatch;

import org.tessera.compiler.directive.DirectiveDescriptor;
import org.tessera.compiler.directive.DirectiveType;
import org.tessera.compiler.directive.ElementClaim;
import org.tessera.compiler.directive.IDirectiveCompiler;
import org.tessera.compiler.frontend.parser.ast.AstNode;
import org.tessera.compiler.frontend.parser.ast.DirectiveNode;
import org.tessera.compiler.pipeline.CompilationContext;

import java.util.List;

/**
 * The {@code s:finally} branch of {@code s:try}. It is emitted by {@link TryDirective} after pairing.
 */
public class FinallyDirective implements IDirectiveCompiler {

    private static final DirectiveDescriptor DESCRIPTOR = DirectiveDescriptor.builder()
            .elementClaim(ElementClaim.bare())
            .build();

    @Override
    public List<AstNode> compile(DirectiveNode node, CompilationContext context) {
        throw context.syntaxError(context.getConfig().directiveAttribute("finally") + " must follow "
                + context.getConfig().directiveAttribute("try"), node);
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
