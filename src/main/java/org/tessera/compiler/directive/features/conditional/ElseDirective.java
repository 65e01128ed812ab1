package org.tessera.compiler.directive.features.conditional;

import org.tessera.compiler.directive.DirectiveDescriptor;
import org.tessera.compiler.directive.DirectiveType;
import org.tessera.compiler.directive.ElementClaim;
import org.tessera.compiler.directive.IDirectiveCompiler;
import org.tessera.compiler.frontend.parser.ast.AstNode;
import org.tessera.compiler.frontend.parser.ast.DirectiveNode;
import org.tessera.compiler.pipeline.CompilationContext;

import java.util.List;

/**
 * {@code s:else} only contributes the alternate branch of a paired conditional; standing alone it is an error.
 */
public class ElseDirective implements IDirectiveCompiler {

    private static final DirectiveDescriptor DESCRIPTOR = DirectiveDescriptor.builder()
            .elementClaim(ElementClaim.bare())
            .build();

    @Override
    public List<AstNode> compile(DirectiveNode node, CompilationContext context) {
        throw context.syntaxError(context.getConfig().directiveAttribute("else") + " must follow "
                + context.getConfig().directiveAttribute("if") + " or "
                + context.getConfig().directiveAttribute("elseif"), node);
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
