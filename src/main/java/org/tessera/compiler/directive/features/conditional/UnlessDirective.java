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
 * Compiles {@code s:unless}, the negated conditional.
 */
public class UnlessDirective implements IDirectiveCompiler {

    private static final DirectiveDescriptor DESCRIPTOR = DirectiveDescriptor.builder()
            .elementClaim(ElementClaim.withAttribute("condition"))
            .build();

    @Override
    public List<AstNode> compile(DirectiveNode node, CompilationContext context) {
        String condition = ConditionalChain.requireExpression(node, context);
        return ConditionalChain.emit(node, "!(" + condition + ")", context);
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
