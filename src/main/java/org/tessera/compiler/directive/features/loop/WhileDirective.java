package org.tessera.compiler.directive.features.loop;

import org.tessera.compiler.directive.CodeNodes;
import org.tessera.compiler.directive.DirectiveDescriptor;
import org.tessera.compiler.directive.DirectiveType;
import org.tessera.compiler.directive.ElementClaim;
import org.tessera.compiler.directive.IDirectiveCompiler;
import org.tessera.compiler.directive.features.conditional.ConditionalChain;
import org.tessera.compiler.frontend.parser.ast.AstNode;
import org.tessera.compiler.frontend.parser.ast.DirectiveNode;
import org.tessera.compiler.pipeline.CompilationContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Compiles {@code s:while="condition"}.
 */
public class WhileDirective implements IDirectiveCompiler {

    private static final DirectiveDescriptor DESCRIPTOR = DirectiveDescriptor.builder()
            .elementClaim(ElementClaim.withAttribute("condition"))
            .build();

    @Override
    public List<AstNode> compile(DirectiveNode node, CompilationContext context) {
        String condition = ConditionalChain.requireExpression(node, context);
        return LoopSupport.withWrapperMode(node, body -> {
            List<AstNode> out = new ArrayList<>();
            out.add(CodeNodes.raw("while (" + condition + ") {", node));
            out.addAll(body);
            out.add(CodeNodes.raw("}", node));
            return out;
        });
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
