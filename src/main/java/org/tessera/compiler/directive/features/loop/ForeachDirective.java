package org.tessera.compiler.directive.features.loop;

import org.tessera.compiler.directive.DirectiveDescriptor;
import org.tessera.compiler.directive.DirectiveType;
import org.tessera.compiler.directive.ElementClaim;
import org.tessera.compiler.directive.IDirectiveCompiler;
import org.tessera.compiler.frontend.parser.ast.AstNode;
import org.tessera.compiler.frontend.parser.ast.DirectiveNode;
import org.tessera.compiler.pipeline.CompilationContext;

import java.util.List;

/**
 * Compiles {@code s:foreach="items as item"} and {@code s:foreach="map as key => value"}.
 * <p>
 * Inside the loop a metadata object named after the item variable ({@code itemLoop}) tracks the
 * iteration and links to the metadata of the enclosing loop.
 */
public class ForeachDirective implements IDirectiveCompiler {

    private static final DirectiveDescriptor DESCRIPTOR = DirectiveDescriptor.builder()
            .elementClaim(ElementClaim.withAttribute("each"))
            .build();

    @Override
    public List<AstNode> compile(DirectiveNode node, CompilationContext context) {
        LoopExpression loop = LoopSupport.parse(node, context);
        String items = context.freshVariable("items");
        return LoopSupport.withWrapperMode(node, body -> LoopSupport.block(node,
                "var " + items + " = " + loop.collection() + ";",
                LoopSupport.forEach(node, loop, items, body, context)));
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
