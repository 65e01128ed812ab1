package org.tessera.compiler.directive.features.loop;

import org.tessera.compiler.directive.CodeNodes;
import org.tessera.compiler.directive.DirectiveDescriptor;
import org.tessera.compiler.directive.DirectiveType;
import org.tessera.compiler.directive.ElementClaim;
import org.tessera.compiler.directive.IDirectiveCompiler;
import org.tessera.compiler.frontend.parser.ast.AstNode;
import org.tessera.compiler.frontend.parser.ast.DirectiveNode;
import org.tessera.compiler.pipeline.CompilationContext;
import org.tessera.compiler.util.RuntimeSymbols;

import java.util.ArrayList;
import java.util.List;

/**
 * Compiles {@code s:forelse}: a foreach loop whose paired {@code s:empty} sibling renders when the
 * collection has no elements. The collection expression is evaluated once.
 */
public class ForelseDirective implements IDirectiveCompiler {

    private static final DirectiveDescriptor DESCRIPTOR = DirectiveDescriptor.builder()
            .pairedWith("empty")
            .elementClaim(ElementClaim.withAttribute("each"))
            .build();

    @Override
    public List<AstNode> compile(DirectiveNode node, CompilationContext context) {
        LoopExpression loop = LoopSupport.parse(node, context);
        String items = context.freshVariable("items");

        List<AstNode> branches = new ArrayList<>();
        branches.add(CodeNodes.raw("if (!" + RuntimeSymbols.VALUES + ".isEmpty(" + items + ")) {", node));
        branches.addAll(LoopSupport.withWrapperMode(node,
                body -> LoopSupport.forEach(node, loop, items, body, context)));
        if (node.getPairedSibling().isPresent()) {
            DirectiveNode empty = node.getPairedSibling().get();
            branches.add(CodeNodes.raw("} else {", empty));
            branches.addAll(empty.getChildren());
        }
        branches.add(CodeNodes.raw("}", node));

        return LoopSupport.block(node, "var " + items + " = " + loop.collection() + ";", branches);
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
