package org.tessera.compiler.directive.features.conditional;

import org.tessera.compiler.directive.CodeNodes;
import org.tessera.compiler.frontend.parser.ast.AstNode;
import org.tessera.compiler.frontend.parser.ast.DirectiveNode;
import org.tessera.compiler.pipeline.CompilationContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Emits a Java {@code if} statement for a conditional directive and all branches paired to it.
 */
public final class ConditionalChain {

    private ConditionalChain() {}

    /**
     * @param node The primary directive.
     * @param condition The Java condition of the primary branch.
     * @param context The compilation context.
     * @return The generated nodes: opening, children, one block per paired branch, closing brace.
     */
    public static List<AstNode> emit(DirectiveNode node, String condition, CompilationContext context) {
        List<AstNode> out = new ArrayList<>();
        out.add(CodeNodes.raw("if (" + condition + ") {", node));
        out.addAll(node.getChildren());

        Optional<DirectiveNode> next = node.getPairedSibling();
        while (next.isPresent()) {
            DirectiveNode branch = next.get();
            if (branch.getName().equals("elseif")) {
                String elseCondition = requireExpression(branch, context);
                out.add(CodeNodes.raw("} else if (" + elseCondition + ") {", branch));
            } else {
                out.add(CodeNodes.raw("} else {", branch));
            }
            out.addAll(branch.getChildren());
            next = branch.getPairedSibling();
        }
        out.add(CodeNodes.raw("}", node));
        return out;
    }

    /**
     * @param node A conditional directive.
     * @param context The compilation context.
     * @return The trimmed expression.
     * @throws org.tessera.compiler.api.SyntaxException if the expression is empty.
     */
    public static String requireExpression(DirectiveNode node, CompilationContext context) {
        String expression = node.getExpression().trim();
        if (expression.isEmpty()) {
            throw context.syntaxError(context.getConfig().directiveAttribute(node.getName())
                    + " requires a condition expression", node);
        }
        return expression;
    }
}
