package org.tessera.compiler.directive.features.attribute;

import org.tessera.compiler.frontend.parser.ast.AstNode;
import org.tessera.compiler.frontend.parser.ast.AttributeNode;
import org.tessera.compiler.frontend.parser.ast.AttributeValue;
import org.tessera.compiler.frontend.parser.ast.DirectiveNode;
import org.tessera.compiler.frontend.parser.ast.FragmentNode;
import org.tessera.compiler.frontend.parser.ast.OutputContext;
import org.tessera.compiler.frontend.parser.ast.OutputNode;
import org.tessera.compiler.pipeline.CompilationContext;

import java.util.List;

/**
 * Builds the attribute carrier that attribute directives compile to: a fragment without children
 * whose attributes are merged into the host element by the extraction pass.
 */
final class AttributeDirectives {

    private AttributeDirectives() {}

    static List<AstNode> named(DirectiveNode node, String attribute, String expression) {
        OutputNode output = new OutputNode(expression, true, OutputContext.HTML_ATTRIBUTE, List.of(),
                node.getLine(), node.getColumn());
        return carrier(node, new AttributeNode(attribute, AttributeValue.ofOutput(output), node.getLine(), node.getColumn()));
    }

    /**
     * @param expression A Java expression producing pre-rendered attribute text such as {@code a="1" b}.
     */
    static List<AstNode> spread(DirectiveNode node, String expression) {
        OutputNode output = new OutputNode(expression, false, OutputContext.RAW, List.of(),
                node.getLine(), node.getColumn());
        return carrier(node, new AttributeNode("", AttributeValue.ofOutput(output), node.getLine(), node.getColumn()));
    }

    static String requireExpression(DirectiveNode node, CompilationContext context) {
        String expression = node.getExpression().trim();
        if (expression.isEmpty() || expression.equals("true")) {
            throw context.syntaxError(context.getConfig().directiveAttribute(node.getName())
                    + " requires an expression", node);
        }
        return expression;
    }

    private static List<AstNode> carrier(DirectiveNode node, AttributeNode attribute) {
        return List.of(new FragmentNode(List.of(attribute), List.of(), node.getLine(), node.getColumn()));
    }
}
