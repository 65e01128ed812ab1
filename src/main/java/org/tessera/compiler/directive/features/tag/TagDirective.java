package org.tessera.compiler.directive.features.tag;

import org.tessera.compiler.directive.CodeNodes;
import org.tessera.compiler.directive.DirectiveDescriptor;
import org.tessera.compiler.directive.DirectiveType;
import org.tessera.compiler.directive.IDirectiveCompiler;
import org.tessera.compiler.frontend.parser.ast.AstNode;
import org.tessera.compiler.frontend.parser.ast.DirectiveNode;
import org.tessera.compiler.frontend.parser.ast.ElementNode;
import org.tessera.compiler.frontend.parser.ast.FragmentNode;
import org.tessera.compiler.pipeline.CompilationContext;
import org.tessera.compiler.util.RuntimeSymbols;

import java.util.List;

/**
 * Compiles {@code s:tag="expr"}, replacing the element name at render time. The written tag is only
 * a placeholder; the computed name is validated by the runtime before it is written.
 */
public class TagDirective implements IDirectiveCompiler {

    private static final DirectiveDescriptor DESCRIPTOR = DirectiveDescriptor.builder()
            .customExtraction(TagDirective::extract)
            .build();

    private static AstNode extract(ElementNode element, String expression, CompilationContext context) {
        String tagExpression = expression.trim();
        if (tagExpression.isEmpty() || tagExpression.equals("true")) {
            throw context.syntaxError(context.getConfig().directiveAttribute("tag")
                    + " requires a tag name expression", element);
        }
        String variable = context.freshVariable("tag");
        AstNode declaration = CodeNodes.raw("String " + variable + " = " + RuntimeSymbols.HTML_TAGS
                + ".validate(" + tagExpression + ");", element);
        return new FragmentNode(List.of(), List.of(declaration, element.withDynamicTag(variable)),
                element.getLine(), element.getColumn());
    }

    @Override
    public List<AstNode> compile(DirectiveNode node, CompilationContext context) {
        throw context.syntaxError(context.getConfig().directiveAttribute("tag")
                + " can only be used on HTML elements", node);
    }

    @Override
    public DirectiveType getType() {
        return DirectiveType.ATTRIBUTE;
    }

    @Override
    public DirectiveDescriptor getDescriptor() {
        return DESCRIPTOR;
    }
}
