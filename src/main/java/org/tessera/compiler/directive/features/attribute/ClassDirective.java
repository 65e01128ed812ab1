package org.tessera.compiler.directive.features.attribute;

import org.tessera.compiler.directive.AttributeMergePolicy;
import org.tessera.compiler.directive.DirectiveDescriptor;
import org.tessera.compiler.directive.DirectiveType;
import org.tessera.compiler.directive.IDirectiveCompiler;
import org.tessera.compiler.frontend.parser.ast.AstNode;
import org.tessera.compiler.frontend.parser.ast.DirectiveNode;
import org.tessera.compiler.pipeline.CompilationContext;
import org.tessera.compiler.util.RuntimeSymbols;

import java.util.List;

/**
 * Compiles {@code s:class="expr"}. The expression may be a string, a collection of class names or a
 * map from class name to condition; a static {@code class} attribute on the same element is merged in.
 */
public class ClassDirective implements IDirectiveCompiler {

    private static final DirectiveDescriptor DESCRIPTOR = DirectiveDescriptor.builder()
            .mergePolicy(AttributeMergePolicy.mergeNamed("class", ClassDirective::classNames))
            .build();

    @Override
    public List<AstNode> compile(DirectiveNode node, CompilationContext context) {
        String expression = AttributeDirectives.requireExpression(node, context);
        return AttributeDirectives.named(node, "class", classNames(expression));
    }

    private static String classNames(String... expressions) {
        return RuntimeSymbols.HTML_ATTRIBUTES + ".classNames(java.util.List.of(" + String.join(", ", expressions) + "))";
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
