package org.tessera.compiler.directive.features.attribute;

import org.tessera.compiler.directive.AttributeMergePolicy;
import org.tessera.compiler.directive.DirectiveDescriptor;
import org.tessera.compiler.directive.DirectiveType;
import org.tessera.compiler.directive.IDirectiveCompiler;
import org.tessera.compiler.frontend.parser.ast.AstNode;
import org.tessera.compiler.frontend.parser.ast.DirectiveNode;
import org.tessera.compiler.pipeline.CompilationContext;
import org.tessera.compiler.util.JavaSource;

import java.util.List;

/**
 * Compiles {@code s:checked}, {@code s:selected} and {@code s:disabled}: the HTML boolean attribute
 * is present exactly when the condition holds. The bare form ({@code <input s:disabled>}) always applies.
 */
public class BooleanAttributeDirective implements IDirectiveCompiler {

    private final String attribute;
    private final DirectiveDescriptor descriptor;

    /**
     * @param attribute The HTML attribute this directive controls.
     */
    public BooleanAttributeDirective(String attribute) {
        this.attribute = attribute;
        this.descriptor = DirectiveDescriptor.builder()
                .mergePolicy(AttributeMergePolicy.replace(attribute))
                .build();
    }

    @Override
    public List<AstNode> compile(DirectiveNode node, CompilationContext context) {
        String condition = node.getExpression().trim();
        if (condition.isEmpty()) {
            throw context.syntaxError(context.getConfig().directiveAttribute(node.getName())
                    + " requires a condition expression", node);
        }
        return AttributeDirectives.spread(node,
                "(" + condition + ") ? " + JavaSource.stringLiteral(attribute) + " : \"\"");
    }

    @Override
    public DirectiveType getType() {
        return DirectiveType.ATTRIBUTE;
    }

    @Override
    public DirectiveDescriptor getDescriptor() {
        return descriptor;
    }
}
