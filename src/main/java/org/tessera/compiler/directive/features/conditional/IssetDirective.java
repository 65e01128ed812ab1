package org.tessera.compiler.directive.features.conditional;

import org.tessera.compiler.directive.DirectiveType;
import org.tessera.compiler.directive.IDirectiveCompiler;
import org.tessera.compiler.frontend.parser.ast.AstNode;
import org.tessera.compiler.frontend.parser.ast.DirectiveNode;
import org.tessera.compiler.pipeline.CompilationContext;

import java.util.List;

/**
 * Compiles {@code s:isset}: renders its host only when the expression is not {@code null}.
 */
public class IssetDirective implements IDirectiveCompiler {

    @Override
    public List<AstNode> compile(DirectiveNode node, CompilationContext context) {
        String value = ConditionalChain.requireExpression(node, context);
        return ConditionalChain.emit(node, "(" + value + ") != null", context);
    }

    @Override
    public DirectiveType getType() {
        return DirectiveType.CONTROL_FLOW;
    }
}
