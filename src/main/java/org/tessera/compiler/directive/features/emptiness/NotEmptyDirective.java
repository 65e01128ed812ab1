package org.tessera.compiler.directive.features.emptiness;

import org.tessera.compiler.directive.DirectiveType;
import org.tessera.compiler.directive.IDirectiveCompiler;
import org.tessera.compiler.directive.features.conditional.ConditionalChain;
import org.tessera.compiler.frontend.parser.ast.AstNode;
import org.tessera.compiler.frontend.parser.ast.DirectiveNode;
import org.tessera.compiler.pipeline.CompilationContext;
import org.tessera.compiler.util.RuntimeSymbols;

import java.util.List;

/**
 * Compiles {@code s:notempty="value"}, rendering its host when the value is not empty.
 */
public class NotEmptyDirective implements IDirectiveCompiler {

    @Override
    public List<AstNode> compile(DirectiveNode node, CompilationContext context) {
        String value = ConditionalChain.requireExpression(node, context);
        return ConditionalChain.emit(node, "!" + RuntimeSymbols.VALUES + ".isEmpty(" + value + ")", context);
    }

    @Override
    public DirectiveType getType() {
        return DirectiveType.CONTROL_FLOW;
    }
}
