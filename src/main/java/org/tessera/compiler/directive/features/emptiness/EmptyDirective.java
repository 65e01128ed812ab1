package org.tessera.compiler.directive.features.emptiness;

import org.tessera.compiler.directive.DirectiveDescriptor;
import org.tessera.compiler.directive.DirectiveType;
import org.tessera.compiler.directive.ElementClaim;
import org.tessera.compiler.directive.IDirectiveCompiler;
import org.tessera.compiler.directive.features.conditional.ConditionalChain;
import org.tessera.compiler.frontend.parser.ast.AstNode;
import org.tessera.compiler.frontend.parser.ast.DirectiveNode;
import org.tessera.compiler.pipeline.CompilationContext;
import org.tessera.compiler.util.RuntimeSymbols;

import java.util.List;

/**
 * Compiles {@code s:empty="value"}, rendering its host when the value is empty.
 * <p>
 * A bare {@code s:empty} is the empty-collection branch of {@code s:forelse} and is consumed by pairing;
 * reaching this compiler without a value means it had nothing to pair with.
 */
public class EmptyDirective implements IDirectiveCompiler {

    private static final DirectiveDescriptor DESCRIPTOR = DirectiveDescriptor.builder()
            .elementClaim(ElementClaim.bare())
            .build();

    @Override
    public List<AstNode> compile(DirectiveNode node, CompilationContext context) {
        String value = node.getExpression().trim();
        if (value.isEmpty() || value.equals("true")) {
            throw context.syntaxError(context.getConfig().directiveAttribute("empty")
                    + " without a value must follow " + context.getConfig().directiveAttribute("forelse"), node);
        }
        return ConditionalChain.emit(node, RuntimeSymbols.VALUES + ".isEmpty(" + value + ")", context);
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
