package org.tessera.compiler.directive.features.conditional;

import org.tessera.compiler.directive.DirectiveDescriptor;
import org.tessera.compiler.directive.DirectiveType;
import org.tessera.compiler.directive.ElementClaim;
import org.tessera.compiler.directive.IDirectiveCompiler;
import org.tessera.compiler.frontend.parser.ast.AstNode;
import org.tessera.compiler.frontend.parser.ast.DirectiveNode;
import org.tessera.compiler.pipeline.CompilationContext;

import java.util.List;

/**
 * Compiles {@code s:if} and {@code s:elseif}. Both may be followed by {@code s:elseif} or {@code s:else}.
 * <p>
 * An {@code s:elseif} only reaches this compiler when it did not pair with a preceding branch.
 */
public class IfDirective implements IDirectiveCompiler {

    private static final DirectiveDescriptor DESCRIPTOR = DirectiveDescriptor.builder()
            .pairedWith("elseif", "else")
            .elementClaim(ElementClaim.withAttribute("condition"))
            .build();

    private final String name;

    /**
     * @param name The registered name, {@code "if"} or {@code "elseif"}.
     */
    public IfDirective(String name) {
        this.name = name;
    }

    @Override
    public List<AstNode> compile(DirectiveNode node, CompilationContext context) {
        if (name.equals("elseif")) {
            throw context.syntaxError(context.getConfig().directiveAttribute("elseif") + " must follow "
                    + context.getConfig().directiveAttribute("if") + " or "
                    + context.getConfig().directiveAttribute("elseif"), node);
        }
        return ConditionalChain.emit(node, ConditionalChain.requireExpression(node, context), context);
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
