package org.tessera.compiler.directive.features.switchcase;

import org.tessera.compiler.directive.DirectiveDescriptor;
import org.tessera.compiler.directive.DirectiveType;
import org.tessera.compiler.directive.ElementClaim;
import org.tessera.compiler.directive.IDirectiveCompiler;
import org.tessera.compiler.frontend.parser.ast.AstNode;
import org.tessera.compiler.frontend.parser.ast.DirectiveNode;
import org.tessera.compiler.pipeline.CompilationContext;

import java.util.List;
import java.util.Set;

/**
 * A branch of {@code s:switch}, either {@code s:case="value"} or {@code s:default}.
 * <p>
 * Branches are left in place by the compilation pass and emitted by the enclosing
 * {@link SwitchDirective}; they are never compiled on their own.
 */
public class CaseDirective implements IDirectiveCompiler {

    static final Set<String> BRANCHES = Set.of("case", "default");

    private final String name;
    private final DirectiveDescriptor descriptor;

    /**
     * @param name The registered name, {@code "case"} or {@code "default"}.
     */
    public CaseDirective(String name) {
        this.name = name;
        this.descriptor = DirectiveDescriptor.builder()
                .enclosingDirective("switch")
                .elementClaim(name.equals("case") ? ElementClaim.withAttribute("value") : ElementClaim.bare())
                .build();
    }

    @Override
    public List<AstNode> compile(DirectiveNode node, CompilationContext context) {
        throw context.syntaxError(context.getConfig().directiveAttribute(name) + " must be used inside "
                + context.getConfig().directiveAttribute("switch"), node);
    }

    @Override
    public DirectiveType getType() {
        return DirectiveType.CONTROL_FLOW;
    }

    @Override
    public DirectiveDescriptor getDescriptor() {
        return descriptor;
    }
}
