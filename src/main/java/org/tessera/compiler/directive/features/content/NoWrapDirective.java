package org.tessera.compiler.directive.features.content;

import org.tessera.compiler.directive.DirectiveDescriptor;
import org.tessera.compiler.directive.DirectiveType;
import org.tessera.compiler.directive.ElementClaim;
import org.tessera.compiler.directive.IDirectiveCompiler;
import org.tessera.compiler.frontend.parser.ast.AstNode;
import org.tessera.compiler.frontend.parser.ast.DirectiveNode;
import org.tessera.compiler.pipeline.CompilationContext;

import java.util.List;

/**
 * {@code s:nowrap} drops the host element of {@code s:text} or {@code s:html}, leaving only the content.
 * It is applied during extraction and never compiled on its own.
 */
public class NoWrapDirective implements IDirectiveCompiler {

    private static final DirectiveDescriptor DESCRIPTOR = DirectiveDescriptor.builder()
            .contentWrapping(false)
            .elementClaim(ElementClaim.bare())
            .build();

    @Override
    public List<AstNode> compile(DirectiveNode node, CompilationContext context) {
        throw context.syntaxError("The " + context.getConfig().directiveAttribute("nowrap")
                + " directive requires a content directive like " + context.getConfig().directiveAttribute("text")
                + " or " + context.getConfig().directiveAttribute("html") + " on the same element.", node);
    }

    @Override
    public DirectiveType getType() {
        return DirectiveType.CONTENT;
    }

    @Override
    public DirectiveDescriptor getDescriptor() {
        return DESCRIPTOR;
    }
}
