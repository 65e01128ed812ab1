package org.tessera.compiler.pipeline.passes;

import org.tessera.compiler.directive.DirectiveRegistry;
import org.tessera.compiler.directive.IDirectiveCompiler;
import org.tessera.compiler.frontend.parser.ast.AstNode;
import org.tessera.compiler.frontend.parser.ast.ContainerNode;
import org.tessera.compiler.frontend.parser.ast.DirectiveNode;
import org.tessera.compiler.frontend.parser.ast.TextNode;
import org.tessera.compiler.pipeline.CompilationContext;
import org.tessera.compiler.pipeline.IAstPass;
import org.tessera.compiler.pipeline.NodeAction;

import java.util.List;
import java.util.Set;

/**
 * Links directives to the sibling that continues them, e.g. {@code s:if} to a following
 * {@code s:else}. Only whitespace text may sit between partners.
 */
public class DirectivePairingPass implements IAstPass {

    private final DirectiveRegistry registry;

    public DirectivePairingPass(DirectiveRegistry registry) {
        this.registry = registry;
    }

    @Override
    public NodeAction before(AstNode node, CompilationContext context) {
        if (!(node instanceof ContainerNode container)) {
            return NodeAction.none();
        }
        List<AstNode> children = container.getChildren();
        for (int i = 0; i < children.size(); i++) {
            if (!(children.get(i) instanceof DirectiveNode directive) || directive.getPairedSibling().isPresent()) {
                continue;
            }
            Set<String> partners = registry.get(directive.getName())
                    .map(IDirectiveCompiler::getDescriptor)
                    .map(d -> d.getPairedWith())
                    .orElse(Set.of());
            if (partners.isEmpty()) {
                continue;
            }
            int j = i + 1;
            while (j < children.size() && children.get(j) instanceof TextNode text && text.isBlank()) {
                j++;
            }
            if (j < children.size()
                    && children.get(j) instanceof DirectiveNode partner
                    && partners.contains(partner.getName())
                    && !partner.isConsumedByPairing()) {
                directive.pairWith(partner);
            }
        }
        return NodeAction.none();
    }
}
