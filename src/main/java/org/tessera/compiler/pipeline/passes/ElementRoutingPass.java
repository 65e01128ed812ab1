package org.tessera.compiler.pipeline.passes;

import org.tessera.compiler.config.CompilerConfig;
import org.tessera.compiler.directive.DirectiveRegistry;
import org.tessera.compiler.directive.ElementClaim;
import org.tessera.compiler.directive.IDirectiveCompiler;
import org.tessera.compiler.frontend.parser.ast.AstNode;
import org.tessera.compiler.frontend.parser.ast.AttributeNode;
import org.tessera.compiler.frontend.parser.ast.AttributeValue;
import org.tessera.compiler.frontend.parser.ast.ComponentNode;
import org.tessera.compiler.frontend.parser.ast.ContainerNode;
import org.tessera.compiler.frontend.parser.ast.FragmentNode;
import org.tessera.compiler.pipeline.CompilationContext;
import org.tessera.compiler.pipeline.IAstPass;
import org.tessera.compiler.pipeline.NodeAction;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns directive elements such as {@code <s-if condition="x">} into fragments carrying the
 * equivalent directive attribute ({@code <s-template s:if="x">}), so that extraction only has to
 * deal with attributes.
 * <p>
 * Routing happens on the immediate children of every container before the later passes look at
 * them, so a routed {@code <s-else>} can pair with the fragment produced for its {@code <s-if>}.
 */
public class ElementRoutingPass implements IAstPass {

    private final DirectiveRegistry registry;
    private final CompilerConfig config;

    public ElementRoutingPass(DirectiveRegistry registry, CompilerConfig config) {
        this.registry = registry;
        this.config = config;
    }

    @Override
    public NodeAction before(AstNode node, CompilationContext context) {
        if (node instanceof ComponentNode component) {
            Optional<FragmentNode> routed = route(component, context);
            if (routed.isPresent()) {
                return NodeAction.replace(List.of(routed.get()), true);
            }
        }
        if (node instanceof ContainerNode container) {
            boolean changed = false;
            List<AstNode> children = new ArrayList<>(container.getChildren().size());
            for (AstNode child : container.getChildren()) {
                Optional<FragmentNode> routed = child instanceof ComponentNode c ? route(c, context) : Optional.empty();
                changed |= routed.isPresent();
                children.add(routed.isPresent() ? routed.get() : child);
            }
            if (changed) {
                container.setChildren(children);
            }
        }
        return NodeAction.none();
    }

    private Optional<FragmentNode> route(ComponentNode component, CompilationContext context) {
        String name = component.getName();
        Optional<ElementClaim> claim = registry.get(name)
                .map(IDirectiveCompiler::getDescriptor)
                .flatMap(d -> d.getElementClaim());
        if (claim.isEmpty()) {
            return Optional.empty();
        }

        String element = "<" + config.elementPrefix() + name + ">";
        Optional<String> claimedName = claim.get().getExpressionAttribute();
        AttributeValue value = claimedName.isPresent() ? null : AttributeValue.BOOLEAN;
        List<AttributeNode> directives = new ArrayList<>();
        for (AttributeNode attribute : component.getAttributes()) {
            if (claimedName.isPresent() && attribute.name().equals(claimedName.get())) {
                if (!attribute.value().isStatic() && !attribute.value().isBoolean()) {
                    throw context.syntaxError("Attribute \"" + attribute.name() + "\" of " + element
                            + " must be a static expression", attribute.line(), attribute.column(), null);
                }
                value = attribute.value();
            } else if (config.isDirectiveAttribute(attribute.name())) {
                directives.add(attribute);
            } else {
                String allowed = claimedName.map(n -> " Only \"" + n + "\" is allowed.").orElse("");
                throw context.syntaxError(element + " does not accept the attribute \""
                        + (attribute.isSpread() ? "<%= %>" : attribute.name()) + "\"." + allowed,
                        attribute.line(), attribute.column(), null);
            }
        }
        if (value == null) {
            throw context.syntaxError(element + " requires a \"" + claimedName.get() + "\" attribute", component);
        }

        List<AttributeNode> attributes = new ArrayList<>();
        attributes.add(new AttributeNode(config.directiveAttribute(name), value, component.getLine(), component.getColumn()));
        attributes.addAll(directives);
        return Optional.of(new FragmentNode(attributes, component.getChildren(), component.getLine(), component.getColumn()));
    }
}
