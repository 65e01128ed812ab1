package org.tessera.compiler.directive.features.content;

import org.tessera.compiler.directive.CodeNodes;
import org.tessera.compiler.directive.DirectiveDescriptor;
import org.tessera.compiler.directive.DirectiveType;
import org.tessera.compiler.directive.IDirectiveCompiler;
import org.tessera.compiler.frontend.parser.ast.AstNode;
import org.tessera.compiler.frontend.parser.ast.DirectiveNode;
import org.tessera.compiler.frontend.parser.ast.ElementNode;
import org.tessera.compiler.pipeline.CompilationContext;
import org.tessera.compiler.util.RuntimeSymbols;

import java.util.ArrayList;
import java.util.List;

/**
 * Compiles {@code s:ifcontent}: the host element is rendered only if its rendered body is not blank.
 * <p>
 * The body is captured into a buffer first, so side effects of the body happen even when the
 * element is dropped.
 */
public class IfContentDirective implements IDirectiveCompiler {

    private static final DirectiveDescriptor DESCRIPTOR = DirectiveDescriptor.builder()
            .customExtraction(IfContentDirective::extract)
            .build();

    private static AstNode extract(ElementNode element, String expression, CompilationContext context) {
        DirectiveNode node = new DirectiveNode("ifcontent", expression, element.getChildren(),
                element.getLine(), element.getColumn());
        node.setElementMetadata(element.copy(element.getAttributes(), List.of()));
        return node;
    }

    @Override
    public List<AstNode> compile(DirectiveNode node, CompilationContext context) {
        ElementNode host = node.getElementMetadata().orElseThrow(() -> context.syntaxError(
                context.getConfig().directiveAttribute("ifcontent") + " can only be used on HTML elements", node));
        String content = context.freshVariable("content");
        String out = RuntimeSymbols.OUT;

        List<AstNode> nodes = new ArrayList<>();
        nodes.add(CodeNodes.raw(out + ".beginCapture();", node));
        nodes.addAll(node.getChildren());
        nodes.add(CodeNodes.raw("String " + content + " = " + out + ".endCapture();\n"
                + "if (!" + content + ".isBlank()) {", node));
        nodes.add(host.copy(host.getAttributes(), List.of(CodeNodes.raw(out + ".write(" + content + ");", node))));
        nodes.add(CodeNodes.raw("}", node));
        return nodes;
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
