package org.tessera.compiler.directive.features.switchcase;

import org.tessera.compiler.directive.CodeNodes;
import org.tessera.compiler.directive.DirectiveDescriptor;
import org.tessera.compiler.directive.DirectiveType;
import org.tessera.compiler.directive.ElementClaim;
import org.tessera.compiler.directive.IDirectiveCompiler;
import org.tessera.compiler.frontend.parser.ast.AstNode;
import org.tessera.compiler.frontend.parser.ast.DirectiveNode;
import org.tessera.compiler.frontend.parser.ast.ElementNode;
import org.tessera.compiler.frontend.parser.ast.TextNode;
import org.tessera.compiler.pipeline.CompilationContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Compiles {@code s:switch="value"} into a Java {@code switch} statement.
 * <p>
 * The branches are the {@code s:case} and {@code s:default} directives among the children. When
 * the switch sits on an element, its branches are that element's children and the element is kept
 * around the generated statement. Whitespace and markup comments between the branches are dropped.
 */
public class SwitchDirective implements IDirectiveCompiler {

    private static final DirectiveDescriptor DESCRIPTOR = DirectiveDescriptor.builder()
            .elementClaim(ElementClaim.withAttribute("value"))
            .build();

    @Override
    public List<AstNode> compile(DirectiveNode node, CompilationContext context) {
        String subject = node.getExpression().trim();
        if (subject.isEmpty() || subject.equals("true")) {
            throw context.syntaxError("Switch directive requires a value expression", node);
        }

        ElementNode wrapper = null;
        List<AstNode> candidates = meaningful(node.getChildren());
        if (candidates.size() == 1 && candidates.get(0) instanceof ElementNode element) {
            wrapper = element;
            candidates = meaningful(element.getChildren());
        }

        List<AstNode> body = new ArrayList<>();
        body.add(CodeNodes.raw("switch (" + subject + ") {", node));
        boolean hasDefault = false;
        int branches = 0;
        for (AstNode candidate : candidates) {
            if (!(candidate instanceof DirectiveNode branch) || !CaseDirective.BRANCHES.contains(branch.getName())) {
                throw context.syntaxError("Switch directive can only contain "
                        + context.getConfig().directiveAttribute("case") + " and "
                        + context.getConfig().directiveAttribute("default") + " branches", candidate);
            }
            if (branch.getName().equals("default")) {
                if (hasDefault) {
                    throw context.syntaxError("Switch directive can only have one default case", branch);
                }
                hasDefault = true;
                body.add(CodeNodes.raw("default: {", branch));
            } else {
                String value = branch.getExpression().trim();
                if (value.isEmpty() || value.equals("true")) {
                    throw context.syntaxError("Case directive requires a value expression", branch);
                }
                body.add(CodeNodes.raw("case " + value + ": {", branch));
            }
            body.addAll(branch.getChildren());
            body.add(CodeNodes.raw("}\nbreak;", branch));
            branches++;
        }
        if (branches == 0) {
            throw context.syntaxError("Switch directive must contain at least one case or default", node);
        }
        body.add(CodeNodes.raw("}", node));

        if (wrapper != null) {
            return List.of(wrapper.copy(wrapper.getAttributes(), body));
        }
        return body;
    }

    private static List<AstNode> meaningful(List<AstNode> children) {
        return children.stream()
                .filter(child -> !(child instanceof TextNode text && (text.isBlank() || isComment(text))))
                .toList();
    }

    private static boolean isComment(TextNode text) {
        return text.getText().strip().startsWith("<!--");
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
