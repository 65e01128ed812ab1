package org.tessera.compiler.pipeline.passes;

import org.tessera.compiler.frontend.parser.ast.AstNode;
import org.tessera.compiler.frontend.parser.ast.AttributeNode;
import org.tessera.compiler.frontend.parser.ast.AttributePart;
import org.tessera.compiler.frontend.parser.ast.AttributeValue;
import org.tessera.compiler.frontend.parser.ast.ComponentNode;
import org.tessera.compiler.frontend.parser.ast.ElementNode;
import org.tessera.compiler.frontend.parser.ast.OutputContext;
import org.tessera.compiler.frontend.parser.ast.OutputNode;
import org.tessera.compiler.pipeline.CompilationContext;
import org.tessera.compiler.pipeline.IAstPass;
import org.tessera.compiler.pipeline.NodeAction;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Assigns each escaped output the escaping context of its final position.
 * <p>
 * The enclosing element is found through parent links rather than a traversal stack, so outputs
 * that were moved by directive compilation are classified by where they ended up. Unescaped and
 * {@code json()} outputs keep their context.
 */
public class ContextAnalysisPass implements IAstPass {

    static final Set<String> URL_ATTRIBUTES = Set.of("href", "src", "action", "formaction", "poster", "cite", "data");

    @Override
    public NodeAction before(AstNode node, CompilationContext context) {
        if (node instanceof OutputNode output) {
            classify(output, bodyContext(output));
        } else if (node instanceof ElementNode element) {
            classifyAttributes(element.getAttributes());
        } else if (node instanceof ComponentNode component) {
            classifyAttributes(component.getAttributes());
        }
        return NodeAction.none();
    }

    private static OutputContext bodyContext(AstNode node) {
        for (AstNode current = node.getParent(); current != null; current = current.getParent()) {
            if (current instanceof ElementNode element) {
                if (element.getDynamicTag().isPresent()) {
                    return OutputContext.HTML;
                }
                return switch (element.getTag().toLowerCase(Locale.ROOT)) {
                    case "script" -> OutputContext.JAVASCRIPT;
                    case "style" -> OutputContext.CSS;
                    default -> OutputContext.HTML;
                };
            }
        }
        return OutputContext.HTML;
    }

    private static void classifyAttributes(List<AttributeNode> attributes) {
        for (AttributeNode attribute : attributes) {
            if (attribute.isSpread()) {
                continue;
            }
            boolean url = URL_ATTRIBUTES.contains(attribute.name().toLowerCase(Locale.ROOT));
            AttributeValue value = attribute.value();
            if (value instanceof AttributeValue.Output o) {
                classify(o.output(), OutputContext.HTML_ATTRIBUTE);
            } else if (value instanceof AttributeValue.Parts p) {
                boolean inQuery = false;
                for (AttributePart part : p.parts()) {
                    if (part instanceof AttributePart.Literal literal) {
                        inQuery |= literal.text().indexOf('?') >= 0;
                    } else if (part instanceof AttributePart.Dynamic dynamic) {
                        classify(dynamic.output(), url && inQuery ? OutputContext.URL : OutputContext.HTML_ATTRIBUTE);
                    }
                }
            }
        }
    }

    private static void classify(OutputNode output, OutputContext position) {
        if (!output.isEscape() || output.getContext() == OutputContext.JSON) {
            return;
        }
        output.setContext(position);
    }
}
