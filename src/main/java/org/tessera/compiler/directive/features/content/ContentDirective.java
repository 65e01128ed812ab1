package org.tessera.compiler.directive.features.content;

import org.tessera.compiler.directive.DirectiveType;
import org.tessera.compiler.directive.IDirectiveCompiler;
import org.tessera.compiler.frontend.parser.PipeChain;
import org.tessera.compiler.frontend.parser.PipeParser;
import org.tessera.compiler.frontend.parser.ast.AstNode;
import org.tessera.compiler.frontend.parser.ast.DirectiveNode;
import org.tessera.compiler.frontend.parser.ast.OutputContext;
import org.tessera.compiler.frontend.parser.ast.OutputNode;
import org.tessera.compiler.pipeline.CompilationContext;

import java.util.List;

/**
 * Compiles {@code s:text} (escaped) and {@code s:html} (unescaped), replacing the body of the host
 * element with a single output.
 */
public class ContentDirective implements IDirectiveCompiler {

    private final boolean escape;

    /**
     * @param escape {@code true} for {@code s:text}, {@code false} for {@code s:html}.
     */
    public ContentDirective(boolean escape) {
        this.escape = escape;
    }

    @Override
    public List<AstNode> compile(DirectiveNode node, CompilationContext context) {
        String expression = node.getExpression().trim();
        if (expression.isEmpty() || expression.equals("true")) {
            throw context.syntaxError(context.getConfig().directiveAttribute(node.getName())
                    + " requires an expression", node);
        }
        PipeChain chain = PipeParser.parse(expression);
        boolean escaped = escape && !chain.raw();
        OutputContext outputContext;
        if (chain.json()) {
            outputContext = OutputContext.JSON;
        } else if (!escaped) {
            outputContext = OutputContext.RAW;
        } else {
            outputContext = OutputContext.HTML;
        }
        return List.of(new OutputNode(chain.expression(), escaped, outputContext, chain.filters(),
                node.getLine(), node.getColumn()));
    }

    @Override
    public DirectiveType getType() {
        return DirectiveType.CONTENT;
    }
}
