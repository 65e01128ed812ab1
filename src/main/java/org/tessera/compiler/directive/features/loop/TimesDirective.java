package org.tessera.compiler.directive.features.loop;

import org.tessera.compiler.directive.CodeNodes;
import org.tessera.compiler.directive.DirectiveDescriptor;
import org.tessera.compiler.directive.DirectiveType;
import org.tessera.compiler.directive.ElementClaim;
import org.tessera.compiler.directive.IDirectiveCompiler;
import org.tessera.compiler.frontend.parser.ast.AstNode;
import org.tessera.compiler.frontend.parser.ast.DirectiveNode;
import org.tessera.compiler.pipeline.CompilationContext;
import org.tessera.compiler.util.JavaSource;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compiles {@code s:times="3"} and {@code s:times="count as i"}, repeating the host a fixed number of times.
 */
public class TimesDirective implements IDirectiveCompiler {

    private static final Pattern WITH_INDEX = Pattern.compile("^(.+?)\\s+as\\s+(\\S+)$", Pattern.DOTALL);

    private static final DirectiveDescriptor DESCRIPTOR = DirectiveDescriptor.builder()
            .elementClaim(ElementClaim.withAttribute("count"))
            .build();

    @Override
    public List<AstNode> compile(DirectiveNode node, CompilationContext context) {
        String expression = node.getExpression().trim();
        if (expression.isEmpty()) {
            throw context.syntaxError(context.getConfig().directiveAttribute("times")
                    + " requires a count expression", node);
        }

        String count = expression;
        String index;
        Matcher m = WITH_INDEX.matcher(expression);
        if (m.matches()) {
            count = m.group(1).trim();
            index = m.group(2);
            if (!JavaSource.isIdentifier(index)) {
                throw context.syntaxError(context.getConfig().directiveAttribute("times")
                        + " index must be a valid variable name, got \"" + index + "\"", node);
            }
        } else {
            index = context.freshVariable("i");
        }

        String header = "for (int " + index + " = 0; " + index + " < (" + count + "); " + index + "++) {";
        return LoopSupport.withWrapperMode(node, body -> {
            List<AstNode> out = new ArrayList<>();
            out.add(CodeNodes.raw(header, node));
            out.addAll(body);
            out.add(CodeNodes.raw("}", node));
            return out;
        });
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
