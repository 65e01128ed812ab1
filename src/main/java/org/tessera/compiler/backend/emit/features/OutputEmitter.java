package org.tessera.compiler.backend.emit.features;

import org.tessera.compiler.backend.emit.EmitContext;
import org.tessera.compiler.backend.emit.INodeEmitter;
import org.tessera.compiler.frontend.parser.PipeParser;
import org.tessera.compiler.frontend.parser.ast.OutputContext;
import org.tessera.compiler.frontend.parser.ast.OutputNode;
import org.tessera.compiler.util.RuntimeSymbols;

/**
 * Emits an output expression through the escaper of its context. Filters are applied first.
 */
public final class OutputEmitter implements INodeEmitter<OutputNode> {

    @Override
    public void emit(OutputNode node, EmitContext ctx) {
        ctx.writer().write(escaped(node));
    }

    /**
     * @param node An output node.
     * @return The Java expression writing the node's value safely for its context.
     */
    public static String escaped(OutputNode node) {
        String value = PipeParser.compose(node.getExpression(), node.getFilters());
        if (node.getContext() == OutputContext.JSON) {
            return RuntimeSymbols.ESCAPER + ".json(" + value + ")";
        }
        if (!node.isEscape()) {
            return "String.valueOf(" + value + ")";
        }
        String escaper = switch (node.getContext()) {
            case HTML_ATTRIBUTE -> "attribute";
            case JAVASCRIPT -> "javascript";
            case CSS -> "css";
            case URL -> "url";
            case RAW -> null;
            default -> "html";
        };
        if (escaper == null) {
            return "String.valueOf(" + value + ")";
        }
        return RuntimeSymbols.ESCAPER + "." + escaper + "(" + value + ")";
    }
}
