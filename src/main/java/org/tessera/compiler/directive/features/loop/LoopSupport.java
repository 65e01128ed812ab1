package org.tessera.compiler.directive.features.loop;

import org.tessera.compiler.directive.CodeNodes;
import org.tessera.compiler.directive.WrapperMode;
import org.tessera.compiler.frontend.parser.ast.AstNode;
import org.tessera.compiler.frontend.parser.ast.DirectiveNode;
import org.tessera.compiler.frontend.parser.ast.ElementNode;
import org.tessera.compiler.pipeline.CompilationContext;
import org.tessera.compiler.util.RuntimeSymbols;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Shared code shapes of the loop directives.
 */
final class LoopSupport {

    static final Set<String> METADATA_LOOPS = Set.of("foreach", "forelse");

    private LoopSupport() {}

    /**
     * Parses the iteration clause of a foreach-style directive.
     */
    static LoopExpression parse(DirectiveNode node, CompilationContext context) {
        return LoopExpression.parse(node.getExpression()).orElseThrow(() -> context.syntaxError(
                context.getConfig().directiveAttribute(node.getName())
                        + " requires an expression like \"items as item\"", node));
    }

    /**
     * Applies wrapper mode: the body producer receives the nodes to repeat, and the result is either
     * the wrapper element holding the loop, or the loop itself.
     */
    static List<AstNode> withWrapperMode(DirectiveNode node, Function<List<AstNode>, List<AstNode>> loop) {
        Optional<ElementNode> wrapper = WrapperMode.wrapperElement(node);
        if (wrapper.isPresent()) {
            ElementNode element = wrapper.get();
            return List.of(element.copy(element.getAttributes(), loop.apply(element.getChildren())));
        }
        return loop.apply(node.getChildren());
    }

    /**
     * Emits a metadata-tracking for-each loop over an already evaluated collection variable.
     */
    static List<AstNode> forEach(DirectiveNode node, LoopExpression loop, String collectionVariable,
                                 List<AstNode> body, CompilationContext context) {
        String metadata = loop.metadataVariable();
        StringBuilder open = new StringBuilder()
                .append("var ").append(metadata).append(" = new ").append(RuntimeSymbols.LOOP_METADATA)
                .append('(').append(collectionVariable).append(", ").append(parentMetadata(node, context)).append(");\n");
        if (loop.hasKey()) {
            String entry = context.freshVariable("entry");
            open.append("for (var ").append(entry).append(" : ").append(RuntimeSymbols.LOOPS)
                    .append(".entries(").append(collectionVariable).append(")) {\n")
                    .append("var ").append(loop.keyVariable()).append(" = ").append(entry).append(".getKey();\n")
                    .append("var ").append(loop.itemVariable()).append(" = ").append(entry).append(".getValue();");
        } else {
            open.append("for (var ").append(loop.itemVariable()).append(" : ").append(RuntimeSymbols.LOOPS)
                    .append(".iterable(").append(collectionVariable).append(")) {");
        }

        List<AstNode> out = new ArrayList<>();
        out.add(CodeNodes.raw(open.toString(), node));
        out.addAll(body);
        out.add(CodeNodes.raw(metadata + ".next();\n}", node));
        return out;
    }

    /**
     * @return The metadata variable of the closest enclosing metadata loop, or {@code null} as Java source.
     */
    static String parentMetadata(DirectiveNode node, CompilationContext context) {
        return context.findEnclosingDirective(node, METADATA_LOOPS)
                .flatMap(parent -> LoopExpression.parse(parent.getExpression()))
                .map(LoopExpression::metadataVariable)
                .orElse("null");
    }

    /**
     * Wraps nodes in a Java block so that loop locals do not leak into sibling loops.
     */
    static List<AstNode> block(DirectiveNode node, String preamble, List<AstNode> body) {
        List<AstNode> out = new ArrayList<>();
        out.add(CodeNodes.raw(preamble.isEmpty() ? "{" : "{\n" + preamble, node));
        out.addAll(body);
        out.add(CodeNodes.raw("}", node));
        return out;
    }
}
