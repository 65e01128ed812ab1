package org.tessera.compiler.directive;

import org.tessera.compiler.frontend.parser.ast.AstNode;
import org.tessera.compiler.frontend.parser.ast.ElementNode;
import org.tessera.compiler.pipeline.CompilationContext;

/**
 * Custom extraction for directives that need to see their whole host element.
 */
@FunctionalInterface
public interface IElementExtractor {

    /**
     * Rewrites the host element.
     * <p>
     * The result is either the rewritten element, which further extractors may rewrite again,
     * a {@link org.tessera.compiler.frontend.parser.ast.FragmentNode} whose last element child is
     * the rewritten element and whose other children are emitted before it, or any other node,
     * which ends the extraction chain.
     *
     * @param element The host element, with the directive attribute already removed.
     * @param expression The directive expression.
     * @param context The compilation context.
     * @return The replacement node.
     */
    AstNode extract(ElementNode element, String expression, CompilationContext context);
}
