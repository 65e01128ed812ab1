package org.tessera.compiler.pipeline;

import org.tessera.compiler.frontend.parser.ast.AstNode;

/**
 * A single stage of the tree-rewriting pipeline.
 * <p>
 * For every node, the pipeline calls {@link #before} of all passes in order, then visits the
 * children, then calls {@link #after} of all passes in order. Both hooks default to no-ops so a
 * pass only overrides what it needs.
 */
public interface IAstPass {

    /**
     * Called before the children of the node are visited.
     * @param node The visited node; its parent is already set.
     * @param context The per-compilation context.
     * @return The action to apply.
     */
    default NodeAction before(AstNode node, CompilationContext context) {
        return NodeAction.none();
    }

    /**
     * Called after the children of the node have been visited.
     * @param node The visited node.
     * @param context The per-compilation context.
     * @return The action to apply. {@link NodeAction.SkipChildren} has no effect here.
     */
    default NodeAction after(AstNode node, CompilationContext context) {
        return NodeAction.none();
    }

    /**
     * @return A short name used in log and error messages.
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
