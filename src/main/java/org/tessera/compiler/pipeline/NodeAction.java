package org.tessera.compiler.pipeline;

import org.tessera.compiler.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * The result of a pass hook, telling the {@link AstPipeline} what to do with the visited node.
 */
public sealed interface NodeAction permits NodeAction.None, NodeAction.SkipChildren, NodeAction.Replace {

    /** Keep the node and continue normally. */
    record None() implements NodeAction {}

    /** Keep the node, but do not run the returning pass on its subtree. Only meaningful from {@code before}. */
    record SkipChildren() implements NodeAction {}

    /**
     * Splice the given nodes into the parent's child list in place of the visited node.
     *
     * @param nodes   The replacement nodes, possibly empty.
     * @param restart If {@code true}, the replacements re-enter at the returning pass, otherwise at the next one.
     */
    record Replace(List<AstNode> nodes, boolean restart) implements NodeAction {
        public Replace {
            nodes = List.copyOf(nodes);
        }
    }

    /**
     * @return An action that leaves the node untouched.
     */
    static NodeAction none() {
        return new None();
    }

    /**
     * @return An action that excludes the subtree from the current pass.
     */
    static NodeAction skipChildren() {
        return new SkipChildren();
    }

    /**
     * @param nodes The replacement nodes.
     * @return An action replacing the node; replacements continue with the next pass.
     */
    static NodeAction replace(List<? extends AstNode> nodes) {
        return new Replace(List.copyOf(nodes), false);
    }

    /**
     * @param nodes   The replacement nodes.
     * @param restart Whether the replacements re-enter at the same pass.
     * @return An action replacing the node.
     */
    static NodeAction replace(List<? extends AstNode> nodes, boolean restart) {
        return new Replace(List.copyOf(nodes), restart);
    }
}
