package org.tessera.compiler.directive;

import org.tessera.compiler.frontend.parser.ast.AstNode;
import org.tessera.compiler.frontend.parser.ast.DirectiveNode;
import org.tessera.compiler.pipeline.CompilationContext;

import java.util.List;

/**
 * Interface for compilers that turn a {@link DirectiveNode} into generated nodes.
 */
public interface IDirectiveCompiler {

    /**
     * Compiles the directive.
     * @param node The directive node, with its children already processed.
     * @param context The compilation context.
     * @return The nodes replacing the directive, in order.
     */
    List<AstNode> compile(DirectiveNode node, CompilationContext context);

    /**
     * @return How this directive takes part in extraction.
     */
    DirectiveType getType();

    /**
     * @return The optional capabilities of this directive.
     */
    default DirectiveDescriptor getDescriptor() {
        return DirectiveDescriptor.NONE;
    }
}
