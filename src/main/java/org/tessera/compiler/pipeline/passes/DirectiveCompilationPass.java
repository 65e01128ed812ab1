package org.tessera.compiler.pipeline.passes;

import org.tessera.compiler.diagnostics.DidYouMean;
import org.tessera.compiler.directive.DirectiveDescriptor;
import org.tessera.compiler.directive.DirectiveRegistry;
import org.tessera.compiler.directive.IDirectiveCompiler;
import org.tessera.compiler.frontend.parser.ast.AstNode;
import org.tessera.compiler.frontend.parser.ast.DirectiveNode;
import org.tessera.compiler.pipeline.CompilationContext;
import org.tessera.compiler.pipeline.IAstPass;
import org.tessera.compiler.pipeline.NodeAction;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Replaces directive nodes with the code their compilers generate, once their children are done.
 * <p>
 * A paired chain ({@code if}, {@code elseif}, {@code else}) is compiled as a whole at the position
 * of its last member, when every member's children have been processed. Earlier members are
 * removed; whitespace between the members is therefore emitted before the chain.
 */
public class DirectiveCompilationPass implements IAstPass {

    private final DirectiveRegistry registry;

    public DirectiveCompilationPass(DirectiveRegistry registry) {
        this.registry = registry;
    }

    @Override
    public NodeAction after(AstNode node, CompilationContext context) {
        if (!(node instanceof DirectiveNode directive)) {
            return NodeAction.none();
        }
        IDirectiveCompiler compiler = compilerFor(directive, context);
        DirectiveDescriptor descriptor = compiler.getDescriptor();

        Optional<String> enclosing = descriptor.getEnclosingDirective();
        if (enclosing.isPresent()) {
            if (context.findEnclosingDirective(directive, Set.of(enclosing.get())).isEmpty()) {
                throw context.syntaxError(context.getConfig().directiveAttribute(directive.getName())
                        + " must be used inside " + context.getConfig().directiveAttribute(enclosing.get()), directive);
            }
            return NodeAction.none();
        }

        if (directive.getPairedSibling().isPresent()) {
            // Not the last member of its chain: compiled later with the rest.
            return NodeAction.replace(List.of());
        }
        if (directive.isConsumedByPairing()) {
            DirectiveNode root = directive;
            while (root.getPairedPrimary().isPresent()) {
                root = root.getPairedPrimary().get();
            }
            return NodeAction.replace(compilerFor(root, context).compile(root, context), true);
        }
        return NodeAction.replace(compiler.compile(directive, context), true);
    }

    private IDirectiveCompiler compilerFor(DirectiveNode directive, CompilationContext context) {
        return registry.get(directive.getName()).orElseThrow(() -> {
            Optional<String> suggestion = DidYouMean.suggest(directive.getName(), registry.names());
            return context.syntaxError("Unknown directive \"" + directive.getName() + "\""
                    + suggestion.map(s -> ". Did you mean \"" + s + "\"?").orElse(""),
                    directive.getLine(), directive.getColumn(), suggestion.orElse(null));
        });
    }
}
