package org.tessera.compiler.backend.emit;

import org.tessera.compiler.frontend.parser.ast.AstNode;
import org.tessera.compiler.pipeline.CompilationContext;

/**
 * Mutable state passed to emitters while a document is generated.
 */
public final class EmitContext {

    private final CompilationContext compilation;
    private final EmitterRegistry registry;
    private final CodeWriter writer = new CodeWriter();

    /**
     * @param compilation The per-compilation context, for configuration, fresh variables and errors.
     * @param registry The registry for resolving node emitters.
     */
    public EmitContext(CompilationContext compilation, EmitterRegistry registry) {
        this.compilation = compilation;
        this.registry = registry;
    }

    /**
     * Emits the given node by resolving and invoking its emitter.
     * @param node The node to emit.
     */
    public void emit(AstNode node) {
        registry.resolve(node).emit(node, this);
    }

    /**
     * Emits all nodes in order.
     * @param nodes The nodes to emit.
     */
    public void emitAll(Iterable<? extends AstNode> nodes) {
        for (AstNode node : nodes) {
            emit(node);
        }
    }

    public CodeWriter writer() {
        return writer;
    }

    public CompilationContext compilation() {
        return compilation;
    }
}
