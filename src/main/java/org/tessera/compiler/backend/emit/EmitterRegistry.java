package org.tessera.compiler.backend.emit;

import org.tessera.compiler.backend.emit.features.ContainerEmitter;
import org.tessera.compiler.backend.emit.features.DirectiveEmitter;
import org.tessera.compiler.backend.emit.features.ElementEmitter;
import org.tessera.compiler.backend.emit.features.OutputEmitter;
import org.tessera.compiler.backend.emit.features.RawBodyEmitter;
import org.tessera.compiler.backend.emit.features.RawCodeEmitter;
import org.tessera.compiler.backend.emit.features.TextEmitter;
import org.tessera.compiler.frontend.parser.ast.AstNode;
import org.tessera.compiler.frontend.parser.ast.DirectiveNode;
import org.tessera.compiler.frontend.parser.ast.DocumentNode;
import org.tessera.compiler.frontend.parser.ast.ElementNode;
import org.tessera.compiler.frontend.parser.ast.FragmentNode;
import org.tessera.compiler.frontend.parser.ast.OutputNode;
import org.tessera.compiler.frontend.parser.ast.RawBodyNode;
import org.tessera.compiler.frontend.parser.ast.RawCodeNode;
import org.tessera.compiler.frontend.parser.ast.TextNode;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry mapping AST node classes to emitter instances.
 * <p>
 * {@link #resolve(AstNode)} walks the class hierarchy to find the nearest registered emitter and
 * falls back to the default emitter, which rejects the node.
 */
public final class EmitterRegistry {

    private final Map<Class<? extends AstNode>, INodeEmitter<? extends AstNode>> byClass = new HashMap<>();
    private final INodeEmitter<AstNode> defaultEmitter;

    private EmitterRegistry(INodeEmitter<AstNode> defaultEmitter) {
        this.defaultEmitter = defaultEmitter;
    }

    /**
     * Registers an emitter for the given AST node class.
     *
     * @param nodeType The AST node class.
     * @param emitter  The emitter handling that class.
     * @param <T>      Concrete AST type parameter.
     */
    public <T extends AstNode> void register(Class<T> nodeType, INodeEmitter<? super T> emitter) {
        byClass.put(nodeType, emitter);
    }

    /**
     * Retrieves the emitter registered for exactly the given class.
     *
     * @param nodeType The AST node class.
     * @return The emitter, if registered.
     */
    public Optional<INodeEmitter<? extends AstNode>> get(Class<? extends AstNode> nodeType) {
        return Optional.ofNullable(byClass.get(nodeType));
    }

    /**
     * Resolves the emitter for a node by searching its class, then its superclasses.
     *
     * @param node The node.
     * @return A non-null emitter.
     */
    @SuppressWarnings("unchecked")
    public INodeEmitter<AstNode> resolve(AstNode node) {
        Class<?> c = node.getClass();
        while (c != null && AstNode.class.isAssignableFrom(c)) {
            INodeEmitter<?> found = byClass.get(c);
            if (found != null) {
                return (INodeEmitter<AstNode>) found;
            }
            c = c.getSuperclass();
        }
        return defaultEmitter;
    }

    /**
     * Creates an empty registry.
     * @param defaultEmitter The fallback for unregistered node types.
     * @return A new registry.
     */
    public static EmitterRegistry initialize(INodeEmitter<AstNode> defaultEmitter) {
        return new EmitterRegistry(defaultEmitter);
    }

    /**
     * Creates a registry with the built-in emitters.
     * @return A registry for all node types the pipeline leaves behind.
     */
    public static EmitterRegistry initializeWithDefaults() {
        EmitterRegistry reg = initialize(new UnsupportedNodeEmitter());
        ContainerEmitter container = new ContainerEmitter();
        reg.register(DocumentNode.class, container);
        reg.register(FragmentNode.class, container);
        reg.register(ElementNode.class, new ElementEmitter());
        reg.register(TextNode.class, new TextEmitter());
        reg.register(OutputNode.class, new OutputEmitter());
        reg.register(RawCodeNode.class, new RawCodeEmitter());
        reg.register(RawBodyNode.class, new RawBodyEmitter());
        reg.register(DirectiveNode.class, new DirectiveEmitter());
        return reg;
    }
}
