package org.tessera.compiler.directive;

import org.tessera.compiler.config.CompilerConfig;
import org.tessera.compiler.diagnostics.DidYouMean;
import org.tessera.compiler.frontend.parser.ast.AttributeNode;
import org.tessera.compiler.frontend.parser.ast.AttributeValue;
import org.tessera.compiler.pipeline.CompilationContext;

import java.util.List;
import java.util.Optional;

/**
 * Recognizes directive attributes and resolves them against the {@link DirectiveRegistry}.
 */
public final class DirectiveClassifier {

    private final DirectiveRegistry registry;
    private final CompilerConfig config;

    public DirectiveClassifier(DirectiveRegistry registry, CompilerConfig config) {
        this.registry = registry;
        this.config = config;
    }

    /**
     * @param attributeName An attribute name.
     * @return The bare directive name if the attribute carries the directive prefix.
     */
    public Optional<String> directiveName(String attributeName) {
        return config.isDirectiveAttribute(attributeName)
                ? Optional.of(config.directiveName(attributeName))
                : Optional.empty();
    }

    /**
     * Checks whether an attribute triggers extraction. Unknown directives count, so that they are reported.
     * @param attributeName An attribute name.
     * @return {@code true} for directive attributes that are not pass-through.
     */
    public boolean isActiveDirective(String attributeName) {
        return directiveName(attributeName)
                .map(name -> registry.get(name).map(c -> c.getType() != DirectiveType.PASS_THROUGH).orElse(true))
                .orElse(false);
    }

    /**
     * @param attributes The attributes of a node.
     * @return {@code true} if any attribute triggers extraction.
     */
    public boolean hasActiveDirective(List<AttributeNode> attributes) {
        return attributes.stream().anyMatch(a -> isActiveDirective(a.name()));
    }

    /**
     * Resolves the compiler of a directive attribute.
     * @param attribute The directive attribute.
     * @param context The compilation context, for error reporting.
     * @return The compiler.
     * @throws org.tessera.compiler.api.SyntaxException if the directive is unknown.
     */
    public IDirectiveCompiler require(AttributeNode attribute, CompilationContext context) {
        String name = config.directiveName(attribute.name());
        return registry.get(name).orElseThrow(() -> {
            Optional<String> suggestion = DidYouMean.suggest(name, registry.names());
            String message = "Unknown directive \"" + name + "\""
                    + suggestion.map(s -> ". Did you mean \"" + s + "\"?").orElse("");
            int column = attribute.column() + config.directiveAttributePrefix().length();
            return context.syntaxError(message, attribute.line(), column, suggestion.orElse(null));
        });
    }

    /**
     * Reads the expression of a directive attribute.
     * @param attribute The directive attribute.
     * @param context The compilation context, for error reporting.
     * @return The static value, or {@code "true"} for a boolean attribute.
     * @throws org.tessera.compiler.api.SyntaxException if the value contains output expressions.
     */
    public String expressionOf(AttributeNode attribute, CompilationContext context) {
        if (attribute.value().isBoolean()) {
            return "true";
        }
        if (attribute.value() instanceof AttributeValue.Static s) {
            return s.text();
        }
        throw context.syntaxError("Directive attributes cannot contain dynamic output expressions",
                attribute.line(), attribute.column(), null);
    }

    /**
     * @return The directive prefix, e.g. {@code "s"}.
     */
    public String prefix() {
        return config.directivePrefix();
    }

    /**
     * @param name A directive name.
     * @return The directive as written in templates, e.g. {@code s:if}.
     */
    public String display(String name) {
        return config.directiveAttribute(name);
    }
}
