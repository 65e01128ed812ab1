package org.tessera.compiler.pipeline;

import org.tessera.compiler.api.DependencySink;
import org.tessera.compiler.api.SyntaxException;
import org.tessera.compiler.config.CompilerConfig;
import org.tessera.compiler.diagnostics.SnippetGenerator;
import org.tessera.compiler.frontend.parser.ast.AstNode;
import org.tessera.compiler.frontend.parser.ast.DirectiveNode;

import java.util.Collection;
import java.util.Optional;

/**
 * Per-compilation state shared by all passes and directive compilers.
 * <p>
 * A new context is created for every compile call and handed explicitly through the pipeline;
 * nothing in here is global.
 */
public class CompilationContext {

    private final String templatePath;
    private final String source;
    private final CompilerConfig config;
    private final DependencySink dependencies;
    private int variableCounter = 0;

    /**
     * Creates a new compilation context.
     * @param templatePath The path of the compiled template, may be {@code null} for inline sources.
     * @param source The full template source.
     * @param config The compiler configuration.
     * @param dependencies The sink receiving every external template this compilation consumes.
     */
    public CompilationContext(String templatePath, String source, CompilerConfig config, DependencySink dependencies) {
        this.templatePath = templatePath;
        this.source = source;
        this.config = config;
        this.dependencies = dependencies == null ? DependencySink.NONE : dependencies;
    }

    public String getTemplatePath() {
        return templatePath;
    }

    public String getSource() {
        return source;
    }

    public CompilerConfig getConfig() {
        return config;
    }

    public boolean isDebug() {
        return config.debug();
    }

    public DependencySink getDependencies() {
        return dependencies;
    }

    /**
     * Reserves a local variable name that is unique within the generated render body.
     * @param hint A readable stem, e.g. {@code "items"}.
     * @return A name such as {@code __items3}.
     */
    public String freshVariable(String hint) {
        variableCounter++;
        return "__" + hint + variableCounter;
    }

    /**
     * Finds the closest directive ancestor with one of the given names, following parent links.
     * @param node The node to start from (exclusive).
     * @param names The directive names to look for.
     * @return The enclosing directive, if any.
     */
    public Optional<DirectiveNode> findEnclosingDirective(AstNode node, Collection<String> names) {
        for (AstNode current = node.getParent(); current != null; current = current.getParent()) {
            if (current instanceof DirectiveNode directive && names.contains(directive.getName())) {
                return Optional.of(directive);
            }
        }
        return Optional.empty();
    }

    /**
     * Creates a syntax error pointing at the given node, including a source excerpt.
     * @param message The error message.
     * @param node The offending node.
     * @return The exception, for the caller to throw.
     */
    public SyntaxException syntaxError(String message, AstNode node) {
        return syntaxError(message, node.getLine(), node.getColumn(), null);
    }

    /**
     * Creates a syntax error at an explicit position, including a source excerpt.
     * @param message The error message.
     * @param line The 1-based line.
     * @param column The 1-based column.
     * @param suggestion A suggested correction, may be {@code null}.
     * @return The exception, for the caller to throw.
     */
    public SyntaxException syntaxError(String message, int line, int column, String suggestion) {
        String snippet = source == null ? null : SnippetGenerator.generate(source, line, column);
        return new SyntaxException(message, templatePath, line, column, snippet, suggestion);
    }
}
