package org.tessera.compiler;

import org.tessera.compiler.api.CompilationException;
import org.tessera.compiler.api.CompiledTemplate;
import org.tessera.compiler.api.DependencySink;
import org.tessera.compiler.api.ITemplateCompiler;
import org.tessera.compiler.api.TemplateException;
import org.tessera.compiler.api.TemplateLoader;
import org.tessera.compiler.backend.emit.CodeGenerator;
import org.tessera.compiler.config.CompilerConfig;
import org.tessera.compiler.diagnostics.CompilerLogger;
import org.tessera.compiler.diagnostics.DiagnosticsEngine;
import org.tessera.compiler.directive.DirectiveRegistry;
import org.tessera.compiler.frontend.lexer.Lexer;
import org.tessera.compiler.frontend.lexer.Token;
import org.tessera.compiler.frontend.parser.Parser;
import org.tessera.compiler.frontend.parser.ast.DocumentNode;
import org.tessera.compiler.pipeline.AstPipeline;
import org.tessera.compiler.pipeline.CompilationContext;
import org.tessera.compiler.pipeline.passes.DefaultPipeline;

import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * The main compiler implementation. It orchestrates lexing, parsing, the pass pipeline and code
 * generation for one template at a time.
 * <p>
 * An instance can be reused; every call builds fresh lexer, parser and pipeline state. The
 * directive registry is shared between calls and must not be modified while compiling.
 */
public class TemplateCompiler implements ITemplateCompiler {

    private final CompilerConfig config;
    private final DirectiveRegistry registry;
    private final CodeGenerator codeGenerator = new CodeGenerator();

    public TemplateCompiler() {
        this(CompilerConfig.defaults());
    }

    /**
     * @param config The compiler configuration.
     */
    public TemplateCompiler(CompilerConfig config) {
        this(config, DirectiveRegistry.withDefaults(config));
    }

    /**
     * @param config The compiler configuration.
     * @param registry The directives to compile with, usually {@link DirectiveRegistry#withDefaults} plus extensions.
     */
    public TemplateCompiler(CompilerConfig config, DirectiveRegistry registry) {
        this.config = Objects.requireNonNull(config, "config");
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    @Override
    public CompiledTemplate compile(String source, String templatePath) throws CompilationException {
        return compile(source, templatePath, DependencySink.NONE);
    }

    @Override
    public CompiledTemplate compile(String path, TemplateLoader loader, DependencySink dependencies)
            throws CompilationException, IOException {
        String resolved = loader.resolve(path, null);
        String source = loader.load(resolved);
        return compile(source, resolved, dependencies);
    }

    /**
     * Compiles a template and reports consumed templates to the given sink.
     *
     * @param source The template source.
     * @param templatePath The path used in diagnostics, may be {@code null}.
     * @param dependencies The dependency sink.
     * @return The generated render body and any warnings.
     * @throws CompilationException if the template is invalid.
     */
    public CompiledTemplate compile(String source, String templatePath, DependencySink dependencies)
            throws CompilationException {
        String displayName = templatePath == null ? "<inline>" : templatePath;
        CompilerLogger.info("Compiling {}", displayName);
        DiagnosticsEngine diagnostics = new DiagnosticsEngine(templatePath);
        CompilationContext context = new CompilationContext(templatePath, source, config, dependencies);

        try {
            // Phase 1: Lexical analysis
            long start = System.nanoTime();
            List<Token> tokens = new Lexer(source, config).scanTokens();
            long lexed = System.nanoTime();

            // Phase 2: Parsing (recovers from malformed markup with warnings)
            DocumentNode document = new Parser(tokens, config, diagnostics).parse();
            long parsed = System.nanoTime();

            // Phase 3: Pass pipeline (directives, pairing, compilation, context analysis)
            AstPipeline pipeline = DefaultPipeline.create(registry, config);
            DocumentNode rewritten = pipeline.execute(document, context);
            long transformed = System.nanoTime();

            // Phase 4: Code generation
            String generated = codeGenerator.generate(rewritten, context);
            long generatedAt = System.nanoTime();

            CompilerLogger.debug("{}: lexed {} tokens in {} ms, parsed in {} ms, passes in {} ms, generated in {} ms",
                    displayName, tokens.size(), millis(start, lexed), millis(lexed, parsed),
                    millis(parsed, transformed), millis(transformed, generatedAt));
            if (!diagnostics.getDiagnostics().isEmpty()) {
                CompilerLogger.warn("{}", diagnostics.summary());
            }
            return new CompiledTemplate(templatePath, generated, diagnostics.getDiagnostics());
        } catch (TemplateException e) {
            throw new CompilationException(e);
        }
    }

    private static long millis(long from, long to) {
        return (to - from) / 1_000_000;
    }

    public CompilerConfig getConfig() {
        return config;
    }

    public DirectiveRegistry getRegistry() {
        return registry;
    }
}
