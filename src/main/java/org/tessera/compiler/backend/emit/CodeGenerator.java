package org.tessera.compiler.backend.emit;

import org.tessera.compiler.frontend.parser.ast.DocumentNode;
import org.tessera.compiler.pipeline.CompilationContext;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Phase: turns the rewritten document into the Java source of a render body by delegating to
 * emitters resolved via the {@link EmitterRegistry}.
 * <p>
 * The generated statements write to a variable named {@code out}; the surrounding method and the
 * runtime helpers belong to the runtime library.
 */
public final class CodeGenerator {

    static final String PREAMBLE = "// Generated by the Tessera template compiler. Do not edit.";

    private final EmitterRegistry registry;

    public CodeGenerator() {
        this(EmitterRegistry.initializeWithDefaults());
    }

    /**
     * @param registry The emitter registry.
     */
    public CodeGenerator(EmitterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Generates the render body.
     *
     * @param document The document after all passes.
     * @param context  The compilation context.
     * @return The generated Java source.
     */
    public String generate(DocumentNode document, CompilationContext context) {
        EmitContext ctx = new EmitContext(context, registry);
        ctx.writer().statement(PREAMBLE);
        if (context.isDebug() && context.getTemplatePath() != null) {
            ctx.writer().comment("Source: " + context.getTemplatePath());
            ctx.writer().comment("Compiled: " + Instant.now().truncatedTo(ChronoUnit.SECONDS));
        }
        ctx.emit(document);
        return ctx.writer().finish();
    }
}
