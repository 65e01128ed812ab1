package org.tessera.compiler.pipeline.passes;

import org.tessera.compiler.config.CompilerConfig;
import org.tessera.compiler.directive.DirectiveRegistry;
import org.tessera.compiler.pipeline.AstPipeline;

/**
 * Assembles the standard pass sequence. Extensions can add their own passes to the returned
 * pipeline, either by priority or anchored to one of the standard passes.
 */
public final class DefaultPipeline {

    public static final int ELEMENT_ROUTING = 15;
    public static final int DIRECTIVE_EXTRACTION = 20;
    public static final int DIRECTIVE_PAIRING = 30;
    public static final int DIRECTIVE_COMPILATION = 40;
    public static final int CONTEXT_ANALYSIS = 50;

    private DefaultPipeline() {}

    /**
     * @param registry The directives known to this compilation.
     * @param config The compiler configuration.
     * @return A pipeline with routing, extraction, pairing, compilation and context analysis.
     */
    public static AstPipeline create(DirectiveRegistry registry, CompilerConfig config) {
        return new AstPipeline(config)
                .addPass(new ElementRoutingPass(registry, config), ELEMENT_ROUTING)
                .addPass(new DirectiveExtractionPass(registry, config), DIRECTIVE_EXTRACTION)
                .addPass(new DirectivePairingPass(registry), DIRECTIVE_PAIRING)
                .addPass(new DirectiveCompilationPass(registry), DIRECTIVE_COMPILATION)
                .addPass(new ContextAnalysisPass(), CONTEXT_ANALYSIS);
    }
}
