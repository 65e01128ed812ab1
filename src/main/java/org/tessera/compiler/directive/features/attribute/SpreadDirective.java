package org.tessera.compiler.directive.features.attribute;

import org.tessera.compiler.directive.AttributeMergePolicy;
import org.tessera.compiler.directive.DirectiveDescriptor;
import org.tessera.compiler.directive.DirectiveType;
import org.tessera.compiler.directive.IDirectiveCompiler;
import org.tessera.compiler.frontend.parser.ast.AstNode;
import org.tessera.compiler.frontend.parser.ast.DirectiveNode;
import org.tessera.compiler.pipeline.CompilationContext;
import org.tessera.compiler.util.JavaSource;
import org.tessera.compiler.util.RuntimeSymbols;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Compiles {@code s:spread="map"} (alias {@code s:attr}), rendering every map entry as an attribute.
 * Attributes written explicitly on the element win over spread entries of the same name.
 */
public class SpreadDirective implements IDirectiveCompiler {

    private static final AttributeMergePolicy POLICY = AttributeMergePolicy.excludeNamed(SpreadDirective::spread);

    private static final DirectiveDescriptor DESCRIPTOR = DirectiveDescriptor.builder()
            .mergePolicy(POLICY)
            .build();

    @Override
    public List<AstNode> compile(DirectiveNode node, CompilationContext context) {
        String expression = AttributeDirectives.requireExpression(node, context);
        return AttributeDirectives.spread(node, POLICY.exclude(expression, Set.of()));
    }

    static String spread(String expression, Set<String> excluded) {
        String names = excluded.stream().map(JavaSource::stringLiteral).collect(Collectors.joining(", "));
        return RuntimeSymbols.HTML_ATTRIBUTES + ".spread(" + expression + ", java.util.Set.of(" + names + "))";
    }

    @Override
    public DirectiveType getType() {
        return DirectiveType.ATTRIBUTE;
    }

    @Override
    public DirectiveDescriptor getDescriptor() {
        return DESCRIPTOR;
    }
}
