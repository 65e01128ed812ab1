package org.tessera.compiler.pipeline.passes;

import org.tessera.compiler.config.CompilerConfig;
import org.tessera.compiler.diagnostics.CompilerLogger;
import org.tessera.compiler.directive.AttributeExpressions;
import org.tessera.compiler.directive.AttributeMergePolicy;
import org.tessera.compiler.directive.DirectiveClassifier;
import org.tessera.compiler.directive.DirectiveDescriptor;
import org.tessera.compiler.directive.DirectiveRegistry;
import org.tessera.compiler.directive.DirectiveType;
import org.tessera.compiler.directive.IDirectiveCompiler;
import org.tessera.compiler.directive.IElementExtractor;
import org.tessera.compiler.directive.MergeMode;
import org.tessera.compiler.frontend.parser.ast.AstNode;
import org.tessera.compiler.frontend.parser.ast.AttributeNode;
import org.tessera.compiler.frontend.parser.ast.AttributeValue;
import org.tessera.compiler.frontend.parser.ast.ComponentNode;
import org.tessera.compiler.frontend.parser.ast.ContainerNode;
import org.tessera.compiler.frontend.parser.ast.DirectiveNode;
import org.tessera.compiler.frontend.parser.ast.ElementNode;
import org.tessera.compiler.frontend.parser.ast.FragmentNode;
import org.tessera.compiler.frontend.parser.ast.OutputContext;
import org.tessera.compiler.frontend.parser.ast.OutputNode;
import org.tessera.compiler.pipeline.CompilationContext;
import org.tessera.compiler.pipeline.IAstPass;
import org.tessera.compiler.pipeline.NodeAction;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Moves directive attributes out of elements, fragments and components into {@link DirectiveNode}s.
 * <p>
 * A control-flow directive becomes a directive node wrapping its host; a content directive
 * replaces the host's body; attribute directives are compiled on the spot and merged into the
 * host's attributes; custom extractors rewrite the host themselves. Extraction runs on the
 * immediate children of every container before later passes see them.
 */
public class DirectiveExtractionPass implements IAstPass {

    /** A directive attribute resolved to its compiler. */
    private record Found(String name, String expression, AttributeNode attribute, IDirectiveCompiler compiler) {
        DirectiveDescriptor descriptor() {
            return compiler.getDescriptor();
        }

        DirectiveNode toNode(List<AstNode> children) {
            return new DirectiveNode(name, expression, children, attribute.line(), attribute.column());
        }
    }

    private final CompilerConfig config;
    private final DirectiveClassifier classifier;

    public DirectiveExtractionPass(DirectiveRegistry registry, CompilerConfig config) {
        this.config = config;
        this.classifier = new DirectiveClassifier(registry, config);
    }

    @Override
    public NodeAction before(AstNode node, CompilationContext context) {
        if (isExtractable(node)) {
            return NodeAction.replace(extract(node, context), true);
        }
        if (node instanceof ContainerNode container) {
            boolean changed = false;
            List<AstNode> children = new ArrayList<>(container.getChildren().size());
            for (AstNode child : container.getChildren()) {
                if (isExtractable(child)) {
                    children.addAll(extract(child, context));
                    changed = true;
                } else {
                    children.add(child);
                }
            }
            if (changed) {
                container.setChildren(children);
            }
        }
        return NodeAction.none();
    }

    private boolean isExtractable(AstNode node) {
        if (node instanceof ElementNode element) {
            return classifier.hasActiveDirective(element.getAttributes());
        }
        if (node instanceof ComponentNode component) {
            return classifier.hasActiveDirective(component.getAttributes());
        }
        if (node instanceof FragmentNode fragment) {
            return !fragment.getAttributes().isEmpty();
        }
        return false;
    }

    private List<AstNode> extract(AstNode node, CompilationContext context) {
        if (node instanceof ElementNode element) {
            return extractElement(element, context);
        }
        if (node instanceof ComponentNode component) {
            return extractComponent(component, context);
        }
        return extractFragment((FragmentNode) node, context);
    }

    // ---- Elements ---------------------------------------------------------------------------

    private List<AstNode> extractElement(ElementNode element, CompilationContext context) {
        List<AttributeNode> remaining = new ArrayList<>();
        List<Found> attributeDirectives = new ArrayList<>();
        List<Found> extractors = new ArrayList<>();
        Found controlFlow = null;
        Found content = null;
        Found wrapping = null;

        for (AttributeNode attribute : element.getAttributes()) {
            Optional<Found> resolved = resolve(attribute, context);
            if (resolved.isEmpty()) {
                remaining.add(attribute);
                continue;
            }
            Found found = resolved.get();
            DirectiveDescriptor descriptor = found.descriptor();
            if (descriptor.getContentWrapping().isPresent()) {
                wrapping = found;
            } else if (descriptor.getCustomExtraction().isPresent()) {
                extractors.add(found);
            } else if (found.compiler().getType() == DirectiveType.CONTROL_FLOW) {
                controlFlow = single(controlFlow, found, "Only one control flow directive allowed per element. "
                        + "Nest elements to combine directives, e.g. put " + classifier.display("if")
                        + " on a wrapping " + "<" + config.fragmentElement() + ">.", context);
            } else if (found.compiler().getType() == DirectiveType.CONTENT) {
                content = single(content, found, "Only one content directive allowed per element. Use either "
                        + classifier.display("text") + " or " + classifier.display("html") + ", not both.", context);
            } else {
                attributeDirectives.add(found);
            }
        }

        applyAttributeDirectives(remaining, attributeDirectives, context);

        if (wrapping != null && content == null) {
            throw context.syntaxError("The " + classifier.display(wrapping.name()) + " directive requires a content "
                    + "directive like " + classifier.display("text") + " or " + classifier.display("html")
                    + " on the same element.", wrapping.attribute().line(), wrapping.attribute().column(), null);
        }

        List<AstNode> result = new ArrayList<>();
        boolean keepHost = wrapping == null || wrapping.descriptor().getContentWrapping().orElse(true);
        if (content != null && !keepHost) {
            if (!remaining.isEmpty() || !extractors.isEmpty()) {
                throw context.syntaxError("Content directives without a wrapper cannot include other attributes.",
                        content.attribute().line(), content.attribute().column(), null);
            }
            result.add(content.toNode(List.of()));
        } else {
            List<AstNode> children = content != null ? List.of(content.toNode(List.of())) : element.getChildren();
            AstNode current = element.copy(remaining, children);
            for (Found found : extractors) {
                if (!(current instanceof ElementNode host)) {
                    break;
                }
                IElementExtractor extractor = found.descriptor().getCustomExtraction().orElseThrow();
                AstNode rewritten = extractor.extract(host, found.expression(), context);
                if (rewritten instanceof FragmentNode fragment && endsWithElement(fragment)) {
                    List<AstNode> parts = fragment.getChildren();
                    result.addAll(parts.subList(0, parts.size() - 1));
                    current = parts.get(parts.size() - 1);
                } else {
                    current = rewritten;
                }
            }
            if (current instanceof FragmentNode fragment && fragment.getAttributes().isEmpty()) {
                result.addAll(fragment.getChildren());
            } else {
                result.add(current);
            }
        }

        CompilerLogger.trace("Extracted directives from <{}> at {}:{}", element.getTag(), element.getLine(), element.getColumn());
        if (controlFlow != null) {
            return List.of(controlFlow.toNode(result));
        }
        return result;
    }

    private static boolean endsWithElement(FragmentNode fragment) {
        List<AstNode> children = fragment.getChildren();
        return fragment.getAttributes().isEmpty()
                && !children.isEmpty()
                && children.get(children.size() - 1) instanceof ElementNode;
    }

    // ---- Components -------------------------------------------------------------------------

    private List<AstNode> extractComponent(ComponentNode component, CompilationContext context) {
        List<AttributeNode> remaining = new ArrayList<>();
        List<Found> attributeDirectives = new ArrayList<>();
        Found controlFlow = null;

        for (AttributeNode attribute : component.getAttributes()) {
            Optional<Found> resolved = resolve(attribute, context);
            if (resolved.isEmpty()) {
                remaining.add(attribute);
                continue;
            }
            Found found = resolved.get();
            DirectiveType type = found.compiler().getType();
            if (found.descriptor().getCustomExtraction().isPresent() || type == DirectiveType.CONTENT) {
                throw context.syntaxError(classifier.display(found.name()) + " cannot be used on components. "
                        + "Only control flow and attribute directives are allowed.",
                        attribute.line(), attribute.column(), null);
            }
            if (type == DirectiveType.CONTROL_FLOW) {
                controlFlow = single(controlFlow, found, "Only one control flow directive allowed per element. "
                        + "Nest elements to combine directives.", context);
            } else {
                attributeDirectives.add(found);
            }
        }

        applyAttributeDirectives(remaining, attributeDirectives, context);
        ComponentNode host = component.copy(remaining, component.getChildren());
        return List.of(controlFlow != null ? controlFlow.toNode(List.of(host)) : host);
    }

    // ---- Fragments --------------------------------------------------------------------------

    private List<AstNode> extractFragment(FragmentNode fragment, CompilationContext context) {
        String element = "<" + config.fragmentElement() + ">";
        Found controlFlow = null;
        Found content = null;

        for (AttributeNode attribute : fragment.getAttributes()) {
            if (!config.isDirectiveAttribute(attribute.name())) {
                throw context.syntaxError(element + " cannot have regular HTML attributes. Found: "
                        + (attribute.isSpread() ? "<%= %>" : attribute.name()) + ".",
                        attribute.line(), attribute.column(), null);
            }
            Optional<Found> resolved = resolve(attribute, context);
            if (resolved.isEmpty()) {
                continue;
            }
            Found found = resolved.get();
            DirectiveDescriptor descriptor = found.descriptor();
            if (descriptor.getContentWrapping().isPresent()) {
                throw context.syntaxError("The " + classifier.display(found.name()) + " directive can only be used on "
                        + "elements with " + classifier.display("text") + " or " + classifier.display("html") + ".",
                        attribute.line(), attribute.column(), null);
            }
            if (descriptor.getCustomExtraction().isPresent() || found.compiler().getType() == DirectiveType.ATTRIBUTE) {
                throw context.syntaxError(element + " cannot have attribute directives like "
                        + classifier.display(found.name()) + ". Only control flow and content directives are allowed.",
                        attribute.line(), attribute.column(), null);
            }
            if (found.compiler().getType() == DirectiveType.CONTROL_FLOW) {
                controlFlow = single(controlFlow, found, "Only one control flow directive allowed per element. "
                        + "Nest " + element + " elements to combine directives.", context);
            } else {
                content = single(content, found, "Only one content directive allowed per element. Use either "
                        + classifier.display("text") + " or " + classifier.display("html") + ", not both.", context);
            }
        }

        List<AstNode> children = content != null ? List.of(content.toNode(List.of())) : fragment.getChildren();
        if (controlFlow != null) {
            return List.of(controlFlow.toNode(children));
        }
        return new ArrayList<>(children);
    }

    // ---- Shared -----------------------------------------------------------------------------

    /**
     * @return The resolved directive, or empty for plain and pass-through attributes.
     */
    private Optional<Found> resolve(AttributeNode attribute, CompilationContext context) {
        Optional<String> name = classifier.directiveName(attribute.name());
        if (name.isEmpty()) {
            return Optional.empty();
        }
        IDirectiveCompiler compiler = classifier.require(attribute, context);
        if (compiler.getType() == DirectiveType.PASS_THROUGH) {
            return Optional.empty();
        }
        String expression = classifier.expressionOf(attribute, context);
        return Optional.of(new Found(name.get(), expression, attribute, compiler));
    }

    private static Found single(Found existing, Found found, String message, CompilationContext context) {
        if (existing != null) {
            throw context.syntaxError(message, found.attribute().line(), found.attribute().column(), null);
        }
        return found;
    }

    /**
     * Compiles attribute directives and merges their attributes into {@code attributes} in place.
     */
    private void applyAttributeDirectives(List<AttributeNode> attributes, List<Found> directives,
                                          CompilationContext context) {
        for (Found found : directives) {
            AttributeNode at = found.attribute();
            Optional<AttributeMergePolicy> policy = found.descriptor().getMergePolicy();
            MergeMode mode = policy.map(AttributeMergePolicy::mode).orElse(null);

            if (mode == MergeMode.MERGE_NAMED) {
                int index = indexOfNamed(attributes, policy.get().targetAttribute());
                if (index >= 0) {
                    AttributeNode existing = attributes.get(index);
                    String merged = policy.get().merge(AttributeExpressions.toExpression(existing.value()),
                            requireExpression(found, context));
                    OutputNode output = new OutputNode(merged, true, OutputContext.HTML_ATTRIBUTE, List.of(),
                            existing.line(), existing.column());
                    attributes.set(index, existing.withValue(AttributeValue.ofOutput(output)));
                    continue;
                }
            } else if (mode == MergeMode.EXCLUDE_NAMED) {
                String spread = policy.get().exclude(requireExpression(found, context),
                        AttributeExpressions.namedAttributes(attributes));
                OutputNode output = new OutputNode(spread, false, OutputContext.RAW, List.of(), at.line(), at.column());
                attributes.add(new AttributeNode("", AttributeValue.ofOutput(output), at.line(), at.column()));
                continue;
            } else if (mode == MergeMode.REPLACE) {
                String target = policy.get().targetAttribute();
                attributes.removeIf(a -> !a.isSpread() && a.name().equals(target));
            }

            for (AstNode compiled : found.compiler().compile(found.toNode(List.of()), context)) {
                if (!(compiled instanceof FragmentNode carrier)) {
                    throw new IllegalStateException("Attribute directive " + found.name()
                            + " must compile to attribute carriers, got " + compiled.getClass().getSimpleName());
                }
                attributes.addAll(carrier.getAttributes());
            }
        }
    }

    private static int indexOfNamed(List<AttributeNode> attributes, String name) {
        for (int i = 0; i < attributes.size(); i++) {
            if (!attributes.get(i).isSpread() && attributes.get(i).name().equals(name)) {
                return i;
            }
        }
        return -1;
    }

    private String requireExpression(Found found, CompilationContext context) {
        String expression = found.expression().trim();
        if (expression.isEmpty() || expression.equals("true")) {
            throw context.syntaxError(classifier.display(found.name()) + " requires an expression",
                    found.attribute().line(), found.attribute().column(), null);
        }
        return expression;
    }
}
