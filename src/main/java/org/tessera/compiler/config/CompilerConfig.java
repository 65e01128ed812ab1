package org.tessera.compiler.config;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable configuration of a single compiler instance.
 *
 * @param directivePrefix     The prefix of directive attributes, without the colon (e.g. "s" for {@code s:if}).
 * @param elementPrefix       The prefix of custom elements (e.g. "s-" for {@code <s-template>}).
 * @param fragmentElement     The name of the fragment pseudo-element.
 * @param slotAttribute       The attribute marker used by component slots.
 * @param bindAttribute       The attribute marker used by component bindings.
 * @param voidTags            Lower-case names of elements that never have a closing tag.
 * @param passThroughComments Whether HTML comments are kept in the generated output.
 * @param debug               Whether the generated source carries a debug header.
 * @param maxDepth            The maximum nesting depth the pipeline accepts.
 * @param maxReplays          The maximum number of restart replays per node.
 */
public record CompilerConfig(
        String directivePrefix,
        String elementPrefix,
        String fragmentElement,
        String slotAttribute,
        String bindAttribute,
        Set<String> voidTags,
        boolean passThroughComments,
        boolean debug,
        int maxDepth,
        int maxReplays
) {

    /** The HTML void elements. */
    public static final Set<String> DEFAULT_VOID_TAGS = Set.of(
            "area", "base", "br", "col", "embed", "hr", "img",
            "input", "link", "meta", "param", "source", "track", "wbr");

    public CompilerConfig {
        if (directivePrefix == null || directivePrefix.isBlank()) {
            throw new IllegalArgumentException("Directive prefix must not be empty");
        }
        if (elementPrefix == null || elementPrefix.isBlank()) {
            throw new IllegalArgumentException("Element prefix must not be empty");
        }
        if (fragmentElement == null || fragmentElement.isBlank()) {
            fragmentElement = elementPrefix + "template";
        }
        voidTags = voidTags.stream()
                .map(t -> t.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        if (maxDepth <= 0 || maxReplays <= 0) {
            throw new IllegalArgumentException("Pipeline limits must be positive");
        }
    }

    /**
     * @return The configuration matching the classpath defaults in {@code reference.conf}.
     */
    public static CompilerConfig defaults() {
        return new CompilerConfig("s", "s-", null, "slot", "bind", DEFAULT_VOID_TAGS, true, false, 512, 10_000);
    }

    /**
     * Creates a copy with another directive prefix. The element prefix follows it ("x" gives "x-").
     * @param prefix The new directive prefix.
     * @return The new configuration.
     */
    public CompilerConfig withDirectivePrefix(String prefix) {
        return new CompilerConfig(prefix, prefix + "-", null, slotAttribute, bindAttribute,
                voidTags, passThroughComments, debug, maxDepth, maxReplays);
    }

    /**
     * Creates a copy with the debug header switched on or off.
     * @param enabled Whether the debug header is emitted.
     * @return The new configuration.
     */
    public CompilerConfig withDebug(boolean enabled) {
        return new CompilerConfig(directivePrefix, elementPrefix, fragmentElement, slotAttribute, bindAttribute,
                voidTags, passThroughComments, enabled, maxDepth, maxReplays);
    }

    /**
     * Creates a copy with comment pass-through switched on or off.
     * @param enabled Whether HTML comments are kept.
     * @return The new configuration.
     */
    public CompilerConfig withPassThroughComments(boolean enabled) {
        return new CompilerConfig(directivePrefix, elementPrefix, fragmentElement, slotAttribute, bindAttribute,
                voidTags, enabled, debug, maxDepth, maxReplays);
    }

    /**
     * Checks whether the given tag name is a configured void element.
     * @param tagName The tag name, in any case.
     * @return {@code true} if the element never has a closing tag.
     */
    public boolean isVoidTag(String tagName) {
        return voidTags.contains(tagName.toLowerCase(Locale.ROOT));
    }

    /**
     * @return The full attribute prefix including the separator, e.g. {@code "s:"}.
     */
    public String directiveAttributePrefix() {
        return directivePrefix + ":";
    }

    /**
     * Checks whether an attribute name carries the directive prefix.
     * @param attributeName The attribute name.
     * @return {@code true} for directive attributes such as {@code s:if}.
     */
    public boolean isDirectiveAttribute(String attributeName) {
        return attributeName.startsWith(directiveAttributePrefix())
                && attributeName.length() > directiveAttributePrefix().length();
    }

    /**
     * Strips the directive prefix from an attribute name.
     * @param attributeName A directive attribute name such as {@code s:if}.
     * @return The bare directive name, e.g. {@code if}.
     */
    public String directiveName(String attributeName) {
        return attributeName.substring(directiveAttributePrefix().length());
    }

    /**
     * @param directiveName A bare directive name.
     * @return The attribute name for the directive, e.g. {@code s:if}.
     */
    public String directiveAttribute(String directiveName) {
        return directiveAttributePrefix() + directiveName;
    }
}
