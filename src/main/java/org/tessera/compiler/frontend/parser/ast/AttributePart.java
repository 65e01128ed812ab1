package org.tessera.compiler.frontend.parser.ast;

/**
 * One segment of a mixed attribute value.
 */
public sealed interface AttributePart permits AttributePart.Literal, AttributePart.Dynamic {

    /**
     * Literal text as written in the source.
     * @param text The text.
     */
    record Literal(String text) implements AttributePart {}

    /**
     * A dynamic expression.
     * @param output The output node.
     */
    record Dynamic(OutputNode output) implements AttributePart {}
}
