package org.tessera.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * The value of an attribute. A value always has its simplest shape: a mixed value with a single
 * part is a {@link Static} or an {@link Output}, never a one-element {@link Parts}. All factories
 * and mutators normalize, and {@link Parts} rejects anything that is not normalized.
 */
public sealed interface AttributeValue permits AttributeValue.Bool, AttributeValue.Static,
        AttributeValue.Output, AttributeValue.Parts {

    /** The presence-only value of {@code <input disabled>}. */
    AttributeValue BOOLEAN = new Bool();

    /**
     * A presence-only attribute.
     */
    record Bool() implements AttributeValue {}

    /**
     * A literal value.
     * @param text The text as written in the source.
     */
    record Static(String text) implements AttributeValue {}

    /**
     * A single dynamic expression.
     * @param output The output node.
     */
    record Output(OutputNode output) implements AttributeValue {}

    /**
     * An ordered mix of literals and expressions with at least two parts and no adjacent literals.
     * @param parts The parts.
     */
    record Parts(List<AttributePart> parts) implements AttributeValue {
        public Parts {
            parts = List.copyOf(parts);
            if (parts.size() < 2) {
                throw new IllegalArgumentException("Parts value needs at least two parts, use AttributeValue.of()");
            }
            for (int i = 1; i < parts.size(); i++) {
                if (parts.get(i) instanceof AttributePart.Literal && parts.get(i - 1) instanceof AttributePart.Literal) {
                    throw new IllegalArgumentException("Adjacent literal parts must be joined, use AttributeValue.of()");
                }
            }
        }
    }

    /**
     * @param text The literal text.
     * @return A static value.
     */
    static AttributeValue ofStatic(String text) {
        return new Static(text);
    }

    /**
     * @param output The expression.
     * @return An output value.
     */
    static AttributeValue ofOutput(OutputNode output) {
        return new Output(output);
    }

    /**
     * Builds the simplest value for an ordered list of parts: adjacent literals are joined, empty
     * literals dropped, a single literal becomes {@link Static}, a single expression {@link Output},
     * and no parts at all an empty {@link Static}.
     *
     * @param parts The parts.
     * @return The normalized value.
     */
    static AttributeValue of(List<AttributePart> parts) {
        List<AttributePart> normalized = new ArrayList<>();
        for (AttributePart part : parts) {
            if (part instanceof AttributePart.Literal literal) {
                if (literal.text().isEmpty()) {
                    continue;
                }
                int last = normalized.size() - 1;
                if (last >= 0 && normalized.get(last) instanceof AttributePart.Literal previous) {
                    normalized.set(last, new AttributePart.Literal(previous.text() + literal.text()));
                    continue;
                }
            }
            normalized.add(part);
        }
        if (normalized.isEmpty()) {
            return new Static("");
        }
        if (normalized.size() == 1) {
            AttributePart only = normalized.get(0);
            if (only instanceof AttributePart.Literal literal) {
                return new Static(literal.text());
            }
            return new Output(((AttributePart.Dynamic) only).output());
        }
        return new Parts(normalized);
    }

    /**
     * @return The value as parts; a boolean value has none.
     */
    default List<AttributePart> toParts() {
        if (this instanceof Static s) {
            return List.of(new AttributePart.Literal(s.text()));
        }
        if (this instanceof Output o) {
            return List.of(new AttributePart.Dynamic(o.output()));
        }
        if (this instanceof Parts p) {
            return p.parts();
        }
        return List.of();
    }

    /**
     * @param parts The replacement parts.
     * @return The normalized value built from the given parts.
     */
    default AttributeValue withParts(List<AttributePart> parts) {
        return of(parts);
    }

    /**
     * @param part The part to add at the end.
     * @return The normalized value with the part appended.
     */
    default AttributeValue append(AttributePart part) {
        List<AttributePart> parts = new ArrayList<>(toParts());
        parts.add(part);
        return of(parts);
    }

    default boolean isBoolean() {
        return this instanceof Bool;
    }

    default boolean isStatic() {
        return this instanceof Static;
    }

    default boolean isOutput() {
        return this instanceof Output;
    }

    default boolean isParts() {
        return this instanceof Parts;
    }
}
