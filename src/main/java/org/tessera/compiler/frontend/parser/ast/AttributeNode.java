package org.tessera.compiler.frontend.parser.ast;

/**
 * An attribute of an element, fragment or component.
 *
 * @param name The attribute name; the empty name marks a spread attribute whose output is
 *             written as a whole.
 * @param value The attribute value.
 * @param line The source line.
 * @param column The source column.
 */
public record AttributeNode(
        String name,
        AttributeValue value,
        int line,
        int column
) {
    /**
     * @return {@code true} for spread attributes.
     */
    public boolean isSpread() {
        return name.isEmpty();
    }

    /**
     * @param newValue The new value.
     * @return A copy with another value.
     */
    public AttributeNode withValue(AttributeValue newValue) {
        return new AttributeNode(name, newValue, line, column);
    }
}
