package org.tessera.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A reference to a component template ({@code <s-card>}), expanded by a later stage.
 */
public final class ComponentNode extends ContainerNode {

    private final String name;
    private final List<AttributeNode> attributes;

    /**
     * @param name The component name without the element prefix.
     * @param attributes The ordered attributes.
     * @param children The ordered children (slot content).
     * @param line The source line.
     * @param column The source column.
     */
    public ComponentNode(String name, List<AttributeNode> attributes, List<AstNode> children, int line, int column) {
        super(children, line, column);
        this.name = name;
        this.attributes = new ArrayList<>(attributes);
    }

    public String getName() {
        return name;
    }

    public List<AttributeNode> getAttributes() {
        return attributes;
    }

    /**
     * Creates a copy with other attributes and children.
     * @param newAttributes The attributes of the copy.
     * @param newChildren The children of the copy.
     * @return The copy.
     */
    public ComponentNode copy(List<AttributeNode> newAttributes, List<AstNode> newChildren) {
        return new ComponentNode(name, newAttributes, newChildren, getLine(), getColumn());
    }
}
