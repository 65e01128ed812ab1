package org.tessera.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Groups nodes without rendering a wrapper tag. Carries directive attributes
 * ({@code <s-template s:if="...">}) and, for attribute directives, the attributes they emit.
 */
public final class FragmentNode extends ContainerNode {

    private final List<AttributeNode> attributes;

    /**
     * @param attributes The ordered attributes.
     * @param children The ordered children.
     * @param line The source line.
     * @param column The source column.
     */
    public FragmentNode(List<AttributeNode> attributes, List<AstNode> children, int line, int column) {
        super(children, line, column);
        this.attributes = new ArrayList<>(attributes);
    }

    public List<AttributeNode> getAttributes() {
        return attributes;
    }
}
