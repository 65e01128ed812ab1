package org.tessera.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * An HTML element with a static tag name, or with a tag name held in a variable of the
 * generated code (see {@link #getDynamicTag()}).
 */
public final class ElementNode extends ContainerNode {

    private final String tag;
    private final String dynamicTag;
    private final List<AttributeNode> attributes;
    private final boolean selfClosing;

    /**
     * @param tag The tag name as written.
     * @param attributes The ordered attributes.
     * @param children The ordered children.
     * @param selfClosing Whether the element has no body and no closing tag.
     * @param line The source line.
     * @param column The source column.
     */
    public ElementNode(String tag, List<AttributeNode> attributes, List<AstNode> children,
                       boolean selfClosing, int line, int column) {
        this(tag, null, attributes, children, selfClosing, line, column);
    }

    private ElementNode(String tag, String dynamicTag, List<AttributeNode> attributes, List<AstNode> children,
                        boolean selfClosing, int line, int column) {
        super(children, line, column);
        this.tag = tag;
        this.dynamicTag = dynamicTag;
        this.attributes = new ArrayList<>(attributes);
        this.selfClosing = selfClosing;
    }

    public String getTag() {
        return tag;
    }

    /**
     * @return The name of the generated variable holding the tag name, if the tag is dynamic.
     */
    public Optional<String> getDynamicTag() {
        return Optional.ofNullable(dynamicTag);
    }

    public List<AttributeNode> getAttributes() {
        return attributes;
    }

    public boolean isSelfClosing() {
        return selfClosing;
    }

    /**
     * @param name An attribute name.
     * @return The first attribute with that name.
     */
    public Optional<AttributeNode> findAttribute(String name) {
        return attributes.stream().filter(a -> a.name().equals(name)).findFirst();
    }

    /**
     * Creates a copy with other attributes and children, keeping tag and position.
     * @param newAttributes The attributes of the copy.
     * @param newChildren The children of the copy.
     * @return The copy.
     */
    public ElementNode copy(List<AttributeNode> newAttributes, List<AstNode> newChildren) {
        return new ElementNode(tag, dynamicTag, newAttributes, newChildren, selfClosing, getLine(), getColumn());
    }

    /**
     * Creates a copy whose tag name is read from a variable of the generated code.
     * @param variable The variable name.
     * @return The copy.
     */
    public ElementNode withDynamicTag(String variable) {
        return new ElementNode(tag, variable, attributes, getChildren(), selfClosing, getLine(), getColumn());
    }
}
