package org.tessera.compiler.frontend.parser.ast;

import java.util.List;
import java.util.Optional;

/**
 * A directive extracted from a directive attribute ({@code s:foreach="items as item"}).
 * <p>
 * The primary children are the nodes the directive controls. After pairing, a directive may be
 * linked to a sibling partner ({@code s:else}, {@code s:empty}, {@code s:finally}) whose children
 * form the alternate branch. Both links are non-owning; the partner stays in its parent's child
 * list, marked as consumed.
 */
public final class DirectiveNode extends ContainerNode {

    private final String name;
    private final String expression;
    private DirectiveNode pairedSibling;
    private DirectiveNode pairedPrimary;
    private boolean consumedByPairing;
    private ElementNode elementMetadata;

    /**
     * @param name The directive name without prefix.
     * @param expression The directive expression, {@code "true"} for boolean attributes.
     * @param children The primary children.
     * @param line The source line.
     * @param column The source column.
     */
    public DirectiveNode(String name, String expression, List<AstNode> children, int line, int column) {
        super(children, line, column);
        this.name = name;
        this.expression = expression;
    }

    public String getName() {
        return name;
    }

    public String getExpression() {
        return expression;
    }

    /**
     * @return The partner that follows this directive, if paired.
     */
    public Optional<DirectiveNode> getPairedSibling() {
        return Optional.ofNullable(pairedSibling);
    }

    /**
     * @return The directive this node is the partner of, if paired.
     */
    public Optional<DirectiveNode> getPairedPrimary() {
        return Optional.ofNullable(pairedPrimary);
    }

    /**
     * Links a partner to this directive in both directions and marks it consumed.
     * @param partner The following sibling directive.
     */
    public void pairWith(DirectiveNode partner) {
        this.pairedSibling = partner;
        partner.pairedPrimary = this;
        partner.consumedByPairing = true;
    }

    /**
     * @return The children of the paired partner, empty if unpaired.
     */
    public List<AstNode> getAlternateChildren() {
        return pairedSibling == null ? List.of() : pairedSibling.getChildren();
    }

    /**
     * @return {@code true} if another directive compiles this node as its alternate branch.
     */
    public boolean isConsumedByPairing() {
        return consumedByPairing;
    }

    /**
     * @return The host element captured by custom extraction, without its children.
     */
    public Optional<ElementNode> getElementMetadata() {
        return Optional.ofNullable(elementMetadata);
    }

    /**
     * @param element The captured host element.
     */
    public void setElementMetadata(ElementNode element) {
        this.elementMetadata = element;
    }
}
