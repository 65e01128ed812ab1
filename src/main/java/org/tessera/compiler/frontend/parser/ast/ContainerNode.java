package org.tessera.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A node that owns an ordered, replaceable list of children.
 */
public abstract class ContainerNode extends AstNode {

    private final List<AstNode> children;

    protected ContainerNode(List<AstNode> children, int line, int column) {
        super(line, column);
        this.children = new ArrayList<>(children);
    }

    @Override
    public List<AstNode> getChildren() {
        return children;
    }

    @Override
    public boolean isContainer() {
        return true;
    }

    /**
     * Replaces all children.
     * @param newChildren The new children, in order.
     */
    public void setChildren(List<AstNode> newChildren) {
        List<AstNode> copy = new ArrayList<>(newChildren);
        children.clear();
        children.addAll(copy);
    }
}
